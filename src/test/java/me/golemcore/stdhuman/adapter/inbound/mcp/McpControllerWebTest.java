package me.golemcore.stdhuman.adapter.inbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.stdhuman.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.stdhuman.domain.service.DecisionService;
import me.golemcore.stdhuman.domain.service.MissionService;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class McpControllerWebTest {

    private static final String TOOLS_LIST = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}";

    private McpRequestHandler requestHandler;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        StdHumanProperties properties = new StdHumanProperties();
        properties.getMcp().setKeepAliveSeconds(1);
        requestHandler = spy(new McpRequestHandler(mock(MissionService.class), mock(DecisionService.class),
                objectMapper, properties));
        webTestClient = WebTestClient.bindToController(new McpController(requestHandler, objectMapper, properties))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ===== POST =====

    @Test
    void shouldAnswerRequestAsJson() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(TOOLS_LIST)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(1)
                .jsonPath("$.result.tools.length()").isEqualTo(4);
    }

    @Test
    void shouldAnswerRequestAsEventStream() {
        Flux<ServerSentEvent<String>> events = webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(TOOLS_LIST)
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .getResponseBody();

        StepVerifier.create(events.filter(event -> event.data() != null).take(1))
                .assertNext(event -> assertTrue(event.data().contains("\"tools\"")))
                .verifyComplete();
    }

    @Test
    void shouldAcknowledgeInitializedNotification() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")
                .exchange()
                .expectStatus().isAccepted();

        assertTrue(requestHandler.isReady());
        verify(requestHandler, never()).handle(any());
    }

    @Test
    void shouldAcknowledgeClientResponse() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":{}}")
                .exchange()
                .expectStatus().isAccepted();
    }

    @Test
    void shouldRejectForeignOrigin() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Origin", "https://evil.example")
                .bodyValue(TOOLS_LIST)
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.message").isEqualTo("origin not allowed");
    }

    @Test
    void shouldAcceptLocalOrigin() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header("Origin", "http://localhost:3000")
                .bodyValue(TOOLS_LIST)
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void shouldRejectUnsupportedProtocolVersion() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .header(McpController.PROTOCOL_VERSION_HEADER, "2020-01-01")
                .bodyValue(TOOLS_LIST)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldRejectPayloadWithoutJsonRpcVersion() {
        webTestClient.post().uri("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"id\":1,\"method\":\"tools/list\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("invalid JSON-RPC payload");
    }

    // ===== GET =====

    @Test
    void shouldRefuseStreamWithoutEventStreamAccept() {
        webTestClient.get().uri("/mcp")
                .accept(MediaType.APPLICATION_JSON)
                .exchange()
                .expectStatus().isEqualTo(405);
    }

    @Test
    void shouldSendSingleKeepAliveWhenOnce() {
        Flux<ServerSentEvent<String>> events = webTestClient.get().uri("/mcp?once=true")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("Cache-Control", "no-cache")
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .getResponseBody();

        StepVerifier.create(events)
                .assertNext(event -> assertEquals("keep-alive", event.comment()))
                .verifyComplete();
    }

    // ===== helpers =====

    @Test
    void shouldClassifyMessages() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertTrue(McpController.isNotificationOrResponse(mapper.readTree("{\"method\":\"x\"}")));
        assertTrue(McpController.isNotificationOrResponse(mapper.readTree("{\"method\":\"x\",\"id\":null}")));
        assertFalse(McpController.isNotificationOrResponse(mapper.readTree("{\"method\":\"x\",\"id\":0}")));
        assertTrue(McpController.isNotificationOrResponse(mapper.readTree("{\"id\":3,\"error\":{}}")));
        assertFalse(McpController.isNotificationOrResponse(mapper.readTree("{\"id\":3}")));
    }

    @Test
    void shouldAllowOnlyLocalOrigins() {
        assertTrue(McpController.isAllowedOrigin("null"));
        assertTrue(McpController.isAllowedOrigin("http://127.0.0.1:8080"));
        assertTrue(McpController.isAllowedOrigin("https://LOCALHOST"));
        assertFalse(McpController.isAllowedOrigin("file://localhost"));
        assertFalse(McpController.isAllowedOrigin("http://192.168.1.5"));
        assertFalse(McpController.isAllowedOrigin("not a uri"));
    }
}
