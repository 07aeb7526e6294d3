package me.golemcore.stdhuman.adapter.inbound.web.controller;

import me.golemcore.stdhuman.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.stdhuman.domain.model.AskMode;
import me.golemcore.stdhuman.domain.model.AskResult;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.DecisionPoll;
import me.golemcore.stdhuman.domain.service.DecisionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class AskControllerWebTest {

    private DecisionService decisionService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        decisionService = mock(DecisionService.class);
        webTestClient = WebTestClient.bindToController(new AskController(decisionService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private WebTestClient.ResponseSpec ask(String json) {
        return webTestClient.post()
                .uri("/v1/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .exchange();
    }

    // ===== POST /v1/ask =====

    @Test
    void shouldReturnAnswerForSyncAsk() {
        when(decisionService.ask("Proceed?", List.of("Yes", "No"), AskMode.SYNC, Duration.ofSeconds(5)))
                .thenReturn(AskResult.answered("Yes"));

        ask("{\"question\":\"Proceed?\",\"options\":[\"Yes\",\"No\"],\"timeout\":5}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("Yes")
                .jsonPath("$.request_id").doesNotExist()
                .jsonPath("$.status").doesNotExist();
    }

    @Test
    void shouldReturnRequestIdForAsyncAsk() {
        when(decisionService.ask(eq("Ping"), anyList(), eq(AskMode.ASYNC), isNull()))
                .thenReturn(AskResult.pending("R-1"));

        ask("{\"question\":\"Ping\",\"mode\":\"async\"}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.request_id").isEqualTo("R-1")
                .jsonPath("$.status").isEqualTo("pending")
                .jsonPath("$.answer").doesNotExist();
    }

    @Test
    void shouldMapConflictTo409() {
        when(decisionService.ask(any(), anyList(), any(), any()))
                .thenThrow(new DecisionException(DecisionFailure.CONFLICT, "pending decision already exists"));

        ask("{\"question\":\"Second\",\"mode\":\"async\"}")
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.status").isEqualTo(409)
                .jsonPath("$.message").isEqualTo("pending decision already exists");
    }

    @Test
    void shouldMapTimeoutTo408() {
        when(decisionService.ask(any(), anyList(), any(), any()))
                .thenThrow(new DecisionException(DecisionFailure.TIMEOUT, "timeout waiting for human response"));

        ask("{\"question\":\"Proceed?\",\"timeout\":0.05}")
                .expectStatus().isEqualTo(408)
                .expectBody()
                .jsonPath("$.message").isEqualTo("timeout waiting for human response");
    }

    @Test
    void shouldMapDeliveryFailureTo502() {
        when(decisionService.ask(any(), anyList(), any(), any()))
                .thenThrow(new DecisionException(DecisionFailure.DELIVERY_FAILED, "telegram send failed"));

        ask("{\"question\":\"Proceed?\"}")
                .expectStatus().isEqualTo(502);
    }

    @Test
    void shouldRejectUnknownMode() {
        ask("{\"question\":\"Proceed?\",\"mode\":\"later\"}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("mode must be 'sync' or 'async'");

        verifyNoInteractions(decisionService);
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        ask("{\"question\":\"Proceed?\",\"timeout\":0}")
                .expectStatus().isBadRequest();
    }

    // ===== GET /v1/ask/result/{id} =====

    @Test
    void shouldReturnPendingStatus() {
        when(decisionService.poll("R-1")).thenReturn(DecisionPoll.pending());

        webTestClient.get().uri("/v1/ask/result/R-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("pending")
                .jsonPath("$.answer").doesNotExist();
    }

    @Test
    void shouldReturnRecordedAnswer() {
        when(decisionService.poll("R-1")).thenReturn(DecisionPoll.answered("pong"));

        webTestClient.get().uri("/v1/ask/result/R-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("pong");
    }

    @Test
    void shouldReturn404ForUnknownId() {
        when(decisionService.poll("nope")).thenReturn(DecisionPoll.notFound());

        webTestClient.get().uri("/v1/ask/result/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("request not found");
    }
}
