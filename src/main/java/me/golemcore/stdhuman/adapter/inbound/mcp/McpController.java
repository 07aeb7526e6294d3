package me.golemcore.stdhuman.adapter.inbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * MCP streamable HTTP endpoint.
 *
 * <p>
 * {@code POST /mcp} takes one JSON-RPC message. Requests are answered with the
 * JSON-RPC response, as plain JSON or, when the client prefers
 * {@code text/event-stream}, as an SSE stream of keep-alive comments followed by
 * a single data event. Notifications and client responses get 202.
 *
 * <p>
 * {@code GET /mcp} opens a keep-alive stream for clients that listen for server
 * messages.
 *
 * <p>
 * Only local origins are accepted.
 */
@RestController
@RequestMapping("/mcp")
@Slf4j
public class McpController {

    static final String PROTOCOL_VERSION_HEADER = "MCP-Protocol-Version";
    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1");
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes");
    private static final ServerSentEvent<String> KEEP_ALIVE = ServerSentEvent.<String>builder()
            .comment("keep-alive")
            .build();

    private final McpRequestHandler requestHandler;
    private final ObjectMapper objectMapper;
    private final StdHumanProperties properties;

    public McpController(McpRequestHandler requestHandler, ObjectMapper objectMapper,
            StdHumanProperties properties) {
        this.requestHandler = requestHandler;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> post(@RequestBody JsonNode payload,
            @RequestHeader HttpHeaders headers) {
        validateHeaders(headers);
        validatePayload(payload);
        if (isNotificationOrResponse(payload)) {
            acknowledge(payload);
            return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).build());
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(requestHandler.handle(payload)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<String>>> postStreaming(@RequestBody JsonNode payload,
            @RequestHeader HttpHeaders headers) {
        validateHeaders(headers);
        validatePayload(payload);
        if (isNotificationOrResponse(payload)) {
            acknowledge(payload);
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }

        Mono<String> result = Mono.fromCallable(() -> toJson(requestHandler.handle(payload)))
                .subscribeOn(Schedulers.boundedElastic())
                .cache();
        Flux<ServerSentEvent<String>> keepAlive = Flux.interval(keepAliveInterval())
                .map(tick -> KEEP_ALIVE)
                .takeUntilOther(result);
        Flux<ServerSentEvent<String>> events = keepAlive
                .concatWith(result.map(json -> ServerSentEvent.builder(json).build()));
        return streaming(events);
    }

    @GetMapping
    public ResponseEntity<Flux<ServerSentEvent<String>>> stream(@RequestHeader HttpHeaders headers,
            @RequestParam(value = "once", required = false) String once) {
        validateHeaders(headers);
        if (!acceptsEventStream(headers)) {
            return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).build();
        }
        if (once != null && TRUTHY.contains(once.toLowerCase(Locale.ROOT))) {
            return streaming(Flux.just(KEEP_ALIVE));
        }
        return streaming(Flux.interval(Duration.ZERO, keepAliveInterval()).map(tick -> KEEP_ALIVE));
    }

    private ResponseEntity<Flux<ServerSentEvent<String>>> streaming(Flux<ServerSentEvent<String>> events) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header("X-Accel-Buffering", "no")
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(events);
    }

    private void acknowledge(JsonNode payload) {
        if ("notifications/initialized".equals(payload.path("method").asText())) {
            requestHandler.markReady();
        }
    }

    private Duration keepAliveInterval() {
        return Duration.ofSeconds(Math.max(1, properties.getMcp().getKeepAliveSeconds()));
    }

    private String toJson(Map<String, Object> response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void validateHeaders(HttpHeaders headers) {
        String origin = headers.getOrigin();
        if (origin != null && !isAllowedOrigin(origin)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "origin not allowed");
        }
        String protocolVersion = headers.getFirst(PROTOCOL_VERSION_HEADER);
        if (protocolVersion != null && !McpRequestHandler.SUPPORTED_PROTOCOL_VERSIONS.contains(protocolVersion)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unsupported MCP protocol version");
        }
    }

    static boolean isAllowedOrigin(String origin) {
        String trimmed = origin.strip();
        if ("null".equalsIgnoreCase(trimmed)) {
            return true;
        }
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return false;
            }
            String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
            return ("http".equals(normalizedScheme) || "https".equals(normalizedScheme))
                    && LOCAL_HOSTS.contains(host.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void validatePayload(JsonNode payload) {
        if (payload == null || !payload.isObject() || !payload.path("jsonrpc").isTextual()
                || !McpRequestHandler.JSONRPC_VERSION.equals(payload.path("jsonrpc").asText())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "invalid JSON-RPC payload");
        }
    }

    static boolean isNotificationOrResponse(JsonNode payload) {
        JsonNode id = payload.get("id");
        boolean hasId = id != null && !id.isNull();
        if (payload.has("method")) {
            return !hasId;
        }
        return hasId && (payload.has("result") || payload.has("error"));
    }

    private static boolean acceptsEventStream(HttpHeaders headers) {
        String accept = headers.getFirst(HttpHeaders.ACCEPT);
        return accept != null && accept.toLowerCase(Locale.ROOT).contains(MediaType.TEXT_EVENT_STREAM_VALUE);
    }
}
