package me.golemcore.stdhuman.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the HTTP API, the MCP endpoint and the
 * Telegram webhook.
 */
@ControllerAdvice(basePackages = {
        "me.golemcore.stdhuman.adapter.inbound.web.controller",
        "me.golemcore.stdhuman.adapter.inbound.mcp",
        "me.golemcore.stdhuman.adapter.inbound.telegram"
})
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DecisionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDecision(DecisionException ex) {
        HttpStatus status = toHttpStatus(ex.getFailure());
        log.warn("[API] {} ({}): {}", status, ex.getFailure(), ex.getMessage());
        return Mono.just(error(status, ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    static HttpStatus toHttpStatus(DecisionFailure failure) {
        return switch (failure) {
        case CONFLICT -> HttpStatus.CONFLICT;
        case TIMEOUT -> HttpStatus.REQUEST_TIMEOUT;
        case DELIVERY_FAILED -> HttpStatus.BAD_GATEWAY;
        case DESTINATION_MISSING -> HttpStatus.BAD_REQUEST;
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case ABANDONED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
