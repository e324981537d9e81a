package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.dto.ErrorResponse;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.ShoppingAssistantException;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Renders failures as {@link ErrorResponse} bodies with a status derived from the error kind.
 */
@RestControllerAdvice
class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ToolInvocationException.class)
    ResponseEntity<ErrorResponse> handleToolFailure(ToolInvocationException e) {
        // unknown tools and resources are client mistakes, the rest is upstream trouble
        HttpStatus status = e.getCode() == ToolErrorCode.NOT_FOUND ? HttpStatus.NOT_FOUND : statusFor(e.getKind());
        log.warn("Tool invocation failed ({}): {}", e.getCode(), e.getMessage());
        return body(status, e.getKind(), e.getMessage());
    }

    @ExceptionHandler(ShoppingAssistantException.class)
    ResponseEntity<ErrorResponse> handleAssistantFailure(ShoppingAssistantException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getKind(), e.getMessage());
        } else {
            log.info("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        return body(status, e.getKind(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.info("Bad request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST, e.getMessage());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case HANDLER_UNAVAILABLE -> HttpStatus.NOT_FOUND;
            case INVALID_SESSION_STATE -> HttpStatus.CONFLICT;
            case INVALID_REQUEST, CLASSIFICATION_AMBIGUOUS -> HttpStatus.BAD_REQUEST;
            case HANDLER_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_INVOCATION_ERROR -> HttpStatus.BAD_GATEWAY;
            case NO_CAPABLE_HANDLER, RETRY_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.getReasonPhrase(), kind, message, clock.instant()));
    }
}
