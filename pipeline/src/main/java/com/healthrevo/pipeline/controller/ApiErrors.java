package com.healthrevo.pipeline.controller;

import com.healthrevo.decision.exception.AlertAlreadyAcknowledgedException;
import com.healthrevo.decision.exception.InvariantViolationException;
import com.healthrevo.pipeline.dto.ErrorResponse;
import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Maps failures to {@link ErrorResponse} bodies so no raw exception reaches a client.
 */
final class ApiErrors {

    private static final Logger logger = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {
    }

    static Mono<ResponseEntity<Object>> toResponse(String action, Throwable error) {
        HttpStatus status;
        boolean retryable = false;
        String message = error.getMessage();
        if (error instanceof ResponseStatusException rse) {
            status = HttpStatus.valueOf(rse.getStatusCode().value());
            message = rse.getReason();
        } else if (error instanceof AlertAlreadyAcknowledgedException) {
            status = HttpStatus.CONFLICT;
        } else if (error instanceof InvariantViolationException) {
            status = HttpStatus.CONFLICT;
            retryable = true;
        } else if (error instanceof UpstreamUnavailableException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
            retryable = true;
        } else if (error instanceof IllegalArgumentException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = "Internal error while trying to " + action;
        }

        if (status.is5xxServerError()) {
            logger.error("Error trying to {}: {}", action, error.getMessage(), error);
        } else {
            logger.warn("Rejected request to {}: {}", action, error.getMessage());
        }
        ErrorResponse body = new ErrorResponse(message, status.value(), Instant.now().toString(), retryable);
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
