package com.insightplatform.engine.controller;

import com.insightplatform.common.exception.EngineException;
import com.insightplatform.engine.exception.InsightNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps engine errors to HTTP responses. Anything unmapped stays a 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InsightNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(InsightNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler({EngineException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        log.warn("Rejected request. reason={}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> unreadable(ServerWebInputException e) {
        log.warn("Unreadable request. reason={}", e.getReason());
        return body(HttpStatus.BAD_REQUEST, "invalid_request", e.getReason());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "timestamp", Instant.now().toString(),
            "status", status.value(),
            "error", error,
            "message", message != null ? message : status.getReasonPhrase()));
    }
}
