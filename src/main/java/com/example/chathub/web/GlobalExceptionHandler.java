package com.example.chathub.web;

import com.example.chathub.exception.MessagePersistenceException;
import com.example.chathub.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler({UpstreamUnavailableException.class, MessagePersistenceException.class})
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(RuntimeException e) {
        log.error("store unavailable: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        String reason = (e.getReason() != null && !e.getReason().isBlank()) ? e.getReason() : e.getStatus().getReasonPhrase();
        return error(e.getStatus(), e.getStatus().name().toLowerCase(), reason);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
