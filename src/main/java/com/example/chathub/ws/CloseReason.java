package com.example.chathub.ws;

import org.springframework.web.socket.CloseStatus;

/**
 * Reasons a connection is refused before it joins a room. All map to 1008 (policy violation).
 */
public enum CloseReason {
    AUTHENTICATION_REQUIRED("Authentication token required"),
    AUTHORIZATION_DENIED("You are not a member of this group"),
    SERVICE_UNAVAILABLE("Authentication service unavailable");

    private final String defaultReason;

    CloseReason(String defaultReason) {
        this.defaultReason = defaultReason;
    }

    public String defaultReason() {
        return defaultReason;
    }

    public CloseStatus toCloseStatus(String detail) {
        String reason = (detail == null || detail.isBlank()) ? defaultReason : detail;
        return CloseStatus.POLICY_VIOLATION.withReason(reason);
    }
}
