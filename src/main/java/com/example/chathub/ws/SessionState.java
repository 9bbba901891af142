package com.example.chathub.ws;

public enum SessionState {
    CONNECTING,
    AUTHORIZING,
    JOINED,
    ACTIVE,
    CLOSED;

    boolean isInRoom() {
        return this == JOINED || this == ACTIVE;
    }
}
