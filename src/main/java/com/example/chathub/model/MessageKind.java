package com.example.chathub.model;

/**
 * Kind of a chat record. The wire value is what clients see in the {@code type} field.
 */
public enum MessageKind {
    MESSAGE("message"),
    SYSTEM_ADD("add"),
    SYSTEM_REMOVE("leave"),
    // never persisted
    EPHEMERAL_CONTROL("video_control");

    private final String wire;

    MessageKind(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public boolean isPersistent() {
        return this != EPHEMERAL_CONTROL;
    }

    public static MessageKind fromWire(String value) {
        for (MessageKind kind : values()) {
            if (kind.wire.equals(value)) return kind;
        }
        throw new IllegalArgumentException("unknown message kind: " + value);
    }
}
