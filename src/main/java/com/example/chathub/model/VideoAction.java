package com.example.chathub.model;

public enum VideoAction {
    PLAY("play"),
    PAUSE("pause"),
    SEEK("seek"),
    CHANGE_VIDEO("change_video");

    private final String wire;

    VideoAction(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /**
     * @return the action, or {@code null} when the value is not a known action
     */
    public static VideoAction fromWire(String value) {
        if (value == null) return null;
        for (VideoAction action : values()) {
            if (action.wire.equals(value)) return action;
        }
        return null;
    }
}
