package com.example.chathub.model;

/**
 * A client frame decoded once at the socket boundary. Client supplied {@code user} values
 * are never carried; the author is always the authenticated session identity.
 */
public abstract class InboundFrame {

    public enum Type { MESSAGE, VIDEO_CONTROL }

    private final Long groupId;

    protected InboundFrame(Long groupId) {
        this.groupId = groupId;
    }

    public abstract Type getType();

    /** Group id declared by the client, or {@code null} when absent. */
    public Long getGroupId() { return groupId; }

    public long groupIdOr(long sessionGroupId) {
        return groupId != null ? groupId : sessionGroupId;
    }
}
