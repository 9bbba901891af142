package com.example.chathub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * A durably recorded chat or system message, as broadcast to rooms and returned by history.
 */
@JsonPropertyOrder({"_id", "text", "user", "group_id", "type", "created_at", "updated_at"})
public class ChatMessage {
    private final String id;
    private final String text;
    private final String user;
    private final Long groupId;
    private final MessageKind kind;
    private final Instant createdAt;
    private final Instant updatedAt;

    public ChatMessage(String id, String text, String user, Long groupId, MessageKind kind, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.text = text;
        this.user = user;
        this.groupId = groupId;
        this.kind = kind;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @JsonProperty("_id")
    public String getId() { return id; }

    public String getText() { return text; }

    public String getUser() { return user; }

    @JsonProperty("group_id")
    public Long getGroupId() { return groupId; }

    @JsonIgnore
    public MessageKind getKind() { return kind; }

    @JsonProperty("type")
    public String getType() { return kind.wire(); }

    @JsonIgnore
    public Instant getCreatedAt() { return createdAt; }

    @JsonIgnore
    public Instant getUpdatedAt() { return updatedAt; }

    @JsonProperty("created_at")
    public String getCreatedAtIso() { return createdAt.toString(); }

    @JsonProperty("updated_at")
    public String getUpdatedAtIso() { return updatedAt.toString(); }
}
