package com.example.chathub.model;

import java.util.Objects;

/**
 * A message that has not been stored yet.
 */
public class NewMessage {
    private final String text;
    private final String user;
    private final Long groupId;
    private final MessageKind kind;

    public NewMessage(String text, String user, Long groupId, MessageKind kind) {
        this.text = Objects.requireNonNull(text, "text");
        this.user = Objects.requireNonNull(user, "user");
        this.groupId = groupId;
        this.kind = Objects.requireNonNull(kind, "kind");
        if (!kind.isPersistent()) {
            throw new IllegalArgumentException("kind is not persistent: " + kind);
        }
    }

    public static NewMessage chat(String text, String user, Long groupId) {
        return new NewMessage(text, user, groupId, MessageKind.MESSAGE);
    }

    public String getText() { return text; }
    public String getUser() { return user; }
    public Long getGroupId() { return groupId; }
    public MessageKind getKind() { return kind; }
}
