package com.example.chathub.persistence;

import javax.persistence.*;

@Entity
@Table(name = "chat_message", indexes = {
        @Index(name = "idx_chat_message_group_created", columnList = "groupId,createdAtEpochMs")
})
public class ChatMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Lob
    @Column(nullable = false)
    private String text;

    @Column(name = "author", length = 320, nullable = false)
    private String user;

    private Long groupId;

    @Column(length = 32, nullable = false)
    private String kind;

    private long createdAtEpochMs;

    private long updatedAtEpochMs;

    protected ChatMessageEntity() {}

    public ChatMessageEntity(String text, String user, Long groupId, String kind, long createdAtEpochMs, long updatedAtEpochMs) {
        this.text = text;
        this.user = user;
        this.groupId = groupId;
        this.kind = kind;
        this.createdAtEpochMs = createdAtEpochMs;
        this.updatedAtEpochMs = updatedAtEpochMs;
    }

    public Long getId() { return id; }
    public String getText() { return text; }
    public String getUser() { return user; }
    public Long getGroupId() { return groupId; }
    public String getKind() { return kind; }
    public long getCreatedAtEpochMs() { return createdAtEpochMs; }
    public long getUpdatedAtEpochMs() { return updatedAtEpochMs; }
}
