package com.example.chathub.model;

import java.util.List;

public class MessageListResponse {
    private final List<ChatMessage> messages;

    public MessageListResponse(List<ChatMessage> messages) {
        this.messages = messages;
    }

    public List<ChatMessage> getMessages() { return messages; }
}
