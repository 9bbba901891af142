package com.example.chathub.model;

public final class ChatFrame extends InboundFrame {
    private final String text;

    public ChatFrame(String text, Long groupId) {
        super(groupId);
        this.text = text;
    }

    @Override
    public Type getType() { return Type.MESSAGE; }

    public String getText() { return text; }
}
