package com.example.chathub.ws;

import com.example.chathub.exception.MalformedFrameException;
import com.example.chathub.model.ChatFrame;
import com.example.chathub.model.InboundFrame;
import com.example.chathub.model.VideoControlFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Turns raw client text into a typed frame. Anything other than {@code video_control} is a chat
 * message, whatever type the client declared.
 */
@Component
public class FrameDecoder {

    static final String TYPE_VIDEO_CONTROL = "video_control";

    private final ObjectMapper objectMapper;

    public FrameDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboundFrame decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("not valid json", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("frame must be a json object");
        }

        Long groupId = readGroupId(root.get("group_id"));
        String type = root.path("type").asText("message");

        if (TYPE_VIDEO_CONTROL.equals(type)) {
            return new VideoControlFrame(
                    textOrNull(root.get("video_action")),
                    textOrNull(root.get("video_name")),
                    readSeconds(root.get("video_time")),
                    groupId);
        }

        JsonNode text = root.get("text");
        if (text == null || !text.isTextual()) {
            throw new MalformedFrameException("text is required");
        }
        return new ChatFrame(text.asText(), groupId);
    }

    private static Long readGroupId(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.canConvertToExactIntegral() && node.canConvertToLong()) return node.asLong();
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedFrameException("group_id must be an integer", e);
            }
        }
        throw new MalformedFrameException("group_id must be an integer");
    }

    private static Double readSeconds(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        throw new MalformedFrameException("video_time must be a number");
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) throw new MalformedFrameException("expected a string, got " + node.getNodeType());
        return node.asText();
    }
}
