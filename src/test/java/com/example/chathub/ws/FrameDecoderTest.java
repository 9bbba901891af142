package com.example.chathub.ws;

import com.example.chathub.exception.MalformedFrameException;
import com.example.chathub.model.ChatFrame;
import com.example.chathub.model.InboundFrame;
import com.example.chathub.model.VideoAction;
import com.example.chathub.model.VideoControlFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FrameDecoderTest {

    private final FrameDecoder decoder = new FrameDecoder(new ObjectMapper());

    @Test
    void plainTextDefaultsToChat() {
        InboundFrame frame = decoder.decode("{\"text\":\"hi\"}");
        assertEquals(InboundFrame.Type.MESSAGE, frame.getType());
        assertEquals("hi", ((ChatFrame) frame).getText());
        assertNull(frame.getGroupId());
        assertEquals(7L, frame.groupIdOr(7));
    }

    @ParameterizedTest
    @ValueSource(strings = {"message", "add", "leave", "whatever"})
    void anyOtherDeclaredTypeIsForcedToChat(String type) {
        InboundFrame frame = decoder.decode("{\"text\":\"hi\",\"type\":\"" + type + "\"}");
        assertEquals(InboundFrame.Type.MESSAGE, frame.getType());
    }

    @Test
    void clientUserFieldIsNotCarried() {
        ChatFrame frame = (ChatFrame) decoder.decode("{\"text\":\"hi\",\"user\":\"mallory@x.com\",\"group_id\":3}");
        assertEquals("hi", frame.getText());
        assertEquals(3L, frame.getGroupId());
    }

    @Test
    void groupIdAcceptsNumericString() {
        assertEquals(12L, decoder.decode("{\"text\":\"hi\",\"group_id\":\"12\"}").getGroupId());
    }

    @Test
    void videoControlIsDecoded() {
        VideoControlFrame frame = (VideoControlFrame) decoder.decode(
                "{\"type\":\"video_control\",\"video_action\":\"seek\",\"video_time\":12.5}");
        assertEquals(VideoAction.SEEK, frame.getAction());
        assertEquals("seek", frame.getRawAction());
        assertEquals(12.5, frame.getVideoTime());
        assertNull(frame.getVideoName());
    }

    @Test
    void unknownVideoActionKeepsRawValue() {
        VideoControlFrame frame = (VideoControlFrame) decoder.decode(
                "{\"type\":\"video_control\",\"video_action\":\"rewind\"}");
        assertNull(frame.getAction());
        assertEquals("rewind", frame.getRawAction());
    }

    @Test
    void integerVideoTimeIsAccepted() {
        VideoControlFrame frame = (VideoControlFrame) decoder.decode(
                "{\"type\":\"video_control\",\"video_action\":\"pause\",\"video_time\":4}");
        assertEquals(4.0, frame.getVideoTime());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[1,2,3]",
            "\"hi\"",
            "{}",
            "{\"text\":42}",
            "{\"text\":\"hi\",\"group_id\":\"seven\"}",
            "{\"text\":\"hi\",\"group_id\":1.5}",
            "{\"type\":\"video_control\",\"video_action\":\"seek\",\"video_time\":\"soon\"}",
            "{\"type\":\"video_control\",\"video_action\":5}"
    })
    void malformedFramesAreRejected(String payload) {
        assertThrows(MalformedFrameException.class, () -> decoder.decode(payload));
    }
}
