package com.example.chathub.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small transient server frames that are never persisted.
 */
public final class Notices {

    private Notices() {}

    public static Map<String, Object> userLeft(long groupId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("type", "user_left");
        p.put("message", "User disconnected from group " + groupId);
        return p;
    }

    public static Map<String, Object> deliveryFailed(String text) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("type", "delivery_failed");
        p.put("text", text);
        p.put("message", "Message could not be saved and was not delivered");
        return p;
    }
}
