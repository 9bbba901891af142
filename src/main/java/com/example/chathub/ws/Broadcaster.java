package com.example.chathub.ws;

import com.example.chathub.room.Connection;
import com.example.chathub.room.RoomRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fan-out to every live connection of a room. A failed send disconnects only that recipient.
 */
@Component
public class Broadcaster {
    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final RoomRegistry registry;
    private final ObjectMapper objectMapper;

    public Broadcaster(RoomRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /**
     * @return number of connections the record was handed to
     */
    public int broadcast(Object record, long groupId) {
        List<Connection> targets = registry.broadcastTargets(groupId);
        if (targets.isEmpty()) return 0;

        String json = toJson(record);
        int delivered = 0;
        for (Connection target : targets) {
            if (deliver(target, json)) delivered++;
        }
        if (delivered < targets.size()) {
            log.warn("partial broadcast. groupId={} delivered={} targets={}", groupId, delivered, targets.size());
        }
        return delivered;
    }

    /**
     * Sends to a single connection, outside of any room fan-out.
     */
    public boolean sendTo(Connection target, Object record) {
        return deliver(target, toJson(record));
    }

    private boolean deliver(Connection target, String json) {
        try {
            target.send(json);
            return true;
        } catch (Exception e) {
            log.warn("send failed, disconnecting. connectionId={} error={}", target.getId(), e.toString());
            target.disconnect();
            return false;
        }
    }

    private String toJson(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("frame cannot be serialized: " + record.getClass().getSimpleName(), e);
        }
    }
}
