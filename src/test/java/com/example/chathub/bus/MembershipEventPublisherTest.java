package com.example.chathub.bus;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.model.MembershipEvent;
import com.example.chathub.room.PlaybackStateMachine;
import com.example.chathub.room.RoomRegistry;
import com.example.chathub.service.HistoryService;
import com.example.chathub.ws.Broadcaster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MembershipEventPublisherTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ChathubProperties properties = new ChathubProperties();
    private StringRedisTemplate redis;
    private MembershipEventPublisher publisher;

    @BeforeEach
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        publisher = new MembershipEventPublisher(redis, om, properties);
    }

    @Test
    void addGoesToAddChannel() throws Exception {
        publisher.publish(new MembershipEvent(MembershipEvent.Change.ADD, 7, "Bob added", "bob@x.com", "a@x.com"));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redis).convertAndSend(eq("added_to_group"), json.capture());

        JsonNode payload = om.readTree(json.getValue());
        assertEquals("add", payload.get("type").asText());
        assertEquals(7, payload.get("group_id").asLong());
        assertEquals("Bob added", payload.get("text").asText());
        assertEquals("bob@x.com", payload.get("user_email").asText());
        assertEquals("a@x.com", payload.get("actor").asText());
    }

    @Test
    void removeGoesToRemoveChannel() {
        publisher.publish(new MembershipEvent(MembershipEvent.Change.REMOVE, 7, "Bob removed", "bob@x.com", "a@x.com"));
        verify(redis).convertAndSend(eq("remove_from_group"), anyString());
    }

    @Test
    void publishedPayloadIsReadableByTheBridge() throws Exception {
        properties.getBus().setAddChannel("custom_add");
        publisher.publish(new MembershipEvent(MembershipEvent.Change.ADD, 3, "Eve added", "eve@x.com", "a@x.com"));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redis).convertAndSend(eq("custom_add"), json.capture());

        NotificationBridge bridge = new NotificationBridge(mock(RedisMessageListenerContainer.class), mock(HistoryService.class),
                new Broadcaster(new RoomRegistry(new PlaybackStateMachine(Clock.systemUTC())), om), om, properties);
        MembershipEvent parsed = bridge.parse("custom_add", json.getValue().getBytes(StandardCharsets.UTF_8));

        assertEquals(MembershipEvent.Change.ADD, parsed.getChange());
        assertEquals(3L, parsed.getGroupId());
        assertEquals("Eve added", parsed.getText());
        assertEquals("eve@x.com", parsed.getUserEmail());
        assertEquals("a@x.com", parsed.getActor());
    }
}
