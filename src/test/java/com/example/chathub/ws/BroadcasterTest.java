package com.example.chathub.ws;

import com.example.chathub.model.Notices;
import com.example.chathub.room.FakeConnection;
import com.example.chathub.room.PlaybackStateMachine;
import com.example.chathub.room.RoomRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class BroadcasterTest {

    private final ObjectMapper om = new ObjectMapper();
    private RoomRegistry registry;
    private Broadcaster broadcaster;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry(new PlaybackStateMachine(Clock.systemUTC()));
        broadcaster = new Broadcaster(registry, om);
    }

    @Test
    void deliversToEveryMember() throws Exception {
        FakeConnection a = new FakeConnection("a");
        FakeConnection b = new FakeConnection("b");
        registry.join(7, a);
        registry.join(7, b);

        int delivered = broadcaster.broadcast(Notices.userLeft(7), 7);

        assertEquals(2, delivered);
        JsonNode frame = om.readTree(a.received().get(0));
        assertEquals("user_left", frame.get("type").asText());
        assertEquals(a.received(), b.received());
    }

    @Test
    void failingRecipientDoesNotBlockOthers() {
        FakeConnection first = new FakeConnection("first");
        FakeConnection broken = new FakeConnection("broken").failing();
        FakeConnection last = new FakeConnection("last");
        registry.join(7, first);
        registry.join(7, broken);
        registry.join(7, last);

        int delivered = broadcaster.broadcast(Notices.userLeft(7), 7);

        assertEquals(2, delivered);
        assertEquals(1, first.received().size());
        assertEquals(1, last.received().size());
        assertTrue(broken.received().isEmpty());
        assertEquals(1, broken.disconnectCount());
        assertEquals(0, first.disconnectCount());
        assertEquals(0, last.disconnectCount());
    }

    @Test
    void otherRoomsAreNotTouched() {
        FakeConnection inRoom = new FakeConnection("in");
        FakeConnection elsewhere = new FakeConnection("out");
        registry.join(7, inRoom);
        registry.join(8, elsewhere);

        broadcaster.broadcast(Notices.userLeft(7), 7);

        assertEquals(1, inRoom.received().size());
        assertTrue(elsewhere.received().isEmpty());
    }

    @Test
    void emptyRoomDeliversNothing() {
        assertEquals(0, broadcaster.broadcast(Notices.userLeft(42), 42));
    }

    @Test
    void sendToReportsFailure() {
        FakeConnection broken = new FakeConnection("broken").failing();
        assertFalse(broadcaster.sendTo(broken, Notices.userLeft(1)));
        assertEquals(1, broken.disconnectCount());
    }
}
