package com.example.chathub.api;

import com.example.chathub.model.VideoAction;
import com.example.chathub.room.FakeConnection;
import com.example.chathub.room.PlaybackStateMachine;
import com.example.chathub.room.RoomRegistry;
import com.example.chathub.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RoomApiControllerTest {

    private RoomRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        registry = new RoomRegistry(new PlaybackStateMachine(clock));
        mvc = MockMvcBuilders.standaloneSetup(new RoomApiController(registry))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsLiveRoomsByGroupId() throws Exception {
        registry.join(9, new FakeConnection("a"));
        registry.join(3, new FakeConnection("b"));
        registry.join(3, new FakeConnection("c"));

        mvc.perform(get("/api/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].group_id").value(3))
                .andExpect(jsonPath("$[0].connections").value(2))
                .andExpect(jsonPath("$[1].group_id").value(9));
    }

    @Test
    void showsPlaybackOfOneRoom() throws Exception {
        registry.join(3, new FakeConnection("a"));
        registry.updatePlaybackState(3, VideoAction.CHANGE_VIDEO, "intro.mp4", 0.0);
        registry.updatePlaybackState(3, VideoAction.PLAY, null, 12.5);

        mvc.perform(get("/api/rooms/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connections").value(1))
                .andExpect(jsonPath("$.playback.video_name").value("intro.mp4"))
                .andExpect(jsonPath("$.playback.video_time").value(12.5))
                .andExpect(jsonPath("$.playback.is_playing").value(true))
                .andExpect(jsonPath("$.playback.last_updated").value("2026-03-01T12:00:00Z"));
    }

    @Test
    void roomWithoutConnectionsIsNotFound() throws Exception {
        FakeConnection a = new FakeConnection("a");
        registry.join(3, a);
        registry.leave(3, a);

        mvc.perform(get("/api/rooms/3"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }
}
