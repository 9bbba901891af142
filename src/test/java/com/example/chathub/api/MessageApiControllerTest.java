package com.example.chathub.api;

import com.example.chathub.exception.UpstreamUnavailableException;
import com.example.chathub.model.ChatMessage;
import com.example.chathub.model.MessageKind;
import com.example.chathub.service.HistoryService;
import com.example.chathub.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MessageApiControllerTest {

    private static final Instant T = Instant.parse("2026-03-01T12:00:00Z");

    private HistoryService history;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        history = mock(HistoryService.class);
        mvc = MockMvcBuilders.standaloneSetup(new MessageApiController(history))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsMessagesNewestFirst() throws Exception {
        when(history.list(7L, 2)).thenReturn(List.of(
                new ChatMessage("2", "Bob added", "system", 7L, MessageKind.SYSTEM_ADD, T.plusSeconds(1), T.plusSeconds(1)),
                new ChatMessage("1", "hi", "alice@x.com", 7L, MessageKind.MESSAGE, T, T)));

        mvc.perform(get("/messages").param("group_id", "7").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.messages[0]._id").value("2"))
                .andExpect(jsonPath("$.messages[0].type").value("add"))
                .andExpect(jsonPath("$.messages[1].user").value("alice@x.com"))
                .andExpect(jsonPath("$.messages[1].group_id").value(7))
                .andExpect(jsonPath("$.messages[1].created_at").value("2026-03-01T12:00:00Z"));
    }

    @Test
    void parametersAreOptional() throws Exception {
        when(history.list(isNull(), isNull())).thenReturn(List.of());

        mvc.perform(get("/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages.length()").value(0));
    }

    @Test
    void nonPositiveLimitIsBadRequest() throws Exception {
        mvc.perform(get("/messages").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
        verifyNoInteractions(history);
    }

    @Test
    void storeOutageIsServiceUnavailable() throws Exception {
        when(history.list(any(), any())).thenThrow(new UpstreamUnavailableException("message store unavailable"));

        mvc.perform(get("/messages").param("group_id", "7"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("store_unavailable"));
    }
}
