package com.example.chathub.api;

import com.example.chathub.model.MessageListResponse;
import com.example.chathub.service.HistoryService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
public class MessageApiController {

    private final HistoryService history;

    public MessageApiController(HistoryService history) {
        this.history = history;
    }

    /**
     * Recent history, newest first.
     * - group_id: optional, restricts to one group
     * - limit: defaults to 100, capped at chathub.history.max-limit
     */
    @GetMapping(value = "/messages", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageListResponse messages(
            @RequestParam(name = "group_id", required = false) Long groupId,
            @RequestParam(required = false) Integer limit
    ) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return new MessageListResponse(history.list(groupId, limit));
    }
}
