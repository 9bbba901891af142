package com.example.chathub.api;

import com.example.chathub.model.RoomOverview;
import com.example.chathub.room.RoomRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only view of live rooms (no auth, operators only).
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomApiController {

    private final RoomRegistry registry;

    public RoomApiController(RoomRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RoomOverview> rooms() {
        return registry.overview();
    }

    @GetMapping(value = "/{groupId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public RoomOverview room(@PathVariable long groupId) {
        return registry.overview(groupId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no live room for group " + groupId));
    }
}
