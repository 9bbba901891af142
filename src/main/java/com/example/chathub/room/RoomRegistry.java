package com.example.chathub.room;

import com.example.chathub.model.PlaybackState;
import com.example.chathub.model.RoomOverview;
import com.example.chathub.model.VideoAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live rooms keyed by group id.
 *
 * <p>Mutations go through {@link ConcurrentMap#compute}, which serialises writers per group id.
 * Rooms are immutable snapshots, so readers never observe a half-applied update. A room is
 * removed, together with its playback state, in the same atomic step that drops its last member.
 */
@Component
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<Long, Room> rooms = new ConcurrentHashMap<>();
    private final PlaybackStateMachine stateMachine;

    public RoomRegistry(PlaybackStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    public void join(long groupId, Connection connection) {
        Room room = rooms.compute(groupId, (k, existing) ->
                existing == null ? Room.open(k, connection) : existing.withMember(connection));
        log.debug("joined. groupId={} connectionId={} members={}", groupId, connection.getId(), room.refCount());
    }

    /**
     * Idempotent. Drops the room and its playback state when the last member leaves.
     */
    public void leave(long groupId, Connection connection) {
        boolean[] closed = new boolean[1];
        rooms.computeIfPresent(groupId, (k, existing) -> {
            Room after = existing.withoutMember(connection);
            closed[0] = after == null;
            return after;
        });
        if (closed[0]) {
            log.info("room closed, playback state dropped. groupId={}", groupId);
        }
    }

    /**
     * Snapshot of the room's members; empty when there is no live room.
     */
    public List<Connection> broadcastTargets(long groupId) {
        Room room = rooms.get(groupId);
        return room == null ? List.of() : room.members();
    }

    public Optional<PlaybackState> getPlaybackState(long groupId) {
        Room room = rooms.get(groupId);
        return room == null ? Optional.empty() : Optional.ofNullable(room.playback());
    }

    /**
     * Applies a playback transition to the room. When no room is live the resulting state is
     * returned but not stored, since state is only kept while someone is watching.
     */
    public PlaybackState updatePlaybackState(long groupId, VideoAction action, String mediaId, Double position) {
        PlaybackState[] result = new PlaybackState[1];
        Room room = rooms.computeIfPresent(groupId, (k, existing) -> {
            PlaybackState next = stateMachine.apply(existing.playback(), action, mediaId, position);
            result[0] = next;
            return next == existing.playback() ? existing : existing.withPlayback(next);
        });
        if (room == null) {
            return stateMachine.apply(null, action, mediaId, position);
        }
        return result[0];
    }

    public boolean isLive(long groupId) {
        return rooms.containsKey(groupId);
    }

    public boolean contains(long groupId, Connection connection) {
        Room room = rooms.get(groupId);
        return room != null && room.contains(connection);
    }

    public int connectionCount(long groupId) {
        Room room = rooms.get(groupId);
        return room == null ? 0 : room.refCount();
    }

    public Optional<RoomOverview> overview(long groupId) {
        Room room = rooms.get(groupId);
        return room == null ? Optional.empty() : Optional.of(toOverview(room));
    }

    public List<RoomOverview> overview() {
        List<RoomOverview> out = new ArrayList<>();
        for (Room room : rooms.values()) {
            out.add(toOverview(room));
        }
        out.sort(Comparator.comparingLong(RoomOverview::getGroupId));
        return out;
    }

    private static RoomOverview toOverview(Room room) {
        PlaybackState state = room.playback();
        return new RoomOverview(room.groupId(), room.refCount(), state == null ? null : new RoomOverview.Playback(state));
    }
}
