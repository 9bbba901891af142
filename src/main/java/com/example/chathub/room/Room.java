package com.example.chathub.room;

import com.example.chathub.model.PlaybackState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one group's live room. The room exists while its reference count
 * (number of members) is above zero; playback state lives and dies with it.
 */
final class Room {
    private final long groupId;
    private final Map<String, Connection> members;
    private final PlaybackState playback;   // nullable

    private Room(long groupId, Map<String, Connection> members, PlaybackState playback) {
        this.groupId = groupId;
        this.members = members;
        this.playback = playback;
    }

    static Room open(long groupId, Connection first) {
        Map<String, Connection> m = new LinkedHashMap<>();
        m.put(first.getId(), first);
        return new Room(groupId, Collections.unmodifiableMap(m), null);
    }

    Room withMember(Connection connection) {
        if (members.containsKey(connection.getId())) return this;
        Map<String, Connection> m = new LinkedHashMap<>(members);
        m.put(connection.getId(), connection);
        return new Room(groupId, Collections.unmodifiableMap(m), playback);
    }

    /**
     * @return the room without the connection, or {@code null} when that drops the count to zero
     */
    Room withoutMember(Connection connection) {
        if (!members.containsKey(connection.getId())) return this;
        if (members.size() == 1) return null;
        Map<String, Connection> m = new LinkedHashMap<>(members);
        m.remove(connection.getId());
        return new Room(groupId, Collections.unmodifiableMap(m), playback);
    }

    Room withPlayback(PlaybackState state) {
        return new Room(groupId, members, state);
    }

    long groupId() { return groupId; }
    int refCount() { return members.size(); }
    boolean contains(Connection connection) { return members.containsKey(connection.getId()); }
    List<Connection> members() { return List.copyOf(members.values()); }
    PlaybackState playback() { return playback; }
}
