package com.example.chathub.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RoomOverview {
    private final long groupId;
    private final int connections;
    private final Playback playback;

    public RoomOverview(long groupId, int connections, Playback playback) {
        this.groupId = groupId;
        this.connections = connections;
        this.playback = playback;
    }

    @JsonProperty("group_id")
    public long getGroupId() { return groupId; }
    public int getConnections() { return connections; }
    public Playback getPlayback() { return playback; }

    public static class Playback {
        private final String videoName;
        private final double videoTime;
        private final boolean playing;
        private final String lastUpdated;

        public Playback(PlaybackState state) {
            this.videoName = state.getMediaId();
            this.videoTime = state.getPosition();
            this.playing = state.isPlaying();
            this.lastUpdated = state.getLastUpdated().toString();
        }

        @JsonProperty("video_name")
        public String getVideoName() { return videoName; }

        @JsonProperty("video_time")
        public double getVideoTime() { return videoTime; }

        @JsonProperty("is_playing")
        public boolean isPlaying() { return playing; }

        @JsonProperty("last_updated")
        public String getLastUpdated() { return lastUpdated; }
    }
}
