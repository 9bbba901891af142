package com.example.chathub.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One-shot snapshot of the room's playback, sent only to a newly joined connection.
 */
@JsonPropertyOrder({"type", "video_name", "video_time", "is_playing", "message"})
public class VideoSyncFrame {
    private final String videoName;
    private final double videoTime;
    private final boolean playing;

    public VideoSyncFrame(String videoName, double videoTime, boolean playing) {
        this.videoName = videoName;
        this.videoTime = videoTime;
        this.playing = playing;
    }

    public static VideoSyncFrame of(PlaybackState state) {
        return new VideoSyncFrame(state.getMediaId(), state.getPosition(), state.isPlaying());
    }

    public String getType() { return "video_sync"; }

    @JsonProperty("video_name")
    public String getVideoName() { return videoName; }

    @JsonProperty("video_time")
    public double getVideoTime() { return videoTime; }

    @JsonProperty("is_playing")
    public boolean isPlaying() { return playing; }

    public String getMessage() { return "Syncing with current video playback"; }
}
