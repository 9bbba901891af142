package com.example.chathub.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Ephemeral broadcast of a playback control action. Never persisted.
 */
@JsonPropertyOrder({"type", "user", "group_id", "video_action", "video_name", "video_time", "timestamp"})
public class VideoControlEcho {
    private final String user;
    private final long groupId;
    private final String videoAction;
    private final String videoName;
    private final Double videoTime;
    private final Instant timestamp;

    public VideoControlEcho(String user, long groupId, String videoAction, String videoName, Double videoTime, Instant timestamp) {
        this.user = user;
        this.groupId = groupId;
        this.videoAction = videoAction;
        this.videoName = videoName;
        this.videoTime = videoTime;
        this.timestamp = timestamp;
    }

    public static VideoControlEcho of(VideoControlFrame frame, String user, long groupId, Instant now) {
        return new VideoControlEcho(user, groupId, frame.getRawAction(), frame.getVideoName(), frame.getVideoTime(), now);
    }

    public String getType() { return MessageKind.EPHEMERAL_CONTROL.wire(); }

    public String getUser() { return user; }

    @JsonProperty("group_id")
    public long getGroupId() { return groupId; }

    @JsonProperty("video_action")
    public String getVideoAction() { return videoAction; }

    @JsonProperty("video_name")
    public String getVideoName() { return videoName; }

    @JsonProperty("video_time")
    public Double getVideoTime() { return videoTime; }

    public String getTimestamp() { return timestamp.toString(); }
}
