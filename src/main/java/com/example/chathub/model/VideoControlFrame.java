package com.example.chathub.model;

public final class VideoControlFrame extends InboundFrame {
    private final String rawAction;
    private final VideoAction action;  // null when rawAction is not recognised
    private final String videoName;
    private final Double videoTime;

    public VideoControlFrame(String rawAction, String videoName, Double videoTime, Long groupId) {
        super(groupId);
        this.rawAction = rawAction;
        this.action = VideoAction.fromWire(rawAction);
        this.videoName = videoName;
        this.videoTime = videoTime;
    }

    @Override
    public Type getType() { return Type.VIDEO_CONTROL; }

    public String getRawAction() { return rawAction; }
    public VideoAction getAction() { return action; }
    public String getVideoName() { return videoName; }
    public Double getVideoTime() { return videoTime; }
}
