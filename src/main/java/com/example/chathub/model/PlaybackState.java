package com.example.chathub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Shared playback view of one room. Immutable; every transition produces a new instance.
 */
public final class PlaybackState {
    private final String mediaId;      // nullable
    private final double position;     // seconds, >= 0
    private final boolean playing;
    private final Instant lastUpdated;

    public PlaybackState(String mediaId, double position, boolean playing, Instant lastUpdated) {
        this.mediaId = mediaId;
        this.position = Math.max(0.0, position);
        this.playing = playing;
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public String getMediaId() { return mediaId; }
    public double getPosition() { return position; }
    public boolean isPlaying() { return playing; }
    public Instant getLastUpdated() { return lastUpdated; }

    public boolean hasMedia() {
        return mediaId != null;
    }

    public boolean sameFieldsAs(PlaybackState other) {
        return other != null
                && Objects.equals(mediaId, other.mediaId)
                && Double.compare(position, other.position) == 0
                && playing == other.playing;
    }

    @Override
    public String toString() {
        return "PlaybackState{mediaId=" + mediaId + ", position=" + position + ", playing=" + playing + ", lastUpdated=" + lastUpdated + "}";
    }
}
