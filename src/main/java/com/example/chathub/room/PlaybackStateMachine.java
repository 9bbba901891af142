package com.example.chathub.room;

import com.example.chathub.model.PlaybackState;
import com.example.chathub.model.VideoAction;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Transition table for shared playback. No I/O; last-writer-wins on every field.
 *
 * <pre>
 *   play          playing=true,  position/media updated when given
 *   pause         playing=false, position updated when given
 *   seek          position updated when given
 *   change_video  media=given, position=given or 0, playing kept (false if new)
 *   unknown       no-op
 * </pre>
 */
@Component
public class PlaybackStateMachine {

    private final Clock clock;

    public PlaybackStateMachine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param current  state before the transition, or {@code null} if the room has none
     * @param action   recognised action, or {@code null} for an unknown one
     * @param mediaId  optional media identifier
     * @param position optional position in seconds
     * @return the new state; {@code current} unchanged for unknown actions or a change_video without media
     */
    public PlaybackState apply(PlaybackState current, VideoAction action, String mediaId, Double position) {
        if (action == null) return current;

        String media = current == null ? null : current.getMediaId();
        double pos = current == null ? 0.0 : current.getPosition();
        boolean playing = current != null && current.isPlaying();

        switch (action) {
            case PLAY:
                playing = true;
                if (position != null) pos = position;
                if (mediaId != null && !mediaId.isEmpty()) media = mediaId;
                break;
            case PAUSE:
                playing = false;
                if (position != null) pos = position;
                break;
            case SEEK:
                if (position != null) pos = position;
                break;
            case CHANGE_VIDEO:
                if (mediaId == null || mediaId.isEmpty()) return current;
                media = mediaId;
                pos = position != null ? position : 0.0;
                break;
            default:
                return current;
        }

        return new PlaybackState(media, sanitize(pos), playing, Instant.now(clock));
    }

    private static double sanitize(double position) {
        if (Double.isNaN(position) || Double.isInfinite(position)) return 0.0;
        return Math.max(0.0, position);
    }
}
