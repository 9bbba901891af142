package com.example.chathub.ws;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.exception.AuthorizationDeniedException;
import com.example.chathub.exception.MalformedFrameException;
import com.example.chathub.exception.MessagePersistenceException;
import com.example.chathub.exception.UpstreamUnavailableException;
import com.example.chathub.identity.IdentityClient;
import com.example.chathub.model.ChatFrame;
import com.example.chathub.model.ChatMessage;
import com.example.chathub.model.IdentityGrant;
import com.example.chathub.model.InboundFrame;
import com.example.chathub.model.NewMessage;
import com.example.chathub.model.Notices;
import com.example.chathub.model.PlaybackState;
import com.example.chathub.model.VideoControlEcho;
import com.example.chathub.model.VideoControlFrame;
import com.example.chathub.model.VideoSyncFrame;
import com.example.chathub.room.Connection;
import com.example.chathub.room.RoomRegistry;
import com.example.chathub.service.HistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted socket, from authorization through room membership to close.
 *
 * <p>State runs {@code CONNECTING -> AUTHORIZING -> JOINED -> ACTIVE -> CLOSED}; CLOSED is reachable
 * from any state. Room membership is released exactly once, whichever of remote close, transport
 * error or failed send gets there first.
 *
 * <p>Room broadcasts that arrive after the join but before the playback sync has been written
 * are held back and flushed right after it, so a joiner always sees {@code video_sync} first.
 */
public class ConnectionSession implements Connection {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    private final WebSocketSession socket;
    private final long groupId;
    private final String credential;

    private final IdentityClient identityClient;
    private final RoomRegistry registry;
    private final Broadcaster broadcaster;
    private final HistoryService history;
    private final FrameDecoder decoder;
    private final ChathubProperties.Chat chatProps;
    private final Clock clock;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile String identity;

    // room traffic received between join and the playback sync; null once flushed
    private final Object heldLock = new Object();
    private List<String> held = new ArrayList<>();

    // writes straight to the socket, ahead of anything held
    private final Connection direct = new Connection() {
        @Override
        public String getId() {
            return ConnectionSession.this.getId();
        }

        @Override
        public void send(String payload) throws IOException {
            ConnectionSession.this.socket.sendMessage(new TextMessage(payload));
        }

        @Override
        public void disconnect() {
            ConnectionSession.this.disconnect();
        }
    };

    ConnectionSession(WebSocketSession socket,
                      long groupId,
                      String credential,
                      IdentityClient identityClient,
                      RoomRegistry registry,
                      Broadcaster broadcaster,
                      HistoryService history,
                      FrameDecoder decoder,
                      ChathubProperties.Chat chatProps,
                      Clock clock) {
        this.socket = socket;
        this.groupId = groupId;
        this.credential = credential;
        this.identityClient = identityClient;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.history = history;
        this.decoder = decoder;
        this.chatProps = chatProps;
        this.clock = clock;
    }

    /**
     * Authorizes, joins the room and sends the playback snapshot. On refusal the socket is
     * closed with a policy-violation status and the room is never touched.
     */
    public void open() {
        if (credential == null || credential.isBlank()) {
            log.warn("connection rejected: no credential. sessionId={} groupId={}", getId(), groupId);
            refuse(CloseReason.AUTHENTICATION_REQUIRED, null);
            return;
        }
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.AUTHORIZING)) return;

        IdentityGrant grant;
        try {
            grant = identityClient.verifyGroupAccess(credential, groupId);
        } catch (AuthorizationDeniedException e) {
            log.warn("connection rejected: {}. sessionId={} groupId={}", e.getMessage(), getId(), groupId);
            refuse(CloseReason.AUTHORIZATION_DENIED, e.getMessage());
            return;
        } catch (UpstreamUnavailableException e) {
            log.warn("connection rejected: {}. sessionId={} groupId={}", e.getMessage(), getId(), groupId);
            refuse(CloseReason.SERVICE_UNAVAILABLE, e.getMessage());
            return;
        }

        identity = grant.getUser();
        registry.join(groupId, this);
        if (!state.compareAndSet(SessionState.AUTHORIZING, SessionState.JOINED)) {
            // socket went away while we were authorizing; release() already ran without a room
            registry.leave(groupId, this);
            return;
        }
        log.info("joined. sessionId={} groupId={} group={} user={} members={}",
                getId(), groupId, grant.getGroupName(), identity, registry.connectionCount(groupId));

        Optional<PlaybackState> playback = registry.getPlaybackState(groupId);
        if (playback.isPresent() && playback.get().hasMedia()) {
            broadcaster.sendTo(direct, VideoSyncFrame.of(playback.get()));
            log.info("sent video sync. sessionId={} video={} at={}s playing={}",
                    getId(), playback.get().getMediaId(), playback.get().getPosition(), playback.get().isPlaying());
        }
        if (state.get() == SessionState.CLOSED) return;
        flushHeld();

        state.compareAndSet(SessionState.JOINED, SessionState.ACTIVE);
    }

    /**
     * Processes one inbound frame. Frames of one connection arrive here strictly in order.
     */
    public void handle(String payload) throws IOException {
        if (state.get() != SessionState.ACTIVE) {
            log.debug("frame ignored in state {}. sessionId={}", state.get(), getId());
            return;
        }

        InboundFrame frame;
        try {
            frame = decoder.decode(payload);
        } catch (MalformedFrameException e) {
            if (chatProps.getMalformedFramePolicy() == ChathubProperties.MalformedFramePolicy.CLOSE) {
                log.warn("malformed frame, closing. sessionId={} reason={}", getId(), e.getMessage());
                socket.close(CloseStatus.BAD_DATA.withReason(e.getMessage()));
            } else {
                log.warn("malformed frame skipped. sessionId={} reason={}", getId(), e.getMessage());
            }
            return;
        }

        switch (frame.getType()) {
            case VIDEO_CONTROL:
                onVideoControl((VideoControlFrame) frame);
                break;
            case MESSAGE:
            default:
                onChat((ChatFrame) frame);
                break;
        }
    }

    private void onVideoControl(VideoControlFrame frame) {
        Instant now = clock.instant();
        VideoControlEcho echo = VideoControlEcho.of(frame, identity, groupId, now);
        if (frame.getAction() == null) {
            log.debug("unknown video action '{}' left playback unchanged. groupId={}", frame.getRawAction(), groupId);
        }
        registry.updatePlaybackState(groupId, frame.getAction(), frame.getVideoName(), frame.getVideoTime());
        broadcaster.broadcast(echo, groupId);
        log.info("video control {} by {} in group {}", frame.getRawAction(), identity, groupId);
    }

    private void onChat(ChatFrame frame) {
        NewMessage draft = NewMessage.chat(frame.getText(), identity, frame.groupIdOr(groupId));
        ChatMessage saved;
        try {
            saved = history.append(draft);
        } catch (MessagePersistenceException e) {
            log.error("message not stored, not broadcast. sessionId={} groupId={}", getId(), groupId, e);
            if (chatProps.isNotifySenderOnPersistenceFailure()) {
                broadcaster.sendTo(this, Notices.deliveryFailed(frame.getText()));
            }
            return;
        }
        broadcaster.broadcast(saved, groupId);
    }

    /**
     * Remote close or transport teardown.
     */
    public void onClosed(CloseStatus status) {
        log.info("closed. sessionId={} groupId={} user={} status={}", getId(), groupId, identity, status);
        release();
    }

    @Override
    public String getId() {
        return socket.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        synchronized (heldLock) {
            if (held != null) {
                held.add(payload);
                return;
            }
        }
        socket.sendMessage(new TextMessage(payload));
    }

    @Override
    public void disconnect() {
        try {
            if (socket.isOpen()) socket.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("close after failed send raised: {}", e.toString());
        }
        release();
    }

    public SessionState getState() {
        return state.get();
    }

    public String getIdentity() {
        return identity;
    }

    public long getGroupId() {
        return groupId;
    }

    private void refuse(CloseReason reason, String detail) {
        state.set(SessionState.CLOSED);
        released.set(true);
        try {
            socket.close(reason.toCloseStatus(detail));
        } catch (IOException e) {
            log.debug("close on refusal raised: {}", e.toString());
        }
    }

    private void flushHeld() {
        int flushed;
        synchronized (heldLock) {
            List<String> pending = held;
            held = null;
            try {
                for (String payload : pending) {
                    socket.sendMessage(new TextMessage(payload));
                }
                flushed = pending.size();
            } catch (IOException e) {
                log.warn("flush of held frames failed, disconnecting. sessionId={} error={}", getId(), e.toString());
                flushed = -1;
            }
        }
        if (flushed < 0) {
            disconnect();
        } else if (flushed > 0) {
            log.debug("flushed {} held frames after sync. sessionId={}", flushed, getId());
        }
    }

    private void release() {
        if (!released.compareAndSet(false, true)) return;
        SessionState previous = state.getAndSet(SessionState.CLOSED);
        if (!previous.isInRoom()) return;

        registry.leave(groupId, this);
        try {
            broadcaster.broadcast(Notices.userLeft(groupId), groupId);
        } catch (RuntimeException e) {
            log.warn("user_left notice failed. groupId={} error={}", groupId, e.toString());
        }
    }
}
