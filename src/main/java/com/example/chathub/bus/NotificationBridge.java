package com.example.chathub.bus;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.exception.MessagePersistenceException;
import com.example.chathub.model.ChatMessage;
import com.example.chathub.model.MembershipEvent;
import com.example.chathub.model.NewMessage;
import com.example.chathub.service.HistoryService;
import com.example.chathub.ws.Broadcaster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders membership changes published by other processes into the live rooms.
 *
 * <p>Each event becomes a system message: stored first, then broadcast to the event's group.
 * Bad payloads and store failures are logged and skipped; the subscription stays up.
 * Subscribes when the context starts and unsubscribes when it stops.
 */
@Component
public class NotificationBridge implements MessageListener, SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    static final String SYSTEM_USER = "system";

    private final RedisMessageListenerContainer container;
    private final HistoryService history;
    private final Broadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final ChathubProperties.Bus props;

    private volatile boolean running;

    public NotificationBridge(RedisMessageListenerContainer container,
                              HistoryService history,
                              Broadcaster broadcaster,
                              ObjectMapper objectMapper,
                              ChathubProperties properties) {
        this.container = container;
        this.history = history;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.props = properties.getBus();
    }

    @Override
    public void start() {
        container.addMessageListener(this, List.of(
                new ChannelTopic(props.getAddChannel()),
                new ChannelTopic(props.getRemoveChannel())));
        running = true;
        log.info("membership bridge subscribed. channels=[{}, {}]", props.getAddChannel(), props.getRemoveChannel());
    }

    @Override
    public void stop() {
        container.removeMessageListener(this);
        running = false;
        log.info("membership bridge unsubscribed");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // start before the container's first subscribe, stop after it has drained
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        MembershipEvent event;
        try {
            event = parse(channel, message.getBody());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("malformed membership event skipped. channel={} error={} raw={}",
                    channel, e.getMessage(), new String(message.getBody(), StandardCharsets.UTF_8));
            return;
        }

        try {
            deliver(event);
        } catch (RuntimeException e) {
            log.error("membership event processing failed. channel={} groupId={}", channel, event.getGroupId(), e);
        }
    }

    /**
     * Stores the event as a system message and broadcasts it to the group's live room.
     *
     * @return the stored message, or {@code null} when the store rejected it
     */
    public ChatMessage deliver(MembershipEvent event) {
        NewMessage draft = new NewMessage(event.getText(), SYSTEM_USER, event.getGroupId(), event.getChange().messageKind());
        ChatMessage saved;
        try {
            saved = history.append(draft);
        } catch (MessagePersistenceException e) {
            log.error("membership notice not stored, not broadcast. groupId={}", event.getGroupId(), e);
            return null;
        }
        int delivered = broadcaster.broadcast(saved, event.getGroupId());
        log.info("broadcast {} notice to group {} ({} connections): {}",
                event.getType(), event.getGroupId(), delivered, event.getText());
        return saved;
    }

    MembershipEvent parse(String channel, byte[] body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("payload must be a json object");
        }

        MembershipEvent.Change change = MembershipEvent.Change.fromWire(root.path("type").asText(null));
        if (change == null) change = changeForChannel(channel);
        if (change == null) {
            throw new IllegalArgumentException("unknown membership change: " + root.path("type").asText(""));
        }

        JsonNode gid = root.get("group_id");
        if (gid == null || !gid.canConvertToExactIntegral()) {
            throw new IllegalArgumentException("group_id must be an integer");
        }

        JsonNode text = root.get("text");
        if (text == null || !text.isTextual()) {
            throw new IllegalArgumentException("text is required");
        }

        String actor = firstText(root, "actor", "added_by", "removed_by");
        String userEmail = root.path("user_email").asText(null);
        return new MembershipEvent(change, gid.asLong(), text.asText(), userEmail, actor);
    }

    private MembershipEvent.Change changeForChannel(String channel) {
        if (props.getAddChannel().equals(channel)) return MembershipEvent.Change.ADD;
        if (props.getRemoveChannel().equals(channel)) return MembershipEvent.Change.REMOVE;
        return null;
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String f : fields) {
            JsonNode n = root.get(f);
            if (n != null && n.isTextual()) return n.asText();
        }
        return null;
    }
}
