package com.example.chathub.service;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.exception.MessagePersistenceException;
import com.example.chathub.exception.UpstreamUnavailableException;
import com.example.chathub.model.ChatMessage;
import com.example.chathub.model.MessageKind;
import com.example.chathub.model.NewMessage;
import com.example.chathub.persistence.ChatMessageEntity;
import com.example.chathub.persistence.ChatMessageRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable chat history: append-only writes and newest-first reads.
 */
@Service
public class HistoryService {

    private final ChatMessageRepository repository;
    private final ChathubProperties.History props;
    private final Clock clock;

    public HistoryService(ChatMessageRepository repository, ChathubProperties properties, Clock clock) {
        this.repository = repository;
        this.props = properties.getHistory();
        this.clock = clock;
    }

    /**
     * Stores the message. Callers must not broadcast it unless this returns normally.
     *
     * @throws MessagePersistenceException when the store rejects or cannot take the write
     */
    // save() commits on its own, so commit failures surface here rather than past the proxy
    public ChatMessage append(NewMessage message) {
        long now = clock.millis();
        ChatMessageEntity entity = new ChatMessageEntity(
                message.getText(), message.getUser(), message.getGroupId(), message.getKind().wire(), now, now);
        try {
            return toModel(repository.save(entity));
        } catch (DataAccessException | TransactionException e) {
            throw new MessagePersistenceException("failed to store message for group " + message.getGroupId(), e);
        }
    }

    /**
     * @param groupId optional group filter
     * @param limit   requested size; clamped to [1, max-limit]
     * @return newest first
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> list(Long groupId, Integer limit) {
        int requested = limit == null ? props.getDefaultLimit() : limit;
        int safeLimit = Math.max(1, Math.min(requested, props.getMaxLimit()));
        PageRequest page = PageRequest.of(0, safeLimit);

        List<ChatMessageEntity> rows;
        try {
            rows = groupId == null
                    ? repository.findLatest(page)
                    : repository.findLatestByGroupId(groupId, page);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("message store unavailable", e);
        }

        List<ChatMessage> out = new ArrayList<>(rows.size());
        for (ChatMessageEntity row : rows) out.add(toModel(row));
        return out;
    }

    private static ChatMessage toModel(ChatMessageEntity e) {
        return new ChatMessage(
                String.valueOf(e.getId()),
                e.getText(),
                e.getUser(),
                e.getGroupId(),
                MessageKind.fromWire(e.getKind()),
                Instant.ofEpochMilli(e.getCreatedAtEpochMs()),
                Instant.ofEpochMilli(e.getUpdatedAtEpochMs()));
    }
}
