package com.example.chathub.bus;

import com.example.chathub.config.ChathubProperties;
import com.example.chathub.model.MembershipEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Producing side of the membership channels, for services that change group membership.
 */
@Component
public class MembershipEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(MembershipEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ChathubProperties.Bus props;

    public MembershipEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ChathubProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.props = properties.getBus();
    }

    public String channelFor(MembershipEvent.Change change) {
        return change == MembershipEvent.Change.ADD ? props.getAddChannel() : props.getRemoveChannel();
    }

    /**
     * Serializes the event onto the channel for its change. Delivery is fire-and-forget.
     */
    public void publish(MembershipEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("membership event cannot be serialized", e);
        }
        String channel = channelFor(event.getChange());
        redisTemplate.convertAndSend(channel, json);
        log.debug("published {} event for group {} to {}", event.getType(), event.getGroupId(), channel);
    }
}
