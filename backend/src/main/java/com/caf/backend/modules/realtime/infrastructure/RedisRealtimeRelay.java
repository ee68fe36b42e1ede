package com.caf.backend.modules.realtime.infrastructure;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.caf.backend.modules.realtime.application.RealtimeDispatcher;
import com.caf.backend.modules.realtime.application.RealtimeEvent;
import com.caf.backend.modules.realtime.application.RealtimeRelay;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Relays pushes over a Redis pub/sub channel so every node, this one included, delivers to its own
 * sessions.
 */
public class RedisRealtimeRelay implements RealtimeRelay, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisRealtimeRelay.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RealtimeDispatcher realtimeDispatcher;
    private final String channel;

    public RedisRealtimeRelay(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            RealtimeDispatcher realtimeDispatcher,
            String channel
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.realtimeDispatcher = realtimeDispatcher;
        this.channel = channel;
    }

    @Override
    public void publish(UUID userId, RealtimeEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(new RelayEnvelope(userId, event.name(), objectMapper.valueToTree(event.data())));
            redisTemplate.convertAndSend(channel, payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode realtime relay message", ex);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            RelayEnvelope envelope = objectMapper.readValue(body, RelayEnvelope.class);
            realtimeDispatcher.deliverLocal(envelope.userId(), new RealtimeEvent(envelope.name(), envelope.data()));
        } catch (IOException ex) {
            log.warn("Dropping malformed realtime relay message on {}", channel, ex);
        }
    }

    record RelayEnvelope(UUID userId, String name, JsonNode data) {
    }
}
