package com.yugabyte.monitor.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Redis list per session under {@code conversation:<id>}, newest message at the head.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "monitor.session.store", havingValue = "redis")
public class RedisConversationStore implements ConversationStore {

    static final String KEY_PREFIX = "conversation:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final int maxMessages;
    private final Duration retention;

    @Autowired
    public RedisConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                  MonitorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.maxMessages = properties.getSession().getMaxMessages();
        this.retention = properties.getSession().getRetention();
        log.info("Conversation history stored in Redis (last {} messages, retention {})", maxMessages, retention);
    }

    @Override
    public void append(String sessionId, ChatMessage message) {
        String key = KEY_PREFIX + sessionId;
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message of session " + sessionId + " is not serializable", e);
        }
        redisTemplate.opsForList().leftPush(key, json);
        redisTemplate.opsForList().trim(key, 0, maxMessages - 1);
        redisTemplate.expire(key, retention);
    }

    @Override
    public List<ChatMessage> readRecent(String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> entries = redisTemplate.opsForList().range(KEY_PREFIX + sessionId, 0, limit - 1);
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<ChatMessage> messages = new ArrayList<>(entries.size());
        for (String entry : entries) {
            try {
                messages.add(objectMapper.readValue(entry, ChatMessage.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable history entry in session {}: {}", sessionId, e.getOriginalMessage());
            }
        }
        Collections.reverse(messages);
        return messages;
    }

    @Override
    public void clear(String sessionId) {
        redisTemplate.delete(KEY_PREFIX + sessionId);
    }
}
