package com.yugabyte.monitor.repository;

import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local history for single-instance deployments and tests. Sessions expire after the
 * retention period without writes.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "monitor.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final int maxMessages;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public InMemoryConversationStore(MonitorProperties properties, Clock clock) {
        this.maxMessages = properties.getSession().getMaxMessages();
        this.retention = properties.getSession().getRetention();
        this.clock = clock;
        log.info("Conversation history kept in memory (last {} messages, retention {})", maxMessages, retention);
    }

    @Override
    public void append(String sessionId, ChatMessage message) {
        Instant now = clock.instant();
        sessions.compute(sessionId, (id, session) -> {
            Session target = session == null || session.isExpired(now) ? new Session() : session;
            synchronized (target) {
                target.messages.addFirst(message);
                while (target.messages.size() > maxMessages) {
                    target.messages.removeLast();
                }
                target.expiresAt = now.plus(retention);
            }
            return target;
        });
    }

    @Override
    public List<ChatMessage> readRecent(String sessionId, int limit) {
        Session session = sessions.get(sessionId);
        if (session == null || limit <= 0) {
            return List.of();
        }
        List<ChatMessage> recent = new ArrayList<>();
        synchronized (session) {
            if (session.isExpired(clock.instant())) {
                return List.of();
            }
            Iterator<ChatMessage> newestFirst = session.messages.iterator();
            while (newestFirst.hasNext() && recent.size() < limit) {
                recent.add(0, newestFirst.next());
            }
        }
        return recent;
    }

    @Override
    public void clear(String sessionId) {
        sessions.remove(sessionId);
    }

    @Scheduled(fixedDelayString = "${monitor.session.cleanup-interval-ms:300000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} expired conversation session(s)", evicted);
        }
    }

    int sessionCount() {
        return sessions.size();
    }

    private static final class Session {
        private final Deque<ChatMessage> messages = new ArrayDeque<>();
        private Instant expiresAt;

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
