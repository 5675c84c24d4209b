package com.yugabyte.monitor.repository;

import com.yugabyte.monitor.model.ChatMessage;

import java.util.List;

/**
 * Bounded per-session message history.
 * <p>
 * Every append keeps only the newest {@code monitor.session.max-messages} entries and refreshes the
 * session's expiry. Implementations may throw on storage failure; callers treat the store as best effort.
 */
public interface ConversationStore {

    void append(String sessionId, ChatMessage message);

    /**
     * The newest {@code limit} messages, oldest first.
     */
    List<ChatMessage> readRecent(String sessionId, int limit);

    void clear(String sessionId);
}
