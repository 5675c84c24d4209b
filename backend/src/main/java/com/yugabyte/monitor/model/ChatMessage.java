package com.yugabyte.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One entry of a conversation, as persisted in the session store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {
    private String content;
    private MessageSender sender;
    private Instant timestamp;
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
