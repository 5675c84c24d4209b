package com.yugabyte.monitor.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ConversationSummary {
    private String sessionId;
    private int messageCount;
    private Instant startTime;
    private Instant lastActivity;
    private List<String> topics;
}
