package com.yugabyte.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * An active alert reported by a monitoring backend.
 */
@Value
@Builder
public class AlertRecord {
    String name;
    AlertSeverity severity;
    String description;
    String service;
    Instant timestamp;
    @Singular
    Map<String, String> labels;
}
