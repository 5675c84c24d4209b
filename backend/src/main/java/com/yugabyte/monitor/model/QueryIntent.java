package com.yugabyte.monitor.model;

import java.util.Locale;
import java.util.Optional;

public enum QueryIntent {
    CPU,
    MEMORY,
    DISK,
    NETWORK,
    LATENCY,
    THROUGHPUT,
    ERRORS,
    PERFORMANCE,
    ALERTS,
    HEALTH,
    SERVICES,
    UNKNOWN;

    public static Optional<QueryIntent> fromText(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
