package com.yugabyte.monitor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Which family of backend operation a turn is routed to.
 */
public enum QueryKind {
    METRICS,
    ALERTS,
    HEALTH,
    SERVICES;

    public static Optional<QueryKind> fromText(String value) {
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
