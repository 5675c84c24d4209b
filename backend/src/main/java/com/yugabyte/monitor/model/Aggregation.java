package com.yugabyte.monitor.model;

import java.util.Locale;
import java.util.Optional;

public enum Aggregation {
    AVG("avg", "Average"),
    SUM("sum", "Total"),
    MAX("max", "Maximum"),
    MIN("min", "Minimum"),
    RAW("raw", "Average");

    private final String function;
    private final String azureName;

    Aggregation(String function, String azureName) {
        this.function = function;
        this.azureName = azureName;
    }

    /**
     * PromQL aggregation operator name.
     */
    public String function() {
        return function;
    }

    /**
     * Aggregation keyword of the Azure metrics API.
     */
    public String azureName() {
        return azureName;
    }

    public static Optional<Aggregation> fromText(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Aggregation aggregation : values()) {
            if (aggregation.function.equals(normalized)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return function;
    }
}
