package com.yugabyte.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Normalized alert severity. Every backend severity is folded into one of these three values.
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO;

    /**
     * Normalize a Prometheus/Alertmanager {@code severity} label. Unknown values map to WARNING.
     */
    public static AlertSeverity fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return WARNING;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
            case "error":
            case "page":
            case "high":
                return CRITICAL;
            case "info":
            case "informational":
            case "low":
            case "none":
                return INFO;
            default:
                return WARNING;
        }
    }

    /**
     * Normalize an Azure Monitor severity ({@code Sev0}..{@code Sev4}). Unmapped values fall into INFO.
     */
    public static AlertSeverity fromAzure(String raw) {
        if (raw == null) {
            return INFO;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "sev0":
            case "sev1":
                return CRITICAL;
            case "sev2":
                return WARNING;
            default:
                return INFO;
        }
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
