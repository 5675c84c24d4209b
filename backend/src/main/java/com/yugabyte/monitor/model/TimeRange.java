package com.yugabyte.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Look-back window of a query. Stored as a {@link Duration}; backends convert it to their own format.
 */
@Getter
@EqualsAndHashCode
public final class TimeRange {

    public static final TimeRange DEFAULT = new TimeRange(Duration.ofHours(1));

    /** Longest look-back accepted; larger requests are clamped to it. */
    public static final Duration MAX = Duration.ofDays(365);

    private static final Pattern COMPACT = Pattern.compile("^\\s*(\\d+)\\s*([smhdw])\\s*$");

    private final Duration duration;

    private TimeRange(Duration duration) {
        this.duration = duration;
    }

    public static TimeRange of(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return DEFAULT;
        }
        return new TimeRange(duration.compareTo(MAX) > 0 ? MAX : duration);
    }

    /**
     * Parse a compact duration such as {@code 5m}, {@code 1h}, {@code 24h} or {@code 7d}.
     * Anything unparsable yields {@link #DEFAULT}; counts beyond {@link #MAX} are clamped.
     */
    public static TimeRange parse(String text) {
        if (text == null) {
            return DEFAULT;
        }
        Matcher m = COMPACT.matcher(text.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return DEFAULT;
        }
        String digits = m.group(1).replaceFirst("^0+", "");
        if (digits.isEmpty()) {
            return DEFAULT;
        }
        long unitSeconds = unitSeconds(m.group(2));
        // anything longer than 12 digits is past MAX in every unit
        if (digits.length() > 12) {
            return new TimeRange(MAX);
        }
        long amount = Long.parseLong(digits);
        if (amount > MAX.getSeconds() / unitSeconds) {
            return new TimeRange(MAX);
        }
        return of(Duration.ofSeconds(amount * unitSeconds));
    }

    private static long unitSeconds(String unit) {
        switch (unit) {
            case "s":
                return 1;
            case "m":
                return 60;
            case "h":
                return 3600;
            case "d":
                return 86400;
            default:
                return 7 * 86400;
        }
    }

    public static boolean isValid(String text) {
        return text != null && COMPACT.matcher(text.toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Compact label using the largest whole unit, e.g. {@code 90m}, {@code 24h}, {@code 7d}.
     */
    @JsonValue
    public String label() {
        long seconds = duration.getSeconds();
        if (seconds % 86400 == 0 && seconds >= 86400 * 2) {
            return (seconds / 86400) + "d";
        }
        if (seconds % 3600 == 0) {
            return (seconds / 3600) + "h";
        }
        if (seconds % 60 == 0) {
            return (seconds / 60) + "m";
        }
        return seconds + "s";
    }

    @Override
    public String toString() {
        return label();
    }
}
