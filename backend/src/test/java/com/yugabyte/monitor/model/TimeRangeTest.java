package com.yugabyte.monitor.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TimeRange")
class TimeRangeTest {

    @ParameterizedTest
    @CsvSource({"5m,300", "1h,3600", "24h,86400", "7d,604800", "2w,1209600", "30s,30"})
    @DisplayName("parses compact durations")
    void parse(String text, long seconds) {
        assertThat(TimeRange.parse(text).getDuration()).isEqualTo(Duration.ofSeconds(seconds));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "soon", "0h", "-5m", "1y", "h1"})
    @DisplayName("falls back to one hour for anything else")
    void invalid(String text) {
        assertThat(TimeRange.parse(text)).isEqualTo(TimeRange.DEFAULT);
        assertThat(TimeRange.parse(null)).isEqualTo(TimeRange.DEFAULT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"99999999999999999999m", "9999999999999999h", "400d", "60w", "0000000000000000000000002h"})
    @DisplayName("clamps or parses large counts without overflow")
    void large(String text) {
        assertThat(TimeRange.parse(text).getDuration()).isLessThanOrEqualTo(TimeRange.MAX);
        assertThat(TimeRange.of(Duration.ofDays(10_000)).getDuration()).isEqualTo(TimeRange.MAX);
    }

    @Test
    @DisplayName("labels use the largest whole unit")
    void label() {
        assertThat(TimeRange.of(Duration.ofMinutes(90)).label()).isEqualTo("90m");
        assertThat(TimeRange.of(Duration.ofDays(1)).label()).isEqualTo("24h");
        assertThat(TimeRange.of(Duration.ofDays(7)).label()).isEqualTo("7d");
        assertThat(TimeRange.of(Duration.ZERO)).isEqualTo(TimeRange.DEFAULT);
    }
}
