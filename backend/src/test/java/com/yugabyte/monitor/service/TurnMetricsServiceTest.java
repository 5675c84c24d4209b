package com.yugabyte.monitor.service;

import com.yugabyte.monitor.MutableClock;
import com.yugabyte.monitor.controller.MonitoringController;
import com.yugabyte.monitor.model.QueryIntent;
import com.yugabyte.monitor.model.QueryKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TurnMetricsService")
class TurnMetricsServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
    private final TurnMetricsService service = new TurnMetricsService(clock);

    @Test
    @DisplayName("aggregates latency, kinds and success rate")
    void analytics() {
        service.recordTurn("TURN-1", QueryKind.METRICS, QueryIntent.MEMORY, 100, true);
        service.recordTurn("TURN-2", QueryKind.METRICS, QueryIntent.CPU, 300, true);
        service.recordTurn("TURN-3", QueryKind.ALERTS, QueryIntent.ALERTS, 200, true);
        service.recordTurn("TURN-4", null, null, 400, false);

        MonitoringController.TurnAnalytics analytics = service.getTurnAnalytics(24);

        assertThat(analytics.getTotalTurns()).isEqualTo(4);
        assertThat(analytics.getAverageLatencyMs()).isEqualTo(250.0);
        assertThat(analytics.getP50LatencyMs()).isEqualTo(200.0);
        assertThat(analytics.getP99LatencyMs()).isEqualTo(400.0);
        assertThat(analytics.getTurnsByKind())
                .containsEntry("metrics", 2L).containsEntry("alerts", 1L).containsEntry("unparsed", 1L);
        assertThat(analytics.getTurnsByIntent()).containsEntry("unknown", 1L);
        assertThat(analytics.getSuccessRate()).isEqualTo(0.75);
        assertThat(service.getFailedTurns()).isEqualTo(1);
    }

    @Test
    @DisplayName("only turns inside the look-back window count")
    void lookback() {
        service.recordTurn("TURN-old", QueryKind.HEALTH, QueryIntent.HEALTH, 50, true);
        clock.advance(Duration.ofHours(3));
        service.recordTurn("TURN-new", QueryKind.HEALTH, QueryIntent.HEALTH, 70, true);

        assertThat(service.getTurnAnalytics(2).getTotalTurns()).isEqualTo(1);
        assertThat(service.getTurnAnalytics(24).getTotalTurns()).isEqualTo(2);
        assertThat(service.getTurnAnalytics(24).getLookbackHours()).isEqualTo(24);
    }

    @Test
    @DisplayName("an empty window yields zeroes")
    void empty() {
        MonitoringController.TurnAnalytics analytics = service.getTurnAnalytics(1);

        assertThat(analytics.getTotalTurns()).isZero();
        assertThat(analytics.getTurnsByKind()).isEmpty();
    }

    @Test
    @DisplayName("keeps only the most recent turns")
    void bounded() {
        for (int i = 0; i < TurnMetricsService.MAX_TURNS + 25; i++) {
            service.recordTurn("TURN-" + i, QueryKind.METRICS, QueryIntent.CPU, i, true);
        }

        assertThat(service.retainedTurns()).isEqualTo(TurnMetricsService.MAX_TURNS);
        assertThat(service.getTotalTurns()).isEqualTo(TurnMetricsService.MAX_TURNS + 25);
    }

    @Test
    @DisplayName("percentile uses the nearest rank")
    void percentile() {
        List<Long> sorted = List.of(10L, 20L, 30L, 40L, 50L, 60L, 70L, 80L, 90L, 100L);

        assertThat(TurnMetricsService.percentile(sorted, 0.50)).isEqualTo(50.0);
        assertThat(TurnMetricsService.percentile(sorted, 0.95)).isEqualTo(100.0);
        assertThat(TurnMetricsService.percentile(List.of(), 0.95)).isZero();
    }
}
