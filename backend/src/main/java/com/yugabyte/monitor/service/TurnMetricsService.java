package com.yugabyte.monitor.service;

import com.yugabyte.monitor.controller.MonitoringController;
import com.yugabyte.monitor.model.QueryIntent;
import com.yugabyte.monitor.model.QueryKind;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory turn statistics for the monitoring endpoints. Keeps the last 1000 turns.
 */
@Service
@Slf4j
public class TurnMetricsService {

    static final int MAX_TURNS = 1000;

    private final Deque<TurnMetric> turns = new ArrayDeque<>();
    private final AtomicLong totalTurns = new AtomicLong(0);
    private final AtomicLong failedTurns = new AtomicLong(0);
    private final Clock clock;

    @Autowired
    public TurnMetricsService(Clock clock) {
        this.clock = clock;
    }

    public void recordTurn(String turnId, QueryKind kind, QueryIntent intent, long latencyMs, boolean success) {
        TurnMetric metric = new TurnMetric(turnId,
                kind != null ? kind.name().toLowerCase(Locale.ROOT) : "unparsed",
                intent != null ? intent.name().toLowerCase(Locale.ROOT) : "unknown",
                latencyMs, success, clock.instant());
        synchronized (turns) {
            turns.addLast(metric);
            while (turns.size() > MAX_TURNS) {
                turns.removeFirst();
            }
        }
        totalTurns.incrementAndGet();
        if (!success) {
            failedTurns.incrementAndGet();
        }
        log.debug("Recorded turn {}: kind={}, intent={}, {}ms, success={}", turnId, metric.getKind(),
                metric.getIntent(), latencyMs, success);
    }

    /**
     * Aggregate the turns of the last {@code lookbackHours} hours.
     */
    public MonitoringController.TurnAnalytics getTurnAnalytics(int lookbackHours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(lookbackHours));
        List<TurnMetric> recent;
        synchronized (turns) {
            recent = turns.stream()
                    .filter(t -> t.getTimestamp().isAfter(cutoff))
                    .collect(Collectors.toList());
        }

        MonitoringController.TurnAnalytics analytics = new MonitoringController.TurnAnalytics();
        analytics.setLookbackHours(lookbackHours);
        if (recent.isEmpty()) {
            analytics.setTurnsByKind(Collections.emptyMap());
            analytics.setTurnsByIntent(Collections.emptyMap());
            return analytics;
        }

        List<Long> latencies = recent.stream()
                .map(TurnMetric::getLatencyMs)
                .sorted()
                .collect(Collectors.toList());
        analytics.setTotalTurns(recent.size());
        analytics.setAverageLatencyMs(latencies.stream().mapToLong(Long::longValue).average().orElse(0.0));
        analytics.setP50LatencyMs(percentile(latencies, 0.50));
        analytics.setP95LatencyMs(percentile(latencies, 0.95));
        analytics.setP99LatencyMs(percentile(latencies, 0.99));

        Map<String, Long> byKind = new LinkedHashMap<>();
        Map<String, Long> byIntent = new LinkedHashMap<>();
        for (TurnMetric turn : recent) {
            byKind.merge(turn.getKind(), 1L, Long::sum);
            byIntent.merge(turn.getIntent(), 1L, Long::sum);
        }
        analytics.setTurnsByKind(byKind);
        analytics.setTurnsByIntent(byIntent);

        long successful = recent.stream().filter(TurnMetric::isSuccess).count();
        analytics.setSuccessfulTurns(successful);
        analytics.setFailedTurns(recent.size() - successful);
        analytics.setSuccessRate((double) successful / recent.size());
        return analytics;
    }

    public long getTotalTurns() {
        return totalTurns.get();
    }

    public long getFailedTurns() {
        return failedTurns.get();
    }

    static double percentile(List<Long> sorted, double percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil(percentile * sorted.size()) - 1;
        index = Math.max(0, Math.min(index, sorted.size() - 1));
        return sorted.get(index);
    }

    int retainedTurns() {
        synchronized (turns) {
            return turns.size();
        }
    }

    @Value
    private static class TurnMetric {
        String turnId;
        String kind;
        String intent;
        long latencyMs;
        boolean success;
        Instant timestamp;
    }
}
