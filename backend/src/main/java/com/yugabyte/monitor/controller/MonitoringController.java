package com.yugabyte.monitor.controller;

import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.service.DataSourceService;
import com.yugabyte.monitor.service.TurnMetricsService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: data source health, active alerts, available metrics and turn analytics.
 */
@RestController
@RequestMapping("/monitoring")
@CrossOrigin(origins = "*")
@Slf4j
public class MonitoringController {

    private final DataSourceService dataSourceService;
    private final TurnMetricsService turnMetricsService;

    public MonitoringController(DataSourceService dataSourceService, TurnMetricsService turnMetricsService) {
        this.dataSourceService = dataSourceService;
        this.turnMetricsService = turnMetricsService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthSummary> getHealth() {
        return ResponseEntity.ok(dataSourceService.getHealthSummary());
    }

    @GetMapping("/alerts")
    public ResponseEntity<AlertsResponse> getActiveAlerts() {
        List<AlertRecord> alerts = dataSourceService.getActiveAlerts();
        AlertsResponse response = new AlertsResponse();
        response.setAlerts(alerts);
        response.setCount(alerts.size());
        response.setTimestamp(Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Services and metric names offered by each healthy connector.
     */
    @GetMapping("/metrics/summary")
    public ResponseEntity<MetricsSummary> getMetricsSummary() {
        return ResponseEntity.ok(dataSourceService.getMetricsSummary());
    }

    /**
     * Turn statistics over the last {@code hours} hours (default 24).
     */
    @GetMapping("/analytics/turns")
    public ResponseEntity<TurnAnalytics> getTurnAnalytics(@RequestParam(required = false) Integer hours) {
        int lookbackHours = hours != null ? hours : 24;
        return ResponseEntity.ok(turnMetricsService.getTurnAnalytics(lookbackHours));
    }

    // Data classes

    @Data
    public static class TurnAnalytics {
        private int lookbackHours;
        private long totalTurns;
        private double averageLatencyMs;
        private double p50LatencyMs;
        private double p95LatencyMs;
        private double p99LatencyMs;
        private Map<String, Long> turnsByKind;
        private Map<String, Long> turnsByIntent;
        private long successfulTurns;
        private long failedTurns;
        private double successRate;
    }

    @Data
    public static class HealthSummary {
        private String overallStatus;
        private Map<String, String> componentStatus;
        private Instant lastCheck;
        private Map<String, Object> metrics;
    }

    @Data
    public static class AlertsResponse {
        private List<AlertRecord> alerts;
        private int count;
        private Instant timestamp;
    }

    @Data
    public static class MetricsSummary {
        private long metricsCount;
        private List<String> services;
        private List<String> connectors;
        private Map<String, ConnectorSummary> connectorSummaries;
        private Instant lastUpdated;
    }

    @Data
    public static class ConnectorSummary {
        private String connectorName;
        private int servicesCount;
        private int metricsCount;
        private List<String> services;
        private List<String> metricNames;
        private Instant lastUpdated;
    }
}
