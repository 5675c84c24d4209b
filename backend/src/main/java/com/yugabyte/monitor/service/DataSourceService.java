package com.yugabyte.monitor.service;

import com.yugabyte.monitor.client.LlmClient;
import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.connector.ConnectorOutcome;
import com.yugabyte.monitor.connector.ConnectorRegistry;
import com.yugabyte.monitor.connector.MonitoringConnector;
import com.yugabyte.monitor.controller.MonitoringController;
import com.yugabyte.monitor.exception.NoDataSourceException;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.ConnectorHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Direct views over the connected backends for the monitoring endpoints, outside of a conversation.
 */
@Service
@Slf4j
public class DataSourceService {

    private final ConnectorRegistry registry;
    private final LlmClient llmClient;
    private final TurnMetricsService turnMetrics;
    private final MonitorProperties properties;
    private final Clock clock;

    @Autowired
    public DataSourceService(ConnectorRegistry registry, LlmClient llmClient, TurnMetricsService turnMetrics,
                             MonitorProperties properties, Clock clock) {
        this.registry = registry;
        this.llmClient = llmClient;
        this.turnMetrics = turnMetrics;
        this.properties = properties;
        this.clock = clock;
    }

    public List<AlertRecord> getActiveAlerts() {
        requireConnectors();
        Instant deadline = clock.instant().plus(properties.getQuery().getTurnTimeout());
        return ConnectorOutcome.merge(registry.fanOut("alerts", MonitoringConnector::listActiveAlerts, deadline).values());
    }

    /**
     * Services and metric names of every healthy connector, capped per connector.
     */
    public MonitoringController.MetricsSummary getMetricsSummary() {
        requireConnectors();
        Instant deadline = clock.instant().plus(properties.getQuery().getTurnTimeout());
        List<MonitoringConnector> healthy = registry.healthyConnectors();
        Map<String, ConnectorOutcome<String>> services = registry.fanOut("services", healthy,
                MonitoringConnector::listServices, deadline);
        Map<String, ConnectorOutcome<String>> metricNames = registry.fanOut("metric names", healthy,
                MonitoringConnector::listMetricNames, deadline);

        Map<String, MonitoringController.ConnectorSummary> summaries = new LinkedHashMap<>();
        Set<String> allServices = new LinkedHashSet<>();
        long totalMetrics = 0;
        for (MonitoringConnector connector : healthy) {
            List<String> connectorServices = capped(services.get(connector.getName()), properties.getQuery().getMaxServices());
            List<String> connectorMetrics = capped(metricNames.get(connector.getName()), properties.getQuery().getMaxMetricNames());
            MonitoringController.ConnectorSummary summary = new MonitoringController.ConnectorSummary();
            summary.setConnectorName(connector.getName());
            summary.setServicesCount(connectorServices.size());
            summary.setMetricsCount(connectorMetrics.size());
            summary.setServices(connectorServices);
            summary.setMetricNames(connectorMetrics);
            summary.setLastUpdated(clock.instant());
            summaries.put(connector.getName(), summary);
            allServices.addAll(connectorServices);
            totalMetrics += connectorMetrics.size();
        }

        MonitoringController.MetricsSummary result = new MonitoringController.MetricsSummary();
        result.setMetricsCount(totalMetrics);
        result.setServices(new ArrayList<>(allServices));
        result.setConnectors(new ArrayList<>(summaries.keySet()));
        result.setConnectorSummaries(summaries);
        result.setLastUpdated(clock.instant());
        return result;
    }

    /**
     * Overall status: healthy when every connector answers, degraded when some do not or none is configured.
     */
    public MonitoringController.HealthSummary getHealthSummary() {
        List<ConnectorHealth> health = registry.checkHealth();
        Map<String, String> components = new LinkedHashMap<>();
        boolean degraded = health.isEmpty();
        for (ConnectorHealth entry : health) {
            components.put("connector_" + entry.getConnectorName(), entry.isReachable() ? "healthy" : "unhealthy");
            degraded |= !entry.isReachable();
        }
        if (health.isEmpty()) {
            components.put("connectors", "none_configured");
        }
        components.put("language_model", llmClient.isEnabled() ? "enabled" : "disabled");
        components.put("session_store", properties.getSession().getStore());

        Map<String, Object> metrics = new LinkedHashMap<>();
        long total = turnMetrics.getTotalTurns();
        metrics.put("total_turns", total);
        metrics.put("failed_turns", turnMetrics.getFailedTurns());
        metrics.put("success_rate", total > 0 ? (double) (total - turnMetrics.getFailedTurns()) / total : 0.0);

        MonitoringController.HealthSummary summary = new MonitoringController.HealthSummary();
        summary.setOverallStatus(degraded ? "degraded" : "healthy");
        summary.setComponentStatus(components);
        summary.setLastCheck(clock.instant());
        summary.setMetrics(metrics);
        log.debug("Health summary: {}", components);
        return summary;
    }

    private void requireConnectors() {
        if (registry.isEmpty()) {
            throw new NoDataSourceException();
        }
    }

    private static List<String> capped(ConnectorOutcome<String> outcome, int cap) {
        if (outcome == null) {
            return List.of();
        }
        return outcome.getItems().stream().limit(cap).collect(Collectors.toList());
    }
}
