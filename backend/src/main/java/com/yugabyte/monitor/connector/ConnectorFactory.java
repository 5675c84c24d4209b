package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the connectors that are fully configured. A partially configured backend is skipped.
 */
@Slf4j
public class ConnectorFactory {

    private final MonitorProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    public ConnectorFactory(MonitorProperties properties, WebClient.Builder webClientBuilder, Clock clock) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
    }

    public List<MonitoringConnector> createConnectors() {
        List<MonitoringConnector> connectors = new ArrayList<>();

        MonitorProperties.Prometheus prometheus = properties.getPrometheus();
        if (prometheus.isConfigured()) {
            connectors.add(new PrometheusConnector(prometheus, webClientBuilder, clock));
            log.info("Prometheus connector configured for {} (alertmanager {})",
                    prometheus.getUrl(), prometheus.resolveAlertmanagerUrl());
        } else {
            log.info("Prometheus connector not configured: monitor.prometheus.url is empty");
        }

        MonitorProperties.Azure azure = properties.getAzure();
        if (azure.isConfigured()) {
            connectors.add(new AzureMonitorConnector(azure, webClientBuilder, clock));
            log.info("Azure Monitor connector configured for subscription {}", azure.getSubscriptionId());
        } else {
            log.info("Azure Monitor connector not configured: subscription-id, client-id, client-secret "
                    + "and tenant-id are all required");
        }

        if (connectors.isEmpty()) {
            log.warn("No monitoring connectors configured; answers will report missing data");
        }
        return connectors;
    }
}
