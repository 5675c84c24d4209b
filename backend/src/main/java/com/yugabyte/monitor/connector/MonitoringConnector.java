package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.ConnectorHealth;
import com.yugabyte.monitor.model.MetricSample;

import java.time.Duration;

/**
 * Uniform capability contract over one monitoring backend.
 * <p>
 * Implementations never throw: every failure is reported as a {@link ConnectorOutcome}
 * with a {@link FailureKind}, and logged by the connector.
 */
public interface MonitoringConnector {

    String getName();

    /**
     * Upper bound for a single call against this backend.
     */
    Duration getTimeout();

    ConnectorHealth checkHealth();

    ConnectorOutcome<MetricSample> queryMetrics(String query, QueryOptions options);

    ConnectorOutcome<AlertRecord> listActiveAlerts();

    ConnectorOutcome<String> listServices();

    ConnectorOutcome<String> listMetricNames();

    /**
     * Translator from a parsed question to this backend's native query language.
     */
    BackendQueryTranslator getTranslator();

    /**
     * Native query that reports target liveness, or null when the backend has none.
     */
    default String livenessQuery() {
        return null;
    }
}
