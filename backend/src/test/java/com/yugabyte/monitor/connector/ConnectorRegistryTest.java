package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.AlertSeverity;
import com.yugabyte.monitor.model.ConnectorHealth;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConnectorRegistry")
class ConnectorRegistryTest {

    private ConnectorRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    private ConnectorRegistry registryOf(MonitoringConnector... connectors) {
        registry = new ConnectorRegistry(List.of(connectors), Clock.systemUTC());
        return registry;
    }

    private static AlertRecord alert(String name) {
        return AlertRecord.builder()
                .name(name)
                .severity(AlertSeverity.WARNING)
                .description("")
                .service("svc")
                .timestamp(Instant.now())
                .build();
    }

    private static MonitoringConnector hungHealthCheck(String name, Duration timeout) {
        return new FakeConnector(name) {
            @Override
            public ConnectorHealth checkHealth() {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.checkHealth();
            }
        }.timeout(timeout);
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("reports every connector by name")
        void healthCheckAll() {
            ConnectorRegistry registry = registryOf(
                    new FakeConnector("prometheus"), new FakeConnector("azure_monitor").healthy(false));

            Map<String, Boolean> health = registry.healthCheckAll();

            assertThat(health).containsExactly(entry("prometheus", true), entry("azure_monitor", false));
        }

        @Test
        @DisplayName("a health check that overruns the connector timeout counts as unreachable")
        void slowHealthCheck() {
            MonitoringConnector slow = new FakeConnector("slow") {
                @Override
                public ConnectorHealth checkHealth() {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.checkHealth();
                }
            }.timeout(Duration.ofMillis(100));

            assertThat(registryOf(slow).healthCheckAll()).containsEntry("slow", false);
        }

        @Test
        @DisplayName("hung health checks share one timeout window instead of adding up")
        void hungChecksShareTimeout() {
            Duration timeout = Duration.ofMillis(500);
            ConnectorRegistry registry = registryOf(
                    hungHealthCheck("a", timeout), hungHealthCheck("b", timeout), hungHealthCheck("c", timeout));
            long started = System.nanoTime();

            Map<String, Boolean> health = registry.healthCheckAll();

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1_000));
            assertThat(health).containsExactly(entry("a", false), entry("b", false), entry("c", false));
        }

        @Test
        @DisplayName("a turn deadline shorter than the connector timeout bounds the health check")
        void deadlineBoundsHealthCheck() {
            ConnectorRegistry registry = registryOf(hungHealthCheck("slow", Duration.ofSeconds(4)));
            long started = System.nanoTime();

            List<ConnectorHealth> health = registry.checkHealth(Instant.now().plusMillis(200));

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
            assertThat(health).extracting(ConnectorHealth::isReachable).containsExactly(false);
        }

        @Test
        @DisplayName("is recomputed on every call")
        void notCached() {
            FakeConnector connector = new FakeConnector("prometheus");
            ConnectorRegistry registry = registryOf(connector);

            registry.checkHealth();
            registry.checkHealth();

            assertThat(connector.getHealthChecks()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("fanOut")
    class FanOut {

        @Test
        @DisplayName("returns one entry per healthy connector and skips unhealthy ones")
        void healthyOnly() {
            FakeConnector up = new FakeConnector("prometheus").alerts(List.of(alert("A")));
            FakeConnector down = new FakeConnector("azure_monitor").healthy(false).alerts(List.of(alert("B")));
            ConnectorRegistry registry = registryOf(up, down);

            Map<String, ConnectorOutcome<AlertRecord>> results =
                    registry.fanOut("alerts", MonitoringConnector::listActiveAlerts, null);

            assertThat(results).containsOnlyKeys("prometheus");
            assertThat(results.get("prometheus").getItems()).extracting(AlertRecord::getName).containsExactly("A");
        }

        @Test
        @DisplayName("a slow connector times out without holding back the others")
        void timeoutIsolated() {
            // Given
            FakeConnector fast = new FakeConnector("prometheus").alerts(List.of(alert("A"), alert("B")));
            FakeConnector slow = new FakeConnector("azure_monitor")
                    .timeout(Duration.ofMillis(200))
                    .delay(Duration.ofSeconds(3))
                    .alerts(List.of(alert("C")));
            ConnectorRegistry registry = registryOf(fast, slow);
            long started = System.nanoTime();

            // When
            Map<String, ConnectorOutcome<AlertRecord>> results =
                    registry.fanOut("alerts", MonitoringConnector::listActiveAlerts, null);

            // Then
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
            assertThat(results.get("prometheus").getItems()).hasSize(2);
            assertThat(results.get("azure_monitor").isFailed()).isTrue();
            assertThat(results.get("azure_monitor").getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
            assertThat(ConnectorOutcome.merge(results.values())).extracting(AlertRecord::getName)
                    .containsExactly("A", "B");
        }

        @Test
        @DisplayName("an exception becomes a failed outcome for that connector only")
        void exceptionIsolated() {
            FakeConnector broken = new FakeConnector("prometheus").failing(new IllegalStateException("boom"));
            FakeConnector fine = new FakeConnector("azure_monitor").services(List.of("vm: web"));
            ConnectorRegistry registry = registryOf(broken, fine);

            Map<String, ConnectorOutcome<String>> results =
                    registry.fanOut("services", MonitoringConnector::listServices, null);

            assertThat(results.get("prometheus").getFailureKind()).isEqualTo(FailureKind.BACKEND_ERROR);
            assertThat(results.get("prometheus").getCause()).contains("boom");
            assertThat(results.get("azure_monitor").getItems()).containsExactly("vm: web");
        }

        @Test
        @DisplayName("the shared deadline caps every connector's wait")
        void deadline() {
            FakeConnector slow = new FakeConnector("prometheus")
                    .timeout(Duration.ofSeconds(30))
                    .delay(Duration.ofSeconds(3));
            ConnectorRegistry registry = registryOf(slow);

            Map<String, ConnectorOutcome<String>> results = registry.fanOut("services",
                    registry.getConnectors(), MonitoringConnector::listServices, Instant.now().plusMillis(150));

            assertThat(results.get("prometheus").getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        }

        @Test
        @DisplayName("a null result counts as empty")
        void nullResult() {
            ConnectorRegistry registry = registryOf(new FakeConnector("prometheus"));

            Map<String, ConnectorOutcome<String>> results =
                    registry.fanOut("noop", connector -> null, null);

            assertThat(results.get("prometheus").getStatus()).isEqualTo(ConnectorOutcome.Status.EMPTY);
        }
    }

    @Test
    @DisplayName("looks connectors up by name")
    void lookup() {
        ConnectorRegistry registry = registryOf(new FakeConnector("prometheus"));

        assertThat(registry.getConnector("prometheus")).isPresent();
        assertThat(registry.getConnector("datadog")).isEmpty();
        assertThat(registry.getConnectorNames()).containsExactly("prometheus");
        assertThat(registry.isEmpty()).isFalse();
    }
}
