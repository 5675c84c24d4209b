package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.AlertSeverity;
import com.yugabyte.monitor.model.Aggregation;
import com.yugabyte.monitor.model.MetricSample;
import com.yugabyte.monitor.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PrometheusConnector")
class PrometheusConnectorTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_003_600L);

    private static final String VECTOR = "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
            + "{\"metric\":{\"__name__\":\"memory_usage_percent\",\"job\":\"checkout\"},\"value\":[1700003600.5,\"71.5\"]},"
            + "{\"metric\":{\"__name__\":\"memory_usage_percent\",\"job\":\"cart\"},\"value\":[1700003600,\"not-a-number\"]}"
            + "]}}";

    private MonitorProperties.Prometheus properties;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties.Prometheus();
        properties.setUrl("http://prom:9090");
        properties.setTimeout(Duration.ofSeconds(2));
        properties.setHealthTimeout(Duration.ofSeconds(1));
    }

    private PrometheusConnector connector(StubExchange stub) {
        return new PrometheusConnector(properties, stub.builder(), clock);
    }

    @Nested
    @DisplayName("queryMetrics")
    class QueryMetrics {

        @Test
        @DisplayName("parses an instant vector and skips unparsable values")
        void instantVector() {
            // Given
            StubExchange stub = new StubExchange(request -> StubExchange.json(VECTOR));

            // When
            ConnectorOutcome<MetricSample> outcome = connector(stub)
                    .queryMetrics("avg(memory_usage_percent)", QueryOptions.INSTANT);

            // Then
            assertThat(outcome.getStatus()).isEqualTo(ConnectorOutcome.Status.DATA);
            assertThat(outcome.getItems()).hasSize(1);
            MetricSample sample = outcome.getItems().get(0);
            assertThat(sample.getName()).isEqualTo("memory_usage_percent");
            assertThat(sample.getValue()).isEqualTo(71.5);
            assertThat(sample.getService()).isEqualTo("checkout");
            assertThat(sample.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1_700_003_600_500L));
            assertThat(sample.getUnit()).isEqualTo("bytes");
        }

        @Test
        @DisplayName("sends the expression unchanged as the query parameter")
        void queryParameter() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(VECTOR));

            connector(stub).queryMetrics("avg by (job) (memory_usage_percent{job=~\"checkout\"})", QueryOptions.INSTANT);

            ClientRequest request = stub.getRequests().get(0);
            assertThat(request.url().getPath()).isEqualTo("/api/v1/query");
            assertThat(request.url().getQuery())
                    .isEqualTo("query=avg by (job) (memory_usage_percent{job=~\"checkout\"})");
        }

        @Test
        @DisplayName("range options use query_range over the window")
        void rangeQuery() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(
                    "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
                            + "{\"metric\":{\"__name__\":\"up\",\"job\":\"api\"},"
                            + "\"values\":[[1700000000,\"1\"],[1700000030,\"0\"]]}]}}"));
            QueryOptions options = QueryOptions.builder()
                    .range(true)
                    .timeRange(TimeRange.parse("1h"))
                    .aggregation(Aggregation.RAW)
                    .build();

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("up", options);

            assertThat(outcome.getItems()).extracting(MetricSample::getValue).containsExactly(1.0, 0.0);
            ClientRequest request = stub.getRequests().get(0);
            assertThat(request.url().getPath()).isEqualTo("/api/v1/query_range");
            assertThat(request.url().getQuery())
                    .contains("start=1700000000", "end=1700003600", "step=30s");
        }

        @Test
        @DisplayName("a non-success status is a backend failure")
        void errorStatus() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(
                    "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}"));

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("sum(", QueryOptions.INSTANT);

            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.BACKEND_ERROR);
            assertThat(outcome.getItems()).isEmpty();
        }

        @Test
        @DisplayName("an HTTP error is a backend failure")
        void httpError() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(HttpStatus.BAD_REQUEST, "{}"));

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("up", QueryOptions.INSTANT);

            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.BACKEND_ERROR);
        }

        @Test
        @DisplayName("a refused connection is reported as unreachable")
        void refused() {
            StubExchange stub = new StubExchange(StubExchange::refused);

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("up", QueryOptions.INSTANT);

            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.UNREACHABLE);
        }

        @Test
        @DisplayName("a hanging backend is reported as a timeout")
        void timeout() {
            properties.setTimeout(Duration.ofMillis(100));
            StubExchange stub = new StubExchange(request -> StubExchange.hang());

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("up", QueryOptions.INSTANT);

            assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        }

        @Test
        @DisplayName("an empty result is an empty success")
        void emptyResult() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(
                    "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}"));

            ConnectorOutcome<MetricSample> outcome = connector(stub).queryMetrics("up", QueryOptions.INSTANT);

            assertThat(outcome.getStatus()).isEqualTo(ConnectorOutcome.Status.EMPTY);
        }
    }

    @Nested
    @DisplayName("listActiveAlerts")
    class ListActiveAlerts {

        @Test
        @DisplayName("reads active alerts from Alertmanager")
        void alertmanager() {
            // Given
            StubExchange stub = new StubExchange(request -> StubExchange.json("["
                    + "{\"labels\":{\"alertname\":\"HighMemory\",\"severity\":\"critical\",\"service\":\"checkout\",\"job\":\"node\"},"
                    + "\"annotations\":{\"summary\":\"Memory above 90%\"},"
                    + "\"startsAt\":\"2023-11-14T22:00:00Z\",\"status\":{\"state\":\"active\"}},"
                    + "{\"labels\":{\"alertname\":\"Quiet\",\"job\":\"node\"},"
                    + "\"status\":{\"state\":\"suppressed\"}}]"));

            // When
            ConnectorOutcome<AlertRecord> outcome = connector(stub).listActiveAlerts();

            // Then
            assertThat(outcome.getItems()).hasSize(1);
            AlertRecord alert = outcome.getItems().get(0);
            assertThat(alert.getName()).isEqualTo("HighMemory");
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getService()).isEqualTo("checkout");
            assertThat(alert.getDescription()).isEqualTo("Memory above 90%");
            assertThat(alert.getTimestamp()).isEqualTo(Instant.parse("2023-11-14T22:00:00Z"));

            ClientRequest request = stub.getRequests().get(0);
            assertThat(request.url().getPort()).isEqualTo(9093);
            assertThat(request.url().getPath()).isEqualTo("/api/v2/alerts");
        }

        @Test
        @DisplayName("falls back to the ALERTS series when Alertmanager is down")
        void fallback() {
            StubExchange stub = new StubExchange(request -> {
                if (request.url().getPort() == 9093) {
                    return StubExchange.refused(request);
                }
                return StubExchange.json("{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
                        + "{\"metric\":{\"__name__\":\"ALERTS\",\"alertname\":\"DiskFull\",\"severity\":\"page\","
                        + "\"job\":\"db\",\"alertstate\":\"firing\"},\"value\":[1700003600,\"1\"]}]}}");
            });

            ConnectorOutcome<AlertRecord> outcome = connector(stub).listActiveAlerts();

            assertThat(outcome.getItems()).singleElement().satisfies(alert -> {
                assertThat(alert.getName()).isEqualTo("DiskFull");
                assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
                assertThat(alert.getService()).isEqualTo("db");
            });
            assertThat(stub.requestsTo("/api/v1/query")).hasSize(1);
        }
    }

    @Test
    @DisplayName("listServices returns sorted job label values")
    void listServices() {
        StubExchange stub = new StubExchange(request ->
                StubExchange.json("{\"status\":\"success\",\"data\":[\"payments\",\"checkout\",\"\"]}"));

        ConnectorOutcome<String> outcome = connector(stub).listServices();

        assertThat(outcome.getItems()).containsExactly("checkout", "payments");
        assertThat(stub.getRequests().get(0).url().getPath()).isEqualTo("/api/v1/label/job/values");
    }

    @Test
    @DisplayName("health reflects the liveness probe status")
    void health() {
        StubExchange up = new StubExchange(request -> StubExchange.json(VECTOR));
        StubExchange down = new StubExchange(request -> StubExchange.json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
        StubExchange refused = new StubExchange(StubExchange::refused);

        assertThat(connector(up).checkHealth().isReachable()).isTrue();
        assertThat(connector(down).checkHealth().isReachable()).isFalse();
        assertThat(connector(refused).checkHealth().isReachable()).isFalse();
        assertThat(connector(up).checkHealth().getCheckedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("credentials are sent as basic auth")
    void basicAuth() {
        properties.setUsername("grafana");
        properties.setPassword("secret");
        StubExchange stub = new StubExchange(request -> StubExchange.json(VECTOR));

        connector(stub).queryMetrics("up", QueryOptions.INSTANT);

        assertThat(stub.getRequests().get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).startsWith("Basic ");
    }

    @Test
    @DisplayName("units are inferred from metric names")
    void inferUnit() {
        assertThat(PrometheusConnector.inferUnit("node_memory_MemFree_bytes")).isEqualTo("bytes");
        assertThat(PrometheusConnector.inferUnit("http_request_duration_seconds")).isEqualTo("seconds");
        assertThat(PrometheusConnector.inferUnit("requests_rps")).isEqualTo("per_second");
        assertThat(PrometheusConnector.inferUnit("cpu_usage_percent")).isEqualTo("percent");
        assertThat(PrometheusConnector.inferUnit("http_requests_total")).isEqualTo("count");
        assertThat(PrometheusConnector.inferUnit("up")).isEqualTo("unknown");
    }
}
