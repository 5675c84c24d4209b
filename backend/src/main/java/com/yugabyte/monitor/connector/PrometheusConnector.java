package com.yugabyte.monitor.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.exception.BackendQueryException;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.AlertSeverity;
import com.yugabyte.monitor.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Prometheus HTTP API connector. Active alerts come from Alertmanager, with the
 * {@code ALERTS} series as fallback when Alertmanager is unreachable.
 */
@Slf4j
public class PrometheusConnector extends AbstractConnector {

    public static final String NAME = "prometheus";

    private static final String QUERY_PATH = "/api/v1/query";
    private static final String QUERY_RANGE_PATH = "/api/v1/query_range";
    private static final String JOB_VALUES_PATH = "/api/v1/label/job/values";
    private static final String METRIC_NAMES_PATH = "/api/v1/label/__name__/values";
    private static final String ALERTS_PATH = "/api/v2/alerts";

    private final String alertmanagerUrl;
    private final String defaultStep;
    private final PromQlTranslator translator;

    public PrometheusConnector(MonitorProperties.Prometheus properties, WebClient.Builder builder, Clock clock) {
        super(NAME, buildClient(properties, builder), properties.getTimeout(), properties.getHealthTimeout(), clock);
        this.alertmanagerUrl = properties.resolveAlertmanagerUrl();
        this.defaultStep = properties.getStep();
        this.translator = new PromQlTranslator(properties.getStep());
    }

    private static WebClient buildClient(MonitorProperties.Prometheus properties, WebClient.Builder builder) {
        WebClient.Builder configured = builder.clone().baseUrl(properties.getUrl());
        if (properties.hasCredentials()) {
            configured.defaultHeaders(headers -> headers.setBasicAuth(properties.getUsername(), properties.getPassword()));
        }
        return configured.build();
    }

    @Override
    protected boolean probe() {
        return exchangeOk(webClient.get()
                .uri(b -> b.path(QUERY_PATH).queryParam("query", "{q}").build(PromQlTranslator.LIVENESS)));
    }

    @Override
    public ConnectorOutcome<MetricSample> queryMetrics(String query, QueryOptions options) {
        return guard("query", () -> runQuery(query, options));
    }

    private List<MetricSample> runQuery(String query, QueryOptions options) {
        WebClient.RequestHeadersSpec<?> request;
        if (options.isRange()) {
            Instant end = clock.instant();
            Instant start = end.minus(options.getTimeRange().getDuration());
            String step = options.getStep() != null ? options.getStep() : defaultStep;
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("q", query);
            params.put("start", start.getEpochSecond());
            params.put("end", end.getEpochSecond());
            params.put("step", step);
            request = webClient.get().uri(b -> b.path(QUERY_RANGE_PATH)
                    .queryParam("query", "{q}")
                    .queryParam("start", "{start}")
                    .queryParam("end", "{end}")
                    .queryParam("step", "{step}")
                    .build(params));
        } else {
            request = webClient.get().uri(b -> b.path(QUERY_PATH).queryParam("query", "{q}").build(query));
        }
        return parseQueryResponse(exchangeJson(request, getTimeout()));
    }

    List<MetricSample> parseQueryResponse(JsonNode body) {
        if (!"success".equals(body.path("status").asText())) {
            throw new BackendQueryException(getName(), "query status " + body.path("status").asText("missing")
                    + ": " + body.path("error").asText(""));
        }
        List<MetricSample> samples = new ArrayList<>();
        for (JsonNode series : body.path("data").path("result")) {
            Map<String, String> labels = labels(series.path("metric"));
            String metricName = labels.getOrDefault("__name__", "unknown");
            if (series.has("value")) {
                addPoint(samples, metricName, labels, series.get("value"));
            } else if (series.has("values")) {
                for (JsonNode point : series.get("values")) {
                    addPoint(samples, metricName, labels, point);
                }
            }
        }
        return samples;
    }

    private static void addPoint(List<MetricSample> samples, String name, Map<String, String> labels, JsonNode point) {
        if (!point.isArray() || point.size() < 2) {
            return;
        }
        double value;
        try {
            value = Double.parseDouble(point.get(1).asText());
        } catch (NumberFormatException e) {
            log.debug("Skipping unparsable sample value '{}' for {}", point.get(1).asText(), name);
            return;
        }
        long millis = Math.round(point.get(0).asDouble() * 1000);
        samples.add(MetricSample.builder()
                .name(name)
                .value(value)
                .timestamp(Instant.ofEpochMilli(millis))
                .labels(labels)
                .unit(inferUnit(name))
                .build());
    }

    @Override
    public ConnectorOutcome<AlertRecord> listActiveAlerts() {
        return guard("alerts", () -> {
            try {
                return fetchAlertmanagerAlerts();
            } catch (RuntimeException e) {
                log.warn("Alertmanager at {} unavailable ({}), falling back to ALERTS series",
                        alertmanagerUrl, describe(e));
            }
            List<AlertRecord> alerts = new ArrayList<>();
            for (MetricSample sample : runQuery(PromQlTranslator.FIRING_ALERTS, QueryOptions.INSTANT)) {
                Map<String, String> labels = sample.getLabels();
                alerts.add(AlertRecord.builder()
                        .name(labels.getOrDefault("alertname", "Unknown"))
                        .severity(AlertSeverity.fromLabel(labels.get("severity")))
                        .description(labels.getOrDefault("description", ""))
                        .service(serviceOf(labels))
                        .timestamp(sample.getTimestamp())
                        .labels(labels)
                        .build());
            }
            return alerts;
        });
    }

    private List<AlertRecord> fetchAlertmanagerAlerts() {
        URI uri = UriComponentsBuilder.fromHttpUrl(alertmanagerUrl)
                .path(ALERTS_PATH)
                .queryParam("active", "true")
                .queryParam("silenced", "false")
                .queryParam("inhibited", "false")
                .build()
                .toUri();
        JsonNode body = exchangeJson(webClient.get().uri(uri), getHealthTimeout());
        // v2 returns a bare array, v1 wraps it in "data"
        JsonNode items = body.isArray() ? body : body.path("data");
        List<AlertRecord> alerts = new ArrayList<>();
        for (JsonNode alert : items) {
            String state = alert.path("status").path("state").asText("active");
            if (!"active".equals(state)) {
                continue;
            }
            Map<String, String> labels = labels(alert.path("labels"));
            JsonNode annotations = alert.path("annotations");
            String description = text(annotations, "description", text(annotations, "summary", ""));
            alerts.add(AlertRecord.builder()
                    .name(labels.getOrDefault("alertname", "Unknown"))
                    .severity(AlertSeverity.fromLabel(labels.get("severity")))
                    .description(description)
                    .service(serviceOf(labels))
                    .timestamp(parseInstant(alert.path("startsAt").asText(null)))
                    .labels(labels)
                    .build());
        }
        return alerts;
    }

    @Override
    public ConnectorOutcome<String> listServices() {
        return guard("services", () -> new ArrayList<>(new TreeSet<>(
                stringValues(exchangeJson(webClient.get().uri(JOB_VALUES_PATH), getTimeout())))));
    }

    @Override
    public ConnectorOutcome<String> listMetricNames() {
        return guard("metric names", () ->
                stringValues(exchangeJson(webClient.get().uri(METRIC_NAMES_PATH), getTimeout())));
    }

    @Override
    public BackendQueryTranslator getTranslator() {
        return translator;
    }

    @Override
    public String livenessQuery() {
        return PromQlTranslator.LIVENESS;
    }

    private List<String> stringValues(JsonNode body) {
        if (!"success".equals(body.path("status").asText())) {
            throw new BackendQueryException(getName(), "label values status " + body.path("status").asText("missing"));
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : body.path("data")) {
            if (!value.asText().isEmpty()) {
                values.add(value.asText());
            }
        }
        return values;
    }

    private Instant parseInstant(String value) {
        if (value == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable alert start time '{}'", value);
            return clock.instant();
        }
    }

    private static Map<String, String> labels(JsonNode node) {
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return labels;
    }

    private static String serviceOf(Map<String, String> labels) {
        String service = labels.get("service");
        if (service == null || service.isEmpty()) {
            service = labels.getOrDefault("job", "unknown");
        }
        return service;
    }

    /**
     * Guess the unit from naming conventions of the metric.
     */
    static String inferUnit(String metricName) {
        String name = metricName.toLowerCase(Locale.ROOT);
        if (containsAny(name, "bytes", "size", "memory")) {
            return "bytes";
        }
        if (containsAny(name, "duration", "time", "latency")) {
            return "seconds";
        }
        if (containsAny(name, "rate", "rps", "qps")) {
            return "per_second";
        }
        if (containsAny(name, "percent", "ratio")) {
            return "percent";
        }
        if (containsAny(name, "count", "total", "num")) {
            return "count";
        }
        return "unknown";
    }

    private static boolean containsAny(String text, String... parts) {
        for (String part : parts) {
            if (text.contains(part)) {
                return true;
            }
        }
        return false;
    }
}
