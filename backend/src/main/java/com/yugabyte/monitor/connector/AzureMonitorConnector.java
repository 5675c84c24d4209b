package com.yugabyte.monitor.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.exception.BackendQueryException;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.AlertSeverity;
import com.yugabyte.monitor.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Azure Monitor connector: Resource Manager metrics and alerts, plus Log Analytics for KQL.
 * <p>
 * Authenticates with the client-credentials grant. The bearer token is cached until five
 * minutes before it expires.
 */
@Slf4j
public class AzureMonitorConnector extends AbstractConnector {

    public static final String NAME = "azure_monitor";

    static final List<String> COMMON_METRICS = List.of(
            "Percentage CPU",
            "Network In Total",
            "Network Out Total",
            "Disk Read Bytes",
            "Disk Write Bytes",
            "Available Memory Bytes",
            "Total Requests",
            "Response Time",
            "Failed Requests",
            "Successful Requests",
            "CPU Credits Consumed",
            "CPU Credits Remaining",
            "Data Disk IOPS Consumed Percentage",
            "OS Disk IOPS Consumed Percentage");

    static final int MAX_SERVICES = 50;
    static final int MAX_SEARCHED_RESOURCES = 5;
    static final int MAX_RESOURCE_PAGES = 20;

    private static final String MANAGEMENT_RESOURCE = "https://management.azure.com/";
    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(5);

    private final MonitorProperties.Azure properties;
    private final AzureQueryTranslator translator;

    private String accessToken;
    private Instant tokenExpiresAt;

    public AzureMonitorConnector(MonitorProperties.Azure properties, WebClient.Builder builder, Clock clock) {
        super(NAME, builder.clone().build(), properties.getTimeout(), properties.getHealthTimeout(), clock);
        this.properties = properties;
        this.translator = new AzureQueryTranslator(COMMON_METRICS);
    }

    /**
     * Return the cached bearer token, fetching a new one when missing or about to expire.
     */
    synchronized String getAccessToken() {
        Instant now = clock.instant();
        if (accessToken != null && tokenExpiresAt != null && now.isBefore(tokenExpiresAt)) {
            return accessToken;
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", properties.getClientId());
        form.add("client_secret", properties.getClientSecret());
        form.add("resource", MANAGEMENT_RESOURCE);

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getLoginUrl())
                .pathSegment(properties.getTenantId(), "oauth2", "token")
                .build()
                .toUri();
        JsonNode body = exchangeJson(webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form)), getTimeout());

        String token = text(body, "access_token", null);
        if (token == null) {
            throw new BackendQueryException(getName(), "token response without access_token");
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        accessToken = token;
        tokenExpiresAt = now.plusSeconds(expiresIn).minus(TOKEN_EXPIRY_MARGIN);
        log.info("Obtained Azure access token, valid until {}", tokenExpiresAt);
        return accessToken;
    }

    @Override
    protected boolean probe() {
        String token = getAccessToken();
        return exchangeOk(webClient.get()
                .uri(managementUri("/subscriptions/" + properties.getSubscriptionId(), Map.of("api-version", "2020-01-01")))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }

    /**
     * Route by query shape: per-resource metrics when a resource id is given, Log Analytics for
     * KQL pipelines, otherwise a search over resources matching the requested services.
     */
    @Override
    public ConnectorOutcome<MetricSample> queryMetrics(String query, QueryOptions options) {
        return guard("query", () -> {
            if (options.getResourceId() != null) {
                return resourceMetrics(options.getResourceId(), query, options);
            }
            if (query.contains("|") || query.startsWith("Heartbeat")) {
                return runKql(query, options);
            }
            return searchAndQuery(query, options);
        });
    }

    private List<MetricSample> resourceMetrics(String resourceId, String metricNames, QueryOptions options) {
        Instant end = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant start = end.minus(options.getTimeRange().getDuration());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("api-version", "2018-01-01");
        params.put("metricnames", metricNames);
        params.put("timespan", start + "/" + end);
        params.put("interval", options.getInterval());
        params.put("aggregation", options.getAggregation().azureName());

        JsonNode body = exchangeJson(webClient.get()
                .uri(managementUri(resourceId + "/providers/Microsoft.Insights/metrics", params))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + getAccessToken()), getTimeout());
        return parseMetrics(body, resourceId);
    }

    List<MetricSample> parseMetrics(JsonNode body, String resourceId) {
        List<MetricSample> samples = new ArrayList<>();
        String[] segments = resourceId.split("/");
        String resourceType = segments.length >= 2 ? segments[segments.length - 2] : "unknown";
        String resourceName = segments.length >= 1 ? segments[segments.length - 1] : "unknown";
        for (JsonNode metric : body.path("value")) {
            String metricName = metric.path("name").path("value").asText("unknown");
            String unit = convertUnit(metric.path("unit").asText("Count"));
            for (JsonNode series : metric.path("timeseries")) {
                Map<String, String> labels = new LinkedHashMap<>();
                for (JsonNode dimension : series.path("metadatavalues")) {
                    String key = dimension.path("name").path("value").asText("");
                    String value = dimension.path("value").asText("");
                    if (!key.isEmpty() && !value.isEmpty()) {
                        labels.put(key, value);
                    }
                }
                labels.put("resource_id", resourceId);
                labels.put("resource_type", resourceType);
                labels.put("resource_name", resourceName);
                for (JsonNode point : series.path("data")) {
                    String stamp = point.path("timeStamp").asText(null);
                    JsonNode value = firstPresent(point, "average", "maximum", "minimum", "total");
                    if (stamp == null || value == null) {
                        continue;
                    }
                    Instant timestamp = parseInstant(stamp);
                    if (timestamp == null) {
                        continue;
                    }
                    samples.add(MetricSample.builder()
                            .name(metricName)
                            .value(value.asDouble())
                            .timestamp(timestamp)
                            .labels(labels)
                            .unit(unit)
                            .build());
                }
            }
        }
        return samples;
    }

    private List<MetricSample> runKql(String query, QueryOptions options) {
        String workspace = options.getWorkspaceId() != null ? options.getWorkspaceId() : properties.getWorkspaceId();
        if (workspace == null || workspace.isBlank()) {
            log.warn("No Log Analytics workspace configured, skipping KQL query");
            return List.of();
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getLogAnalyticsUrl())
                .pathSegment("v1", "workspaces", workspace, "query")
                .build()
                .toUri();
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("timespan", options.getTimeRange().getDuration().toString());
        JsonNode body = exchangeJson(webClient.post()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + getAccessToken())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload), getTimeout());
        return parseKqlResult(body);
    }

    /**
     * Turn Log Analytics tables into samples: the first datetime column is the timestamp, the last
     * numeric non-time column the value, and every other column a label.
     */
    List<MetricSample> parseKqlResult(JsonNode body) {
        List<MetricSample> samples = new ArrayList<>();
        for (JsonNode table : body.path("tables")) {
            JsonNode columns = table.path("columns");
            int timeColumn = -1;
            int valueColumn = -1;
            for (int i = 0; i < columns.size(); i++) {
                String columnName = columns.get(i).path("name").asText("").toLowerCase(Locale.ROOT);
                String type = columns.get(i).path("type").asText("");
                if ("datetime".equals(type) && timeColumn < 0) {
                    timeColumn = i;
                } else if (("real".equals(type) || "long".equals(type) || "int".equals(type))
                        && !columnName.contains("time")) {
                    valueColumn = i;
                }
            }
            if (timeColumn < 0 || valueColumn < 0) {
                log.debug("KQL table without time/value columns, skipping");
                continue;
            }
            for (JsonNode row : table.path("rows")) {
                if (row.size() <= Math.max(timeColumn, valueColumn) || !row.get(valueColumn).isNumber()) {
                    continue;
                }
                Instant timestamp = parseInstant(row.get(timeColumn).asText());
                if (timestamp == null) {
                    continue;
                }
                Map<String, String> labels = new LinkedHashMap<>();
                for (int i = 0; i < columns.size() && i < row.size(); i++) {
                    if (i != timeColumn && i != valueColumn) {
                        labels.put(columns.get(i).path("name").asText("col_" + i), row.get(i).asText());
                    }
                }
                samples.add(MetricSample.builder()
                        .name("kql_result")
                        .value(row.get(valueColumn).asDouble())
                        .timestamp(timestamp)
                        .labels(labels)
                        .unit("count")
                        .build());
            }
        }
        return samples;
    }

    private List<MetricSample> searchAndQuery(String metricNames, QueryOptions options) {
        if (options.getServices().isEmpty()) {
            log.info("No services requested, skipping Azure resource search for '{}'", metricNames);
            return List.of();
        }
        List<JsonNode> matches = new ArrayList<>();
        for (JsonNode resource : listResources()) {
            if (matchesAny(resource, options.getServices())) {
                matches.add(resource);
                if (matches.size() == MAX_SEARCHED_RESOURCES) {
                    break;
                }
            }
        }
        log.info("Resource search for {} matched {} resource(s)", options.getServices(), matches.size());

        List<MetricSample> samples = new ArrayList<>();
        for (JsonNode resource : matches) {
            String resourceId = resource.path("id").asText();
            try {
                samples.addAll(resourceMetrics(resourceId, metricNames, options));
            } catch (RuntimeException e) {
                log.warn("Metrics for resource {} failed: {}", resourceId, describe(e));
            }
        }
        return samples;
    }

    private static boolean matchesAny(JsonNode resource, Iterable<String> services) {
        String name = resource.path("name").asText("").toLowerCase(Locale.ROOT);
        String label = displayName(resource).toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return false;
        }
        for (String service : services) {
            String wanted = service.toLowerCase(Locale.ROOT);
            if (wanted.equals(label) || wanted.equals(name) || name.contains(wanted)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resources of the subscription, following {@code nextLink} for at most {@link #MAX_RESOURCE_PAGES}
     * pages and never revisiting a link.
     */
    private List<JsonNode> listResources() {
        List<JsonNode> resources = new ArrayList<>();
        Set<URI> visited = new HashSet<>();
        URI next = managementUri("/subscriptions/" + properties.getSubscriptionId() + "/resources",
                Map.of("api-version", "2021-04-01"));
        while (next != null && visited.add(next)) {
            if (visited.size() > MAX_RESOURCE_PAGES) {
                log.warn("Resource listing stopped after {} pages", MAX_RESOURCE_PAGES);
                break;
            }
            JsonNode page = exchangeJson(webClient.get()
                    .uri(next)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + getAccessToken()), getTimeout());
            page.path("value").forEach(resources::add);
            String nextLink = text(page, "nextLink", null);
            next = nextLink != null ? URI.create(nextLink) : null;
        }
        return resources;
    }

    @Override
    public ConnectorOutcome<AlertRecord> listActiveAlerts() {
        return guard("alerts", () -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("api-version", "2019-05-05-preview");
            params.put("alertState", "New,Acknowledged");
            JsonNode body = exchangeJson(webClient.get()
                    .uri(managementUri("/subscriptions/" + properties.getSubscriptionId()
                            + "/providers/Microsoft.AlertsManagement/alerts", params))
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + getAccessToken()), getTimeout());
            return parseAlerts(body);
        });
    }

    List<AlertRecord> parseAlerts(JsonNode body) {
        List<AlertRecord> alerts = new ArrayList<>();
        for (JsonNode alert : body.path("value")) {
            JsonNode properties = alert.path("properties");
            JsonNode essentials = properties.path("essentials");
            Map<String, String> labels = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = essentials.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode()) {
                    labels.put(field.getKey(), field.getValue().asText());
                }
            }
            Instant fired = parseInstant(essentials.path("firedDateTime").asText(""));
            alerts.add(AlertRecord.builder()
                    .name(text(essentials, "alertRule", "Unknown"))
                    .severity(AlertSeverity.fromAzure(text(essentials, "severity", "Sev3")))
                    .description(properties.path("context").path("description").asText(""))
                    .service(text(essentials, "targetResourceName", "unknown"))
                    .timestamp(fired != null ? fired : clock.instant())
                    .labels(labels)
                    .build());
        }
        return alerts;
    }

    @Override
    public ConnectorOutcome<String> listServices() {
        return guard("services", () -> {
            TreeSet<String> names = new TreeSet<>();
            for (JsonNode resource : listResources()) {
                if (!resource.path("type").asText("").isEmpty() && !resource.path("name").asText("").isEmpty()) {
                    names.add(displayName(resource));
                }
            }
            return names.stream().limit(MAX_SERVICES).collect(Collectors.toList());
        });
    }

    @Override
    public ConnectorOutcome<String> listMetricNames() {
        return ConnectorOutcome.success(COMMON_METRICS);
    }

    @Override
    public BackendQueryTranslator getTranslator() {
        return translator;
    }

    private URI managementUri(String path, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getManagementUrl()).path(path);
        for (String key : params.keySet()) {
            builder.queryParam(key, "{" + key + "}");
        }
        return builder.encode().buildAndExpand(params).toUri();
    }

    private static String displayName(JsonNode resource) {
        String type = resource.path("type").asText("");
        String leaf = type.substring(type.lastIndexOf('/') + 1);
        return leaf + ": " + resource.path("name").asText("");
    }

    private static JsonNode firstPresent(JsonNode point, String... fields) {
        for (String field : fields) {
            JsonNode value = point.get(field);
            if (value != null && value.isNumber()) {
                return value;
            }
        }
        return null;
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable timestamp '{}'", value);
            return null;
        }
    }

    static String convertUnit(String unit) {
        switch (unit) {
            case "Percent":
                return "percent";
            case "Count":
                return "count";
            case "Bytes":
                return "bytes";
            case "Seconds":
                return "seconds";
            case "BytesPerSecond":
                return "bytes_per_second";
            case "CountPerSecond":
                return "per_second";
            case "Milliseconds":
                return "milliseconds";
            default:
                return unit.toLowerCase(Locale.ROOT);
        }
    }
}
