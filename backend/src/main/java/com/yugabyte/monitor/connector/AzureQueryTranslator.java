package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.QueryDescriptor;
import com.yugabyte.monitor.model.QueryIntent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a parsed question onto an Azure Monitor request.
 * <p>
 * An explicit {@code kql} filter goes to Log Analytics, a {@code resource_id} filter to the
 * per-resource metrics endpoint. Otherwise the known metric names of the question (or the default
 * metrics of its category) are searched across resources that match the requested services.
 */
public class AzureQueryTranslator implements BackendQueryTranslator {

    public static final String KQL_FILTER = "kql";
    public static final String RESOURCE_FILTER = "resource_id";
    public static final String WORKSPACE_FILTER = "workspace_id";

    private static final Map<QueryIntent, String> CATEGORY_METRICS = new EnumMap<>(QueryIntent.class);

    static {
        CATEGORY_METRICS.put(QueryIntent.CPU, "Percentage CPU");
        CATEGORY_METRICS.put(QueryIntent.MEMORY, "Available Memory Bytes");
        CATEGORY_METRICS.put(QueryIntent.DISK, "Disk Read Bytes,Disk Write Bytes");
        CATEGORY_METRICS.put(QueryIntent.NETWORK, "Network In Total,Network Out Total");
        CATEGORY_METRICS.put(QueryIntent.LATENCY, "Response Time");
        CATEGORY_METRICS.put(QueryIntent.THROUGHPUT, "Total Requests");
        CATEGORY_METRICS.put(QueryIntent.ERRORS, "Failed Requests");
    }

    private final List<String> knownMetrics;

    public AzureQueryTranslator(List<String> knownMetrics) {
        this.knownMetrics = knownMetrics;
    }

    @Override
    public Optional<TranslatedQuery> translate(QueryDescriptor descriptor) {
        Map<String, String> filters = descriptor.getFilters();
        QueryOptions.QueryOptionsBuilder options = QueryOptions.builder()
                .timeRange(descriptor.getTimeRange())
                .aggregation(descriptor.getAggregation())
                .workspaceId(filters.get(WORKSPACE_FILTER));

        String kql = filters.get(KQL_FILTER);
        if (kql != null && !kql.isBlank()) {
            return Optional.of(new TranslatedQuery(kql, options.build()));
        }

        String metricNames = metricNames(descriptor);
        if (metricNames.isEmpty()) {
            return Optional.empty();
        }

        String resourceId = filters.get(RESOURCE_FILTER);
        if (resourceId != null && !resourceId.isBlank()) {
            return Optional.of(new TranslatedQuery(metricNames, options.resourceId(resourceId).build()));
        }
        if (descriptor.getServices().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TranslatedQuery(metricNames, options.services(descriptor.getServices()).build()));
    }

    private String metricNames(QueryDescriptor descriptor) {
        String requested = descriptor.getMetrics().stream()
                .filter(knownMetrics::contains)
                .collect(Collectors.joining(","));
        if (!requested.isEmpty()) {
            return requested;
        }
        return CATEGORY_METRICS.getOrDefault(descriptor.getIntent(), "");
    }
}
