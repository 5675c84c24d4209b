package com.yugabyte.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Structured form of one user question. Built once per turn by the query parser.
 */
@Value
@Builder(toBuilder = true)
public class QueryDescriptor {
    @Builder.Default
    QueryIntent intent = QueryIntent.UNKNOWN;
    @Singular
    Set<String> metrics;
    @Singular
    Set<String> services;
    @Builder.Default
    TimeRange timeRange = TimeRange.DEFAULT;
    @Builder.Default
    Aggregation aggregation = Aggregation.AVG;
    @Singular
    Map<String, String> filters;
    @Builder.Default
    QueryKind kind = QueryKind.METRICS;
    String originalText;

    /**
     * Flat view used as message metadata and in logs.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("intent", intent.name().toLowerCase());
        map.put("metrics", metrics);
        map.put("services", services);
        map.put("time_range", timeRange.label());
        map.put("aggregation", aggregation.function());
        map.put("filters", filters);
        map.put("query_type", kind.name().toLowerCase());
        map.put("original_query", originalText);
        return map;
    }
}
