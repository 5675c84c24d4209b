package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.Aggregation;
import com.yugabyte.monitor.model.TimeRange;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Backend-neutral options that accompany a native query.
 */
@Value
@Builder
public class QueryOptions {

    public static final QueryOptions INSTANT = QueryOptions.builder().build();

    @Builder.Default
    TimeRange timeRange = TimeRange.DEFAULT;
    /** Range query over {@link #timeRange} instead of an instant query. */
    boolean range;
    /** Prometheus range step, e.g. {@code 30s}. Null uses the connector default. */
    String step;
    @Builder.Default
    Aggregation aggregation = Aggregation.AVG;
    /** Azure resource id; selects the per-resource metrics endpoint. */
    String resourceId;
    /** Log Analytics workspace; null uses the connector default. */
    String workspaceId;
    /** Azure metrics interval, ISO-8601. */
    @Builder.Default
    String interval = "PT1M";
    /** Requested services, used by the best-effort resource search. */
    @Singular
    Set<String> services;
}
