package com.yugabyte.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single metric observation produced by a connector.
 */
@Value
@Builder
public class MetricSample {
    String name;
    double value;
    Instant timestamp;
    @Singular
    Map<String, String> labels;
    String unit;

    /**
     * Service the sample belongs to: the {@code job} label, else the {@code resource_name} label,
     * else the last segment of {@code resource_id}.
     */
    public String getService() {
        String job = labels.get("job");
        if (job != null && !job.isEmpty()) {
            return job;
        }
        String resourceName = labels.get("resource_name");
        if (resourceName != null && !resourceName.isEmpty()) {
            return resourceName;
        }
        String resourceId = labels.get("resource_id");
        if (resourceId != null && !resourceId.isEmpty()) {
            return resourceId.substring(resourceId.lastIndexOf('/') + 1);
        }
        return "unknown";
    }
}
