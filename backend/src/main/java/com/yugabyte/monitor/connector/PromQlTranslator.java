package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.Aggregation;
import com.yugabyte.monitor.model.QueryDescriptor;
import com.yugabyte.monitor.model.QueryIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a parsed question onto a PromQL expression.
 * <p>
 * Priority: firing alerts, liveness, the canonical expression of a cpu/memory/network question,
 * then the first requested metric. Service filters become a {@code job=~"a|b"} matcher and any
 * aggregation other than raw wraps the expression, grouped by job when services are filtered.
 */
@Slf4j
public class PromQlTranslator implements BackendQueryTranslator {

    public static final String FIRING_ALERTS = "ALERTS{alertstate=\"firing\"}";
    public static final String LIVENESS = "up";

    static final String CPU_METRIC = "cpu_usage_percent";
    static final String CPU_RATE = "rate(cpu_seconds_total[5m]) * 100";
    static final String MEMORY_METRIC = "memory_usage_percent";
    static final String MEMORY_FALLBACK = "memory_working_set_bytes";
    static final String NETWORK_RATE = "rate(network_receive_bytes_total[5m])";

    private static final String SERVICE_LABEL = "job";

    private final String step;

    public PromQlTranslator(String step) {
        this.step = step;
    }

    @Override
    public Optional<TranslatedQuery> translate(QueryDescriptor descriptor) {
        String query = toPromQl(descriptor);
        log.debug("Translated '{}' to PromQL: {}", descriptor.getOriginalText(), query);
        QueryOptions options = QueryOptions.builder()
                .timeRange(descriptor.getTimeRange())
                .aggregation(descriptor.getAggregation())
                // raw series are read over the whole window
                .range(descriptor.getAggregation() == Aggregation.RAW)
                .step(step)
                .build();
        return Optional.of(new TranslatedQuery(query, options));
    }

    public String toPromQl(QueryDescriptor descriptor) {
        QueryIntent intent = descriptor.getIntent();
        Set<String> metrics = descriptor.getMetrics();
        String text = descriptor.getOriginalText() != null
                ? descriptor.getOriginalText().toLowerCase(Locale.ROOT) : "";

        if (intent == QueryIntent.ALERTS) {
            return FIRING_ALERTS;
        }
        if (intent == QueryIntent.HEALTH || text.contains("health")) {
            return LIVENESS;
        }

        String base;
        if (intent == QueryIntent.CPU || mentions(metrics, "cpu")) {
            base = metrics.contains(CPU_METRIC) ? CPU_METRIC : CPU_RATE;
        } else if (intent == QueryIntent.MEMORY || mentions(metrics, "memory")) {
            base = metrics.contains(MEMORY_METRIC) ? MEMORY_METRIC : MEMORY_FALLBACK;
        } else if (intent == QueryIntent.NETWORK || mentions(metrics, "network")) {
            base = NETWORK_RATE;
        } else {
            base = metrics.isEmpty() ? LIVENESS : metrics.iterator().next();
        }

        Set<String> services = descriptor.getServices();
        if (!services.isEmpty()) {
            base = withServiceFilter(base, services);
        }

        Aggregation aggregation = descriptor.getAggregation();
        if (aggregation != Aggregation.RAW) {
            if (!services.isEmpty()) {
                base = aggregation.function() + " by (" + SERVICE_LABEL + ") (" + base + ")";
            } else {
                base = aggregation.function() + "(" + base + ")";
            }
        }
        return base;
    }

    /**
     * Insert a regex matcher into the first selector braces, or append new braces to a bare selector.
     */
    static String withServiceFilter(String expression, Set<String> services) {
        String alternation = services.stream()
                .map(PromQlTranslator::escape)
                .collect(Collectors.joining("|"));
        String matcher = SERVICE_LABEL + "=~\"" + alternation + "\"";
        int brace = expression.indexOf('{');
        if (brace >= 0) {
            boolean emptyBraces = expression.startsWith("}", brace + 1);
            return expression.substring(0, brace + 1) + matcher + (emptyBraces ? "" : ",")
                    + expression.substring(brace + 1);
        }
        int bracket = expression.indexOf('[');
        if (bracket >= 0) {
            // range selector inside a function call: rate(metric[5m])
            return expression.substring(0, bracket) + "{" + matcher + "}" + expression.substring(bracket);
        }
        return expression + "{" + matcher + "}";
    }

    private static boolean mentions(Set<String> metrics, String domain) {
        return metrics.stream().anyMatch(m -> m.toLowerCase(Locale.ROOT).contains(domain));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
