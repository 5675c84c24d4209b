package com.yugabyte.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword dictionaries of the deterministic query parser, as read from {@code query-patterns.json}.
 * Map iteration order is significant: the first matching entry wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryPatterns {

    /** Metric category (cpu, memory, ...) to the phrases that signal it. */
    private Map<String, List<String>> categories = new LinkedHashMap<>();
    /** Compact time range ({@code 1h}) to the phrases that signal it. */
    private Map<String, List<String>> timePhrases = new LinkedHashMap<>();
    /** Aggregation function ({@code avg}) to its words. */
    private Map<String, List<String>> aggregations = new LinkedHashMap<>();
    private List<String> alertWords = new ArrayList<>();
    private List<String> healthWords = new ArrayList<>();
    private List<String> serviceListingPhrases = new ArrayList<>();
    /** Words that introduce a service name, e.g. {@code service 'checkout'}. */
    private List<String> serviceKeywords = new ArrayList<>();

    public boolean isComplete() {
        return !categories.isEmpty() && !timePhrases.isEmpty() && !aggregations.isEmpty()
                && !alertWords.isEmpty() && !healthWords.isEmpty();
    }

    public static QueryPatterns defaults() {
        QueryPatterns patterns = new QueryPatterns();
        Map<String, List<String>> categories = patterns.getCategories();
        categories.put("cpu", List.of("cpu", "processor", "computation"));
        categories.put("memory", List.of("memory", "ram", "mem"));
        categories.put("disk", List.of("disk", "storage", "io", "filesystem"));
        categories.put("network", List.of("network", "net", "bandwidth", "traffic"));
        categories.put("latency", List.of("latency", "response time", "delay"));
        categories.put("throughput", List.of("throughput", "requests per second", "rps", "qps"));
        categories.put("errors", List.of("error", "errors", "failure", "failures", "exception", "fault"));

        Map<String, List<String>> time = patterns.getTimePhrases();
        time.put("1m", List.of("last minute", "60s"));
        time.put("1h", List.of("last hour", "hour ago"));
        time.put("24h", List.of("today", "last day", "day ago"));
        time.put("7d", List.of("this week", "last week", "week ago"));

        Map<String, List<String>> aggregations = patterns.getAggregations();
        aggregations.put("avg", List.of("average", "avg", "mean"));
        aggregations.put("sum", List.of("sum", "total"));
        aggregations.put("max", List.of("max", "maximum", "peak", "highest"));
        aggregations.put("min", List.of("min", "minimum", "lowest"));
        aggregations.put("raw", List.of("raw", "every sample", "all samples"));

        patterns.setAlertWords(new ArrayList<>(List.of("alert", "alerts", "alarm", "alarms", "firing", "incident", "incidents")));
        patterns.setHealthWords(new ArrayList<>(List.of("health", "healthy", "status", "uptime", "online", "offline")));
        patterns.setServiceListingPhrases(new ArrayList<>(List.of("list services", "list all services",
                "what services", "which services", "show services", "show me services", "show all services",
                "available services", "services are", "all services", "list applications", "what applications")));
        patterns.setServiceKeywords(new ArrayList<>(List.of("service", "app", "application", "pod", "container", "instance")));
        return patterns;
    }
}
