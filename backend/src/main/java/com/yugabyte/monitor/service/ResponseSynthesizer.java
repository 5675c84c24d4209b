package com.yugabyte.monitor.service;

import com.yugabyte.monitor.client.LlmClient;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.LlmRequest;
import com.yugabyte.monitor.model.MetricSample;
import com.yugabyte.monitor.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the user-facing answer for merged metrics and alerts.
 * The language model phrases the answer; when it is unavailable a fixed sentence built from the counts is used.
 */
@Service
@Slf4j
public class ResponseSynthesizer {

    static final String SYSTEM_INSTRUCTION =
            "You are a monitoring assistant. Provide clear, concise responses about system metrics and alerts.";

    private static final int SUMMARY_NAMES = 5;
    private static final int SAMPLE_LINES = 3;

    private final LlmClient llmClient;

    @Autowired
    public ResponseSynthesizer(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    public String synthesize(String question, List<MetricSample> metrics, List<AlertRecord> alerts, TimeRange timeRange) {
        try {
            String answer = llmClient.complete(LlmRequest.builder()
                    .systemInstruction(SYSTEM_INSTRUCTION)
                    .prompt(buildPrompt(question, metrics, alerts, timeRange))
                    .maxTokens(500)
                    .temperature(0.3)
                    .build());
            log.debug("Synthesized answer of {} characters", answer.length());
            return answer;
        } catch (Exception e) {
            log.warn("Response synthesis failed ({}), using template answer", e.getMessage());
            return fallback(question, metrics, alerts);
        }
    }

    /**
     * Deterministic answer from the counts alone.
     */
    public String fallback(String question, List<MetricSample> metrics, List<AlertRecord> alerts) {
        if (!alerts.isEmpty()) {
            return "Found " + alerts.size() + " active alerts. The most critical ones need attention.";
        }
        if (!metrics.isEmpty()) {
            return "Retrieved " + metrics.size() + " metrics for your query. "
                    + "The data shows recent activity across your monitored services.";
        }
        return "No data found for query '" + question + "'. "
                + "Please check if the services are running and metrics are available.";
    }

    String buildPrompt(String question, List<MetricSample> metrics, List<AlertRecord> alerts, TimeRange timeRange) {
        Set<String> services = new LinkedHashSet<>();
        Set<String> metricNames = new LinkedHashSet<>();
        for (MetricSample metric : metrics) {
            services.add(metric.getService());
            metricNames.add(metric.getName());
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("User asked: \"").append(question).append("\"\n\n");
        prompt.append("Data summary:\n");
        prompt.append("- Found ").append(metrics.size()).append(" metrics\n");
        prompt.append("- Found ").append(alerts.size()).append(" alerts\n");
        prompt.append("- Services: ").append(firstNames(services)).append("\n");
        prompt.append("- Metrics: ").append(firstNames(metricNames)).append("\n");
        prompt.append("- Time range: ").append(timeRange != null ? timeRange.label() : TimeRange.DEFAULT.label()).append("\n\n");

        prompt.append("Sample metrics (showing first few):\n");
        if (metrics.isEmpty()) {
            prompt.append("No metrics found.\n");
        }
        metrics.stream().limit(SAMPLE_LINES).forEach(m -> prompt.append(String.format(Locale.ROOT,
                "- %s: %.2f %s (service: %s)%n", m.getName(), m.getValue(), m.getUnit(), m.getService())));

        prompt.append("\nSample alerts (showing first few):\n");
        if (alerts.isEmpty()) {
            prompt.append("No active alerts.\n");
        }
        alerts.stream().limit(SAMPLE_LINES).forEach(a -> prompt.append(String.format(Locale.ROOT,
                "- %s (%s): %s (service: %s)%n", a.getName(), a.getSeverity().label(), a.getDescription(), a.getService())));

        prompt.append("\nGenerate a helpful, conversational response that:\n");
        prompt.append("1. Answers the user's question directly\n");
        prompt.append("2. Highlights important findings or anomalies\n");
        prompt.append("3. Suggests next steps if relevant\n");
        prompt.append("4. Keeps technical details accessible\n\n");
        prompt.append("Be concise but informative.");
        return prompt.toString();
    }

    private static String firstNames(Set<String> names) {
        return names.stream().limit(SUMMARY_NAMES).collect(Collectors.joining(", "));
    }
}
