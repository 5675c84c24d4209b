package com.yugabyte.monitor.service;

import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.connector.ConnectorOutcome;
import com.yugabyte.monitor.connector.ConnectorRegistry;
import com.yugabyte.monitor.connector.MonitoringConnector;
import com.yugabyte.monitor.connector.QueryOptions;
import com.yugabyte.monitor.connector.TranslatedQuery;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.ChatMessage;
import com.yugabyte.monitor.model.ConnectorHealth;
import com.yugabyte.monitor.model.ConversationSummary;
import com.yugabyte.monitor.model.MessageSender;
import com.yugabyte.monitor.model.MetricSample;
import com.yugabyte.monitor.model.QueryDescriptor;
import com.yugabyte.monitor.model.QueryIntent;
import com.yugabyte.monitor.model.QueryKind;
import com.yugabyte.monitor.repository.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one conversation turn end to end: persist the question, load recent history, enumerate what
 * the backends offer, parse, route to alerts, health, services or metrics, answer, persist the answer.
 * <p>
 * The session store is best effort and backend failures only shrink the data; the last-resort catch
 * turns anything else into an apologetic answer instead of an error.
 */
@Service
@Slf4j
public class ConversationService {

    static final String NO_ALERTS = "Great news! No active alerts found in your monitoring systems.";
    static final String NO_SERVICES = "No services found in the monitoring systems. Please check your configuration.";

    private static final Map<String, List<String>> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("CPU Performance", List.of("cpu", "processor"));
        TOPICS.put("Memory Usage", List.of("memory", "ram"));
        TOPICS.put("Disk I/O", List.of("disk", "storage"));
        TOPICS.put("Network", List.of("network", "bandwidth"));
        TOPICS.put("Alerts", List.of("alert", "alerts", "alarm", "alarms"));
        TOPICS.put("System Health", List.of("health", "status"));
        TOPICS.put("Services", List.of("service", "services", "app", "apps"));
    }

    private final ConnectorRegistry registry;
    private final QueryParserService queryParser;
    private final ResponseSynthesizer responseSynthesizer;
    private final ConversationStore conversationStore;
    private final TurnMetricsService turnMetrics;
    private final MonitorProperties properties;
    private final Clock clock;

    @Autowired
    public ConversationService(ConnectorRegistry registry, QueryParserService queryParser,
                               ResponseSynthesizer responseSynthesizer, ConversationStore conversationStore,
                               TurnMetricsService turnMetrics, MonitorProperties properties, Clock clock) {
        this.registry = registry;
        this.queryParser = queryParser;
        this.responseSynthesizer = responseSynthesizer;
        this.conversationStore = conversationStore;
        this.turnMetrics = turnMetrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Process one user message and return the stored assistant answer.
     */
    public ChatMessage processMessage(String sessionId, String message) {
        String turnId = "TURN-" + UUID.randomUUID().toString().substring(0, 8);
        Instant started = clock.instant();
        Instant deadline = started.plus(properties.getQuery().getTurnTimeout());
        log.info("[{}] Turn started for session {}: {}", turnId, sessionId, abbreviate(message));

        QueryDescriptor descriptor = null;
        boolean success = true;
        ChatMessage answer;
        try {
            store(turnId, sessionId, message(message, MessageSender.USER, null));

            long stage = System.currentTimeMillis();
            List<ChatMessage> history = loadHistory(turnId, sessionId);
            log.info("[{}] History: {} message(s) in {}ms", turnId, history.size(), System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            List<ConnectorHealth> health = registry.checkHealth(deadline);
            List<MonitoringConnector> healthy = registry.healthyConnectors(health);
            Map<String, List<String>> servicesByConnector = enumerate(healthy, "services",
                    MonitoringConnector::listServices, properties.getQuery().getMaxServices(), deadline);
            Map<String, List<String>> metricsByConnector = enumerate(healthy, "metric names",
                    MonitoringConnector::listMetricNames, properties.getQuery().getMaxMetricNames(), deadline);
            List<String> services = flatten(servicesByConnector);
            List<String> metricNames = flatten(metricsByConnector);
            log.info("[{}] Enumeration: {}/{} connector(s) healthy, {} service(s), {} metric name(s) in {}ms",
                    turnId, healthy.size(), health.size(), services.size(), metricNames.size(),
                    System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            descriptor = queryParser.parse(message, services, metricNames, history);
            log.info("[{}] Parse: kind={}, intent={}, metrics={}, services={}, range={} in {}ms", turnId,
                    descriptor.getKind(), descriptor.getIntent(), descriptor.getMetrics(), descriptor.getServices(),
                    descriptor.getTimeRange(), System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            String content = dispatch(turnId, descriptor, health, healthy, servicesByConnector, deadline);
            log.info("[{}] Dispatch and answer in {}ms", turnId, System.currentTimeMillis() - stage);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("parsed_query", descriptor.toMetadata());
            metadata.put("connectors_used", healthy.stream().map(MonitoringConnector::getName).collect(Collectors.toList()));
            metadata.put("turn_id", turnId);
            answer = message(content, MessageSender.ASSISTANT, metadata);
        } catch (Exception e) {
            success = false;
            log.error("[{}] Turn failed: {}", turnId, e.getMessage(), e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error", String.valueOf(e.getMessage()));
            metadata.put("turn_id", turnId);
            answer = message("I encountered an error processing your request: " + e.getMessage()
                    + ". Please try rephrasing your question.", MessageSender.ASSISTANT, metadata);
        }

        store(turnId, sessionId, answer);
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        turnMetrics.recordTurn(turnId, descriptor != null ? descriptor.getKind() : null,
                descriptor != null ? descriptor.getIntent() : null, elapsed, success);
        log.info("[{}] Turn completed in {}ms", turnId, elapsed);
        return answer;
    }

    private String dispatch(String turnId, QueryDescriptor descriptor, List<ConnectorHealth> health,
                            List<MonitoringConnector> healthy, Map<String, List<String>> servicesByConnector,
                            Instant deadline) {
        QueryKind kind = descriptor.getKind();
        QueryIntent intent = descriptor.getIntent();
        if (kind == QueryKind.ALERTS || intent == QueryIntent.ALERTS) {
            return answerAlerts(descriptor, healthy, deadline);
        }
        if (kind == QueryKind.HEALTH || intent == QueryIntent.HEALTH) {
            return healthReport(health, healthy, deadline);
        }
        if (kind == QueryKind.SERVICES || intent == QueryIntent.SERVICES) {
            return servicesListing(servicesByConnector);
        }
        return answerMetrics(turnId, descriptor, healthy, deadline);
    }

    private String answerAlerts(QueryDescriptor descriptor, List<MonitoringConnector> healthy, Instant deadline) {
        List<AlertRecord> alerts = ConnectorOutcome.merge(
                registry.fanOut("alerts", healthy, MonitoringConnector::listActiveAlerts, deadline).values());
        if (alerts.isEmpty()) {
            return NO_ALERTS;
        }
        return responseSynthesizer.synthesize(descriptor.getOriginalText(), List.of(), alerts, descriptor.getTimeRange());
    }

    /**
     * Fixed-format status report: one line per connector, liveness of scraped targets, active alert count.
     */
    String healthReport(List<ConnectorHealth> health, List<MonitoringConnector> healthy, Instant deadline) {
        List<String> lines = new ArrayList<>();
        lines.add("🔍 **System Health Status**");
        lines.add("");
        lines.add("**Data Sources:**");
        for (ConnectorHealth entry : health) {
            lines.add("- " + displayName(entry.getConnectorName()) + ": "
                    + (entry.isReachable() ? "✅ Online" : "❌ Offline"));
        }

        List<MonitoringConnector> withLiveness = healthy.stream()
                .filter(c -> c.livenessQuery() != null)
                .collect(Collectors.toList());
        List<MetricSample> liveness = ConnectorOutcome.merge(registry.fanOut("liveness", withLiveness,
                c -> c.queryMetrics(c.livenessQuery(), QueryOptions.INSTANT), deadline).values());
        long up = liveness.stream().filter(m -> m.getValue() == 1.0).count();
        lines.add("");
        lines.add("**Services Status:** " + up + "/" + liveness.size() + " services are healthy");

        List<AlertRecord> alerts = ConnectorOutcome.merge(
                registry.fanOut("alerts", healthy, MonitoringConnector::listActiveAlerts, deadline).values());
        lines.add(alerts.isEmpty() ? "✅ No active alerts" : "⚠️  " + alerts.size() + " active alerts requiring attention");
        return String.join("\n", lines);
    }

    String servicesListing(Map<String, List<String>> servicesByConnector) {
        if (servicesByConnector.values().stream().allMatch(List::isEmpty)) {
            return NO_SERVICES;
        }
        int displayLimit = properties.getQuery().getServiceDisplayLimit();
        List<String> lines = new ArrayList<>();
        lines.add("📋 **Available Services:**");
        lines.add("");
        int total = 0;
        int sources = 0;
        for (Map.Entry<String, List<String>> entry : servicesByConnector.entrySet()) {
            List<String> services = entry.getValue();
            if (services.isEmpty()) {
                continue;
            }
            total += services.size();
            sources++;
            lines.add("**" + displayName(entry.getKey()) + " (" + services.size() + " services):**");
            services.stream().limit(displayLimit).forEach(s -> lines.add("- " + s));
            if (services.size() > displayLimit) {
                lines.add("... and " + (services.size() - displayLimit) + " more");
            }
            lines.add("");
        }
        lines.add("**Total:** " + total + " services across " + sources + " data sources");
        return String.join("\n", lines);
    }

    private String answerMetrics(String turnId, QueryDescriptor descriptor, List<MonitoringConnector> healthy,
                                 Instant deadline) {
        Map<String, TranslatedQuery> plans = new LinkedHashMap<>();
        List<MonitoringConnector> targets = new ArrayList<>();
        for (MonitoringConnector connector : healthy) {
            Optional<TranslatedQuery> translated = connector.getTranslator().translate(descriptor);
            if (translated.isPresent()) {
                plans.put(connector.getName(), translated.get());
                targets.add(connector);
                log.debug("[{}] {} query: {}", turnId, connector.getName(), translated.get().getQuery());
            } else {
                log.debug("[{}] {} has no translation for this question", turnId, connector.getName());
            }
        }

        Map<String, ConnectorOutcome<MetricSample>> outcomes = registry.fanOut("metrics", targets, c -> {
            TranslatedQuery plan = plans.get(c.getName());
            return c.queryMetrics(plan.getQuery(), plan.getOptions());
        }, deadline);
        List<MetricSample> metrics = ConnectorOutcome.merge(outcomes.values());
        log.info("[{}] Metrics fan-out: {}", turnId, outcomes);
        if (metrics.isEmpty()) {
            return noDataResponse(descriptor);
        }
        return responseSynthesizer.synthesize(descriptor.getOriginalText(), metrics, List.of(), descriptor.getTimeRange());
    }

    String noDataResponse(QueryDescriptor descriptor) {
        List<String> suggestions = new ArrayList<>();
        if (!descriptor.getServices().isEmpty()) {
            suggestions.add("Check if the service '" + String.join(", ", descriptor.getServices()) + "' is running");
        }
        if (!descriptor.getMetrics().isEmpty()) {
            suggestions.add("Verify that metrics '" + String.join(", ", descriptor.getMetrics()) + "' are being collected");
        }
        String base = "No data found for your query: '" + descriptor.getOriginalText() + "'";
        if (suggestions.isEmpty()) {
            return base + "\n\nTry asking about available services or check system health.";
        }
        return base + "\n\nSuggestions:\n" + suggestions.stream().map(s -> "- " + s).collect(Collectors.joining("\n"));
    }

    /**
     * Per-connector enumeration, capped per connector. Failed or timed-out connectors contribute an empty list.
     */
    private Map<String, List<String>> enumerate(List<MonitoringConnector> healthy, String label,
                                                Function<MonitoringConnector, ConnectorOutcome<String>> call,
                                                int cap, Instant deadline) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        registry.fanOut(label, healthy, call, deadline).forEach((name, outcome) ->
                result.put(name, outcome.getItems().stream().limit(cap).collect(Collectors.toList())));
        return result;
    }

    private static List<String> flatten(Map<String, List<String>> byConnector) {
        Set<String> all = new LinkedHashSet<>();
        byConnector.values().forEach(all::addAll);
        return new ArrayList<>(all);
    }

    public List<ChatMessage> getHistory(String sessionId, int limit) {
        return conversationStore.readRecent(sessionId, Math.min(limit, properties.getSession().getMaxMessages()));
    }

    public void clearSession(String sessionId) {
        conversationStore.clear(sessionId);
        log.info("Cleared conversation history of session {}", sessionId);
    }

    public ConversationSummary getSummary(String sessionId) {
        List<ChatMessage> history;
        try {
            history = conversationStore.readRecent(sessionId, properties.getSession().getMaxMessages());
        } catch (RuntimeException e) {
            log.error("Error reading history for summary of session {}: {}", sessionId, e.getMessage());
            history = List.of();
        }
        Instant now = clock.instant();
        return ConversationSummary.builder()
                .sessionId(sessionId)
                .messageCount(history.size())
                .startTime(history.isEmpty() ? now : history.get(0).getTimestamp())
                .lastActivity(history.isEmpty() ? now : history.get(history.size() - 1).getTimestamp())
                .topics(extractTopics(history))
                .build();
    }

    static List<String> extractTopics(List<ChatMessage> messages) {
        Set<String> topics = new LinkedHashSet<>();
        for (ChatMessage message : messages) {
            if (message.getSender() != MessageSender.USER || message.getContent() == null) {
                continue;
            }
            String content = message.getContent().toLowerCase(Locale.ROOT);
            TOPICS.forEach((topic, words) -> {
                if (words.stream().anyMatch(w -> QueryParserService.containsWord(content, w))) {
                    topics.add(topic);
                }
            });
        }
        return new ArrayList<>(topics);
    }

    private void store(String turnId, String sessionId, ChatMessage message) {
        try {
            conversationStore.append(sessionId, message);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not store {} message for session {}: {}", turnId,
                    message.getSender().wireName(), sessionId, e.getMessage());
        }
    }

    private List<ChatMessage> loadHistory(String turnId, String sessionId) {
        try {
            return conversationStore.readRecent(sessionId, properties.getSession().getHistoryLimit());
        } catch (RuntimeException e) {
            log.warn("[{}] Could not read history for session {}: {}", turnId, sessionId, e.getMessage());
            return List.of();
        }
    }

    private ChatMessage message(String content, MessageSender sender, Map<String, Object> metadata) {
        return ChatMessage.builder()
                .content(content)
                .sender(sender)
                .timestamp(clock.instant())
                .metadata(metadata != null ? metadata : new LinkedHashMap<>())
                .build();
    }

    static String displayName(String connectorName) {
        return Arrays.stream(connectorName.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
