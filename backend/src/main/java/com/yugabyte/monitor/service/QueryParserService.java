package com.yugabyte.monitor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yugabyte.monitor.client.LlmClient;
import com.yugabyte.monitor.config.MonitorProperties;
import com.yugabyte.monitor.config.QueryPatternConfigLoader;
import com.yugabyte.monitor.model.Aggregation;
import com.yugabyte.monitor.model.ChatMessage;
import com.yugabyte.monitor.model.LlmRequest;
import com.yugabyte.monitor.model.MessageSender;
import com.yugabyte.monitor.model.QueryDescriptor;
import com.yugabyte.monitor.model.QueryIntent;
import com.yugabyte.monitor.model.QueryKind;
import com.yugabyte.monitor.model.QueryPatterns;
import com.yugabyte.monitor.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a user question into a {@link QueryDescriptor}.
 * <p>
 * A keyword pass over the dictionaries of {@code query-patterns.json} always produces a baseline.
 * When a language model is configured its JSON answer overrides the baseline field by field;
 * any failure of that stage leaves the baseline untouched.
 */
@Service
@Slf4j
public class QueryParserService {

    static final String SYSTEM_INSTRUCTION = "You are a monitoring query analyzer. Return only valid JSON.";
    static final int PROMPT_SERVICES = 20;
    static final int PROMPT_METRICS = 30;
    static final int PROMPT_HISTORY = 3;
    static final int METRICS_PER_CATEGORY = 3;

    private static final Pattern QUOTED = Pattern.compile("(?<![A-Za-z0-9])[\"']([^\"']+)[\"'](?![A-Za-z0-9])");
    private static final Pattern NUMERIC_RANGE = Pattern.compile(
            "(\\d+)\\s*(seconds?|secs?|s|minutes?|mins?|m|hours?|hrs?|h|days?|d|weeks?|w)(?![a-z])");

    private final QueryPatternConfigLoader patternConfigLoader;
    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final TimeRange defaultTimeRange;

    @Autowired
    public QueryParserService(QueryPatternConfigLoader patternConfigLoader, LlmClient llmClient,
                              ObjectMapper objectMapper, MonitorProperties properties) {
        this.patternConfigLoader = patternConfigLoader;
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.defaultTimeRange = TimeRange.parse(properties.getQuery().getDefaultTimeRange());
    }

    /**
     * Parse one question. Never throws; the keyword baseline is the floor.
     */
    public QueryDescriptor parse(String text, List<String> availableServices, List<String> availableMetrics,
                                 List<ChatMessage> history) {
        QueryDescriptor baseline = parseDeterministic(text, availableServices, availableMetrics);
        log.debug("Keyword parse: {}", baseline.toMetadata());
        if (!llmClient.isEnabled()) {
            return baseline;
        }
        try {
            String reply = llmClient.complete(LlmRequest.builder()
                    .systemInstruction(SYSTEM_INSTRUCTION)
                    .prompt(buildPrompt(text, availableServices, availableMetrics, history))
                    .maxTokens(300)
                    .temperature(0.1)
                    .build());
            Optional<String> json = extractJsonObject(reply);
            if (json.isEmpty()) {
                log.warn("Model reply contained no JSON object, keeping keyword parse");
                return baseline;
            }
            QueryDescriptor merged = applyOverride(baseline, objectMapper.readTree(json.get()),
                    availableServices, availableMetrics);
            log.debug("Model-refined parse: {}", merged.toMetadata());
            return merged;
        } catch (Exception e) {
            log.warn("Model parse failed ({}), keeping keyword parse", e.getMessage());
            return baseline;
        }
    }

    public QueryDescriptor parseDeterministic(String text, List<String> availableServices,
                                              List<String> availableMetrics) {
        QueryPatterns patterns = patternConfigLoader.getPatterns();
        String original = text == null ? "" : text;
        String lower = original.toLowerCase(Locale.ROOT);

        List<String> categories = matchedCategories(lower, patterns);
        QueryDescriptor.QueryDescriptorBuilder builder = QueryDescriptor.builder()
                .originalText(original)
                .metrics(extractMetrics(lower, categories, availableMetrics))
                .services(extractServices(original, availableServices, patterns))
                .timeRange(extractTimeRange(lower, patterns))
                .aggregation(extractAggregation(lower, patterns));

        if (containsAny(lower, patterns.getAlertWords())) {
            builder.intent(QueryIntent.ALERTS).kind(QueryKind.ALERTS);
        } else if (containsAny(lower, patterns.getHealthWords())) {
            builder.intent(QueryIntent.HEALTH).kind(QueryKind.HEALTH);
        } else if (containsAny(lower, patterns.getServiceListingPhrases())) {
            builder.intent(QueryIntent.SERVICES).kind(QueryKind.SERVICES);
        } else if (!categories.isEmpty()) {
            builder.intent(QueryIntent.fromText(categories.get(0)).orElse(QueryIntent.UNKNOWN));
        }
        return builder.build();
    }

    private static List<String> matchedCategories(String lower, QueryPatterns patterns) {
        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, List<String>> category : patterns.getCategories().entrySet()) {
            if (containsAny(lower, category.getValue())) {
                matched.add(category.getKey());
            }
        }
        return matched;
    }

    /**
     * Metric names spelled out in the text, plus a few available metrics of every matched category.
     */
    private static Set<String> extractMetrics(String lower, List<String> categories, List<String> availableMetrics) {
        Set<String> metrics = new LinkedHashSet<>();
        for (String metric : availableMetrics) {
            if (containsWord(lower, metric.toLowerCase(Locale.ROOT))) {
                metrics.add(metric);
            }
        }
        for (String category : categories) {
            availableMetrics.stream()
                    .filter(m -> m.toLowerCase(Locale.ROOT).contains(category))
                    .limit(METRICS_PER_CATEGORY)
                    .forEach(metrics::add);
        }
        return metrics;
    }

    private static Set<String> extractServices(String original, List<String> availableServices, QueryPatterns patterns) {
        String lower = original.toLowerCase(Locale.ROOT);
        Set<String> services = new LinkedHashSet<>();
        for (String service : availableServices) {
            String name = service.toLowerCase(Locale.ROOT);
            int typeSeparator = name.indexOf(": ");
            String shortName = typeSeparator >= 0 ? name.substring(typeSeparator + 2) : name;
            if (containsWord(lower, name) || (!shortName.isEmpty() && containsWord(lower, shortName))) {
                services.add(service);
            }
        }

        List<String> quoted = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(original);
        while (matcher.find()) {
            quoted.add(matcher.group(1).trim());
        }
        for (String name : quoted) {
            if (availableServices.contains(name)) {
                services.add(name);
            }
        }

        // backends that cannot enumerate services still get the name the user typed
        if (services.isEmpty()) {
            for (String keyword : patterns.getServiceKeywords()) {
                Matcher named = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword)
                        + "s?\\s+[\"']([^\"']+)[\"']").matcher(lower);
                if (named.find()) {
                    String start = named.group(1);
                    quoted.stream()
                            .filter(q -> q.toLowerCase(Locale.ROOT).equals(start))
                            .findFirst()
                            .ifPresent(services::add);
                    break;
                }
            }
        }
        return services;
    }

    private TimeRange extractTimeRange(String lower, QueryPatterns patterns) {
        for (Map.Entry<String, List<String>> phrase : patterns.getTimePhrases().entrySet()) {
            if (containsAny(lower, phrase.getValue())) {
                return TimeRange.parse(phrase.getKey());
            }
        }
        Matcher matcher = NUMERIC_RANGE.matcher(lower);
        if (matcher.find()) {
            return TimeRange.parse(matcher.group(1) + unitLetter(matcher.group(2)));
        }
        return defaultTimeRange;
    }

    private static String unitLetter(String unit) {
        if (unit.startsWith("s")) {
            return "s";
        }
        if (unit.startsWith("m")) {
            return "m";
        }
        if (unit.startsWith("h")) {
            return "h";
        }
        if (unit.startsWith("d")) {
            return "d";
        }
        return "w";
    }

    private static Aggregation extractAggregation(String lower, QueryPatterns patterns) {
        for (Map.Entry<String, List<String>> aggregation : patterns.getAggregations().entrySet()) {
            if (containsAny(lower, aggregation.getValue())) {
                Optional<Aggregation> resolved = Aggregation.fromText(aggregation.getKey());
                if (resolved.isPresent()) {
                    return resolved.get();
                }
            }
        }
        return Aggregation.AVG;
    }

    String buildPrompt(String text, List<String> services, List<String> metrics, List<ChatMessage> history) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze this monitoring query and extract structured information:\n\n");
        List<String> previous = recentUserQuestions(text, history);
        if (!previous.isEmpty()) {
            prompt.append("Earlier questions in this conversation:\n");
            previous.forEach(q -> prompt.append("- ").append(q).append("\n"));
            prompt.append("\n");
        }
        prompt.append("Query: \"").append(text).append("\"\n\n");
        prompt.append("Available services: ").append(head(services, PROMPT_SERVICES)).append("\n");
        prompt.append("Available metrics: ").append(head(metrics, PROMPT_METRICS)).append("\n\n");
        prompt.append("Extract and return JSON with:\n");
        prompt.append("- intent: main intent (cpu, memory, disk, network, latency, throughput, errors, alerts, health, performance)\n");
        prompt.append("- metrics: list of relevant metric names from available metrics\n");
        prompt.append("- services: list of relevant service names from available services\n");
        prompt.append("- time_range: time period (5m, 1h, 24h, etc.)\n");
        prompt.append("- aggregation: aggregation type (avg, sum, max, min, raw)\n");
        prompt.append("- query_type: type of query (metrics, alerts, health, services)\n");
        prompt.append("- filters: any additional filters as key-value pairs\n\n");
        prompt.append("Return only valid JSON.");
        return prompt.toString();
    }

    private static List<String> recentUserQuestions(String current, List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<String> questions = history.stream()
                .filter(m -> m.getSender() == MessageSender.USER)
                .map(ChatMessage::getContent)
                .collect(Collectors.toCollection(ArrayList::new));
        // the current question is already persisted as the newest entry
        if (!questions.isEmpty() && questions.get(questions.size() - 1).equals(current)) {
            questions.remove(questions.size() - 1);
        }
        return questions.subList(Math.max(0, questions.size() - PROMPT_HISTORY), questions.size());
    }

    /**
     * Overlay the model's non-empty fields on the baseline. Metric and service names the backends
     * did not enumerate are dropped.
     */
    QueryDescriptor applyOverride(QueryDescriptor baseline, JsonNode override,
                                  List<String> availableServices, List<String> availableMetrics) {
        QueryDescriptor.QueryDescriptorBuilder builder = baseline.toBuilder();

        QueryIntent.fromText(override.path("intent").asText(null)).ifPresent(builder::intent);

        List<String> metrics = knownNames(override.path("metrics"), availableMetrics);
        if (!metrics.isEmpty()) {
            builder.clearMetrics().metrics(metrics);
        }
        List<String> services = knownNames(override.path("services"), availableServices);
        if (!services.isEmpty()) {
            builder.clearServices().services(services);
        }

        String timeRange = override.path("time_range").asText(null);
        if (TimeRange.isValid(timeRange)) {
            builder.timeRange(TimeRange.parse(timeRange));
        }
        Aggregation.fromText(override.path("aggregation").asText(null)).ifPresent(builder::aggregation);
        QueryKind.fromText(override.path("query_type").asText(null)).ifPresent(builder::kind);

        JsonNode filters = override.path("filters");
        if (filters.isObject() && filters.size() > 0) {
            Map<String, String> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = filters.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode() && !field.getValue().asText().isEmpty()) {
                    values.put(field.getKey(), field.getValue().asText());
                }
            }
            if (!values.isEmpty()) {
                builder.clearFilters().filters(values);
            }
        }
        return builder.build();
    }

    private static List<String> knownNames(JsonNode node, List<String> available) {
        List<String> names = new ArrayList<>();
        if (node.isTextual()) {
            matchName(node.asText(), available).ifPresent(names::add);
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                matchName(item.asText(), available).filter(n -> !names.contains(n)).ifPresent(names::add);
            }
        }
        return names;
    }

    private static Optional<String> matchName(String candidate, List<String> available) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        return available.stream().filter(a -> a.equalsIgnoreCase(candidate.trim())).findFirst();
    }

    /**
     * First balanced {@code {...}} block of the reply, ignoring braces inside JSON strings.
     */
    static Optional<String> extractJsonObject(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        int start = reply.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < reply.length(); i++) {
                char c = reply.charAt(i);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = inString;
                } else if (c == '"') {
                    inString = !inString;
                } else if (!inString && c == '{') {
                    depth++;
                } else if (!inString && c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(reply.substring(start, i + 1));
                    }
                }
            }
            start = reply.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static List<String> head(List<String> values, int limit) {
        return values.subList(0, Math.min(limit, values.size()));
    }

    private static boolean containsAny(String lower, List<String> phrases) {
        for (String phrase : phrases) {
            if (containsWord(lower, phrase.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Phrase occurrence not glued to surrounding letters or digits, so {@code io} does not match {@code ratio}.
     */
    static boolean containsWord(String text, String phrase) {
        if (phrase.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int at = text.indexOf(phrase, from);
            if (at < 0) {
                return false;
            }
            int end = at + phrase.length();
            boolean leftOk = at == 0 || !Character.isLetterOrDigit(text.charAt(at - 1));
            boolean rightOk = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = at + 1;
        }
    }
}
