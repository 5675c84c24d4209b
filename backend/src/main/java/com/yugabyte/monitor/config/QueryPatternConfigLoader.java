package com.yugabyte.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.yugabyte.monitor.model.QueryPatterns;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the parser dictionaries from query-patterns.json at startup.
 * Falls back to the built-in dictionaries when the file is missing or invalid.
 */
@Component
@Slf4j
@Getter
public class QueryPatternConfigLoader {

    static final String RESOURCE = "/query-patterns.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private QueryPatterns patterns = QueryPatterns.defaults();
    private boolean loaded;

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.warn("⚠️  {} not found in classpath, using built-in query patterns", RESOURCE);
                return;
            }
            load(is);
        } catch (IOException e) {
            log.error("❌ Error loading {}: {}", RESOURCE, e.getMessage(), e);
            log.warn("⚠️  Falling back to built-in query patterns");
        }
    }

    void load(InputStream is) throws IOException {
        QueryPatterns parsed = objectMapper.readValue(is, QueryPatterns.class);
        if (parsed == null || !parsed.isComplete()) {
            log.error("❌ Invalid {}: categories, time_phrases, aggregations, alert_words and health_words are required",
                    RESOURCE);
            return;
        }
        patterns = parsed;
        loaded = true;
        log.info("✅ Loaded query patterns: {} categories, {} time phrases, {} aggregations",
                parsed.getCategories().size(), parsed.getTimePhrases().size(), parsed.getAggregations().size());
    }
}
