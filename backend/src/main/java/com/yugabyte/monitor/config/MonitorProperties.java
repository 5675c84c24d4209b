package com.yugabyte.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    private Prometheus prometheus = new Prometheus();
    private Azure azure = new Azure();
    private Session session = new Session();
    private Query query = new Query();

    @Data
    public static class Prometheus {
        private String url;
        private String username;
        private String password;
        private String alertmanagerUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration healthTimeout = Duration.ofSeconds(10);
        private String step = "30s";

        public boolean isConfigured() {
            return hasText(url);
        }

        public boolean hasCredentials() {
            return hasText(username) && hasText(password);
        }

        /**
         * Alertmanager base URL; defaults to the Prometheus URL on the Alertmanager port.
         */
        public String resolveAlertmanagerUrl() {
            if (hasText(alertmanagerUrl)) {
                return stripSlash(alertmanagerUrl);
            }
            return stripSlash(url).replace(":9090", ":9093");
        }
    }

    @Data
    public static class Azure {
        private String subscriptionId;
        private String clientId;
        private String clientSecret;
        private String tenantId;
        private String workspaceId;
        private String loginUrl = "https://login.microsoftonline.com";
        private String managementUrl = "https://management.azure.com";
        private String logAnalyticsUrl = "https://api.loganalytics.io";
        private Duration timeout = Duration.ofSeconds(30);
        private Duration healthTimeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return hasText(subscriptionId) && hasText(clientId) && hasText(clientSecret) && hasText(tenantId);
        }
    }

    @Data
    public static class Session {
        /** {@code redis} or {@code memory}. */
        private String store = "memory";
        private int maxMessages = 50;
        private Duration retention = Duration.ofHours(24);
        private int historyLimit = 10;
    }

    @Data
    public static class Query {
        private String defaultTimeRange = "1h";
        private Duration turnTimeout = Duration.ofSeconds(60);
        private int maxServices = 50;
        private int maxMetricNames = 100;
        private int serviceDisplayLimit = 10;
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
