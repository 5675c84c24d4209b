package com.yugabyte.monitor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MonitorProperties")
class MonitorPropertiesTest {

    @Test
    @DisplayName("Alertmanager defaults to the Prometheus host on port 9093")
    void alertmanagerDefault() {
        MonitorProperties.Prometheus prometheus = new MonitorProperties.Prometheus();
        prometheus.setUrl("http://prometheus:9090/");

        assertThat(prometheus.resolveAlertmanagerUrl()).isEqualTo("http://prometheus:9093");

        prometheus.setAlertmanagerUrl("http://am.internal:80/");
        assertThat(prometheus.resolveAlertmanagerUrl()).isEqualTo("http://am.internal:80");
    }

    @Test
    @DisplayName("credentials need both user and password")
    void credentials() {
        MonitorProperties.Prometheus prometheus = new MonitorProperties.Prometheus();
        prometheus.setUsername("admin");

        assertThat(prometheus.hasCredentials()).isFalse();

        prometheus.setPassword("secret");
        assertThat(prometheus.hasCredentials()).isTrue();
    }

    @Test
    @DisplayName("session defaults bound the history")
    void sessionDefaults() {
        MonitorProperties.Session session = new MonitorProperties().getSession();

        assertThat(session.getMaxMessages()).isEqualTo(50);
        assertThat(session.getHistoryLimit()).isEqualTo(10);
        assertThat(session.getRetention()).hasHours(24);
        assertThat(session.getStore()).isEqualTo("memory");
    }
}
