package com.yugabyte.monitor.controller;

import com.yugabyte.monitor.exception.NoDataSourceException;
import com.yugabyte.monitor.model.AlertRecord;
import com.yugabyte.monitor.model.AlertSeverity;
import com.yugabyte.monitor.service.DataSourceService;
import com.yugabyte.monitor.service.TurnMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MonitoringController.class)
@DisplayName("MonitoringController")
class MonitoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSourceService dataSourceService;

    @MockBean
    private TurnMetricsService turnMetricsService;

    @Test
    @DisplayName("GET /monitoring/alerts returns alerts with their count")
    void alerts() throws Exception {
        when(dataSourceService.getActiveAlerts()).thenReturn(List.of(AlertRecord.builder()
                .name("HighCPU")
                .severity(AlertSeverity.CRITICAL)
                .description("CPU above 90%")
                .service("checkout")
                .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
                .build()));

        mockMvc.perform(get("/monitoring/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.alerts[0].name").value("HighCPU"));
    }

    @Test
    @DisplayName("no configured data source maps to 503")
    void noDataSource() throws Exception {
        when(dataSourceService.getMetricsSummary()).thenThrow(new NoDataSourceException());

        mockMvc.perform(get("/monitoring/metrics/summary"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("No data sources configured"));
    }

    @Test
    @DisplayName("turn analytics default to a 24 hour lookback")
    void analyticsDefault() throws Exception {
        MonitoringController.TurnAnalytics analytics = new MonitoringController.TurnAnalytics();
        analytics.setLookbackHours(24);
        when(turnMetricsService.getTurnAnalytics(24)).thenReturn(analytics);

        mockMvc.perform(get("/monitoring/analytics/turns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lookbackHours").value(24));
    }
}
