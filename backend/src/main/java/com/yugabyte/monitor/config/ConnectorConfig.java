package com.yugabyte.monitor.config;

import com.yugabyte.monitor.connector.ConnectorFactory;
import com.yugabyte.monitor.connector.ConnectorRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class ConnectorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public ConnectorRegistry connectorRegistry(MonitorProperties properties, WebClient.Builder webClientBuilder,
                                               Clock clock) {
        return new ConnectorRegistry(new ConnectorFactory(properties, webClientBuilder, clock).createConnectors(), clock);
    }
}
