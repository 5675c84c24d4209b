package com.yugabyte.monitor.model;

import lombok.Value;

import java.time.Instant;

/**
 * Result of one health check. Computed per request and never cached.
 */
@Value
public class ConnectorHealth {
    String connectorName;
    boolean reachable;
    Instant checkedAt;
}
