package com.yugabyte.monitor.connector;

public enum FailureKind {
    /** Transport error or failed health check. */
    UNREACHABLE,
    /** Call exceeded the connector or turn timeout. */
    TIMEOUT,
    /** Non-2xx status or malformed payload. */
    BACKEND_ERROR
}
