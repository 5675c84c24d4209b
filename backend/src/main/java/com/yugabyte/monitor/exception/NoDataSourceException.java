package com.yugabyte.monitor.exception;

/**
 * Raised by the monitoring endpoints when no backend connector is configured.
 */
public class NoDataSourceException extends RuntimeException {

    public NoDataSourceException() {
        super("No data sources configured");
    }
}
