package com.yugabyte.monitor.exception;

import lombok.Getter;

/**
 * Non-2xx status or malformed payload from a monitoring backend.
 * Never leaves the connector that raised it.
 */
@Getter
public class BackendQueryException extends RuntimeException {

    private final String connector;
    private final Integer statusCode;

    public BackendQueryException(String connector, String message) {
        super(message);
        this.connector = connector;
        this.statusCode = null;
    }

    public BackendQueryException(String connector, int statusCode, String message) {
        super(message);
        this.connector = connector;
        this.statusCode = statusCode;
    }
}
