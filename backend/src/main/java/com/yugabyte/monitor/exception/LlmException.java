package com.yugabyte.monitor.exception;

import lombok.Getter;

/**
 * Raised by the language-model client. Callers degrade to deterministic logic.
 */
@Getter
public class LlmException extends RuntimeException {

    public static final String DISABLED = "LLM_DISABLED";
    public static final String TIMEOUT = "LLM_TIMEOUT";
    public static final String RATE_LIMITED = "LLM_RATE_LIMITED";
    public static final String EMPTY_RESPONSE = "LLM_EMPTY_RESPONSE";
    public static final String ERROR = "LLM_ERROR";

    private final String errorCode;

    public LlmException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LlmException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
