package com.shoplytic.ai.exception;

import java.time.Duration;

/**
 * A model call or database operation did not finish within its time limit.
 */
public class OperationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(String.format("%s did not complete within %d ms", operation, timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
