package com.vigil.resilience;

import java.time.Duration;

/**
 * A transient HTTP failure: one of the statuses accepted by
 * {@link HttpRetryClassifier#isRetryableStatus(Integer)}.
 */
public class RetryableHttpException extends RetryableException {

    private final int statusCode;

    public RetryableHttpException(int statusCode, String message, Duration retryAfter) {
        super(message, null, retryAfter);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
