package com.whereq.courier.exception;

import java.time.Duration;

/**
 * Exception thrown when the messaging platform rejects a call because of its rate limit
 */
public class ThrottledException extends DeliveryException {

    /**
     * Wait requested by the platform, zero when it did not say
     */
    private final Duration retryAfter;

    public ThrottledException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
