package com.whereq.courier.exception;

/**
 * Exception thrown when a gated operation is called without the shared secret
 */
public class UnauthorizedException extends CourierException {
    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
