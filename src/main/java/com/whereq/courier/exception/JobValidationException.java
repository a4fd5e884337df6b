package com.whereq.courier.exception;

/**
 * Exception thrown when a job is malformed or incomplete; never retried
 */
public class JobValidationException extends CourierException {
    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
