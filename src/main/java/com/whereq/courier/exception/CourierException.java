package com.whereq.courier.exception;

/**
 * Base type for failures raised while queueing and delivering jobs
 */
public class CourierException extends RuntimeException {
    public CourierException(String message) {
        super(message);
    }

    public CourierException(String message, Throwable cause) {
        super(message, cause);
    }
}
