package com.whereq.courier.exception;

/**
 * Exception thrown when the answer generation engine fails or times out
 */
public class GenerationException extends CourierException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
