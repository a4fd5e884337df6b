package com.whereq.courier.exception;

/**
 * Exception thrown when a message could not be delivered to the messaging platform
 */
public class DeliveryException extends CourierException {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
