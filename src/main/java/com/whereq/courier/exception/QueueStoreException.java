package com.whereq.courier.exception;

/**
 * Exception thrown when the queue store cannot be read or written
 */
public class QueueStoreException extends CourierException {
    public QueueStoreException(String message) {
        super(message);
    }

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
