package com.whereq.courier.diagnostics;

import java.util.Locale;

/**
 * Administrative operations on the queue
 */
public enum QueueOperation {
    /**
     * Drop waiting and processing jobs
     */
    FLUSH_QUEUE,

    /**
     * Move every job in processing back to waiting
     */
    RECOVER_STUCK_JOBS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve an operation name
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static QueueOperation fromWireName(String value) {
        if (value != null) {
            for (QueueOperation operation : values()) {
                if (operation.wireName().equalsIgnoreCase(value.trim())) {
                    return operation;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
}
