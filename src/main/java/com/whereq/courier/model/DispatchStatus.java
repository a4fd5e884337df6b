package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one worker invocation
 */
public enum DispatchStatus {
    /**
     * Answer delivered
     */
    SUCCESS,

    /**
     * Streaming failed part way; the content so far was delivered with the incomplete notice
     */
    PARTIAL_SUCCESS,

    /**
     * Duplicate delivery of an already processed job
     */
    SKIPPED,

    /**
     * Generation or delivery failed
     */
    ERROR,

    /**
     * Nothing waiting in the queue
     */
    NO_JOBS,

    /**
     * Health probe answered without touching the queue
     */
    HEALTHY;

    /**
     * Check if the claimed job should be dropped from the queue rather than dead-lettered
     */
    public boolean isAcknowledged() {
        return this == SUCCESS || this == PARTIAL_SUCCESS || this == SKIPPED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
