package com.whereq.courier.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A job taken from the waiting list, together with the exact item now sitting in processing.
 */
@Data
@AllArgsConstructor
public class ClaimedJob {
    /**
     * Decoded envelope
     */
    private JobEnvelope envelope;

    /**
     * Stored JSON, needed to remove the item on acknowledgement
     */
    private String rawPayload;

    public Job getJob() {
        return envelope.getBody();
    }

    public String getStreamId() {
        return envelope.getStreamId();
    }
}
