package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A job that failed processing, kept for inspection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeadLetterEntry {
    private String streamId;

    /**
     * The failed job, null when the queue item could not be decoded
     */
    private Job body;

    private String error;

    private Instant timestamp;

    /**
     * Original queue item, only kept when it could not be decoded
     */
    private String rawPayload;
}
