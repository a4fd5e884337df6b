package com.whereq.courier.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A job as stored in the queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEnvelope {
    /**
     * Identifier assigned when the job was enqueued
     */
    private String streamId;

    /**
     * The queued job
     */
    private Job body;

    /**
     * When the job was enqueued
     */
    private Instant enqueuedAt;
}
