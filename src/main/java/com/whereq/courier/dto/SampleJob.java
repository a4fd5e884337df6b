package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.courier.model.Job;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Head of the waiting list as shown by diagnostics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SampleJob {
    private String streamId;

    private Instant enqueuedAt;

    /**
     * The job with its question truncated
     */
    private Job original;

    private TimestampReport timestamps;
}
