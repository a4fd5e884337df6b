package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured response of a worker invocation
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {
    private DispatchStatus status;

    private DispatchMode mode;

    /**
     * Job identity (or queue stream id) the result refers to
     */
    private String jobId;

    /**
     * Human readable detail
     */
    private String message;

    /**
     * Error message when status is ERROR
     */
    private String error;

    /**
     * Jobs still waiting after a queue pull
     */
    private Long remainingJobs;

    public static DispatchResult of(DispatchStatus status, DispatchMode mode) {
        return DispatchResult.builder()
            .status(status)
            .mode(mode)
            .build();
    }

    public boolean isError() {
        return status == DispatchStatus.ERROR;
    }
}
