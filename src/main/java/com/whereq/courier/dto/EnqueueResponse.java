package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for a job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnqueueResponse {
    /**
     * {@code queued} or {@code error}
     */
    private String status;

    /**
     * Waiting jobs after the submission
     */
    private Long queueDepth;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static EnqueueResponse queued(long queueDepth) {
        return EnqueueResponse.builder()
            .status("queued")
            .queueDepth(queueDepth)
            .submittedAt(Instant.now())
            .build();
    }

    public static EnqueueResponse error(String message) {
        return EnqueueResponse.builder()
            .status("error")
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
