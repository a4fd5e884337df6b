package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.Job;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a manually injected test job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestJobResponse {
    private String status;

    private Job job;

    /**
     * Waiting jobs right after the test job was enqueued
     */
    private Long queueDepth;

    /**
     * Result of the worker run that followed
     */
    private DispatchResult workerResult;

    private String message;

    private Instant timestamp;

    public static TestJobResponse error(String message) {
        return TestJobResponse.builder()
            .status("error")
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
