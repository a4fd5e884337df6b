package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.courier.model.DeadLetterEntry;
import com.whereq.courier.model.QueueDepth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the queue for operators
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueSnapshot {
    private String status;

    private Instant timestamp;

    private String queueName;

    private QueueDepth queueHealth;

    /**
     * Head of the waiting list, absent when nothing waits
     */
    private SampleJob sampleJob;

    /**
     * First dead-letter entries, absent when the list is empty
     */
    private List<DeadLetterEntry> deadLetterJobs;

    private String message;

    public static QueueSnapshot error(String message) {
        return QueueSnapshot.builder()
            .status("error")
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
