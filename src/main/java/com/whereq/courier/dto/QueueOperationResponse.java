package com.whereq.courier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of an administrative queue operation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueOperationResponse {
    private String status;

    private String operation;

    /**
     * Jobs moved back to waiting, only for recovery
     */
    private Long jobsRecovered;

    private String message;

    private Instant timestamp;

    public static QueueOperationResponse error(String operation, String message) {
        return QueueOperationResponse.builder()
            .status("error")
            .operation(operation)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
