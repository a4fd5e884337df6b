package com.whereq.courier.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for an administrative queue operation
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueOperationRequest {
    /**
     * {@code flush_queue} or {@code recover_stuck_jobs}
     */
    @NotBlank
    private String operation;
}
