package com.whereq.courier.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sizes of the three queue lists
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueDepth {
    private long waiting;
    private long processing;
    private long dead;
}
