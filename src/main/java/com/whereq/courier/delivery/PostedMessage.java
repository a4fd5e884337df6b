package com.whereq.courier.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a message the platform accepted
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostedMessage {
    private String channel;

    private String messageId;
}
