package com.whereq.courier.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A new message to post
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {
    private String channel;

    private String text;

    /**
     * Thread to reply in, null for a top-level message
     */
    private String threadId;
}
