package com.whereq.courier.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New text for an already posted message
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageUpdate {
    private String channel;

    /**
     * Platform reference of the message to edit
     */
    private String messageId;

    private String text;
}
