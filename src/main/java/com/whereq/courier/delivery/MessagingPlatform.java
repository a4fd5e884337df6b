package com.whereq.courier.delivery;

import reactor.core.publisher.Mono;

/**
 * Outbound calls to the messaging platform.
 *
 * Implementations fail with {@link com.whereq.courier.exception.ThrottledException} when the
 * platform rate limit is hit and with {@link com.whereq.courier.exception.DeliveryException}
 * for every other failure.
 */
public interface MessagingPlatform {

    /**
     * Post a new message
     */
    Mono<PostedMessage> postMessage(OutboundMessage message);

    /**
     * Replace the text of an existing message
     */
    Mono<PostedMessage> updateMessage(MessageUpdate update);

    /**
     * Check if a delivery credential is available
     */
    boolean isConfigured();
}
