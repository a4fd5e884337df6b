package com.whereq.courier.delivery;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.DeliveryException;
import com.whereq.courier.exception.ThrottledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;

/**
 * Wraps every outbound platform call with retry on throttling.
 *
 * The platform limit is a fixed rate per destination, so a throttled call waits a fixed
 * interval (or longer if the platform asks for it) instead of backing off exponentially.
 * Other failures are not retried.
 */
@Slf4j
@Component
public class RateLimitedDeliveryClient {

    private final MessagingPlatform platform;
    private final int maxAttempts;
    private final Duration throttleInterval;

    public RateLimitedDeliveryClient(MessagingPlatform platform, CourierProperties properties) {
        this.platform = platform;
        this.maxAttempts = properties.getDelivery().getMaxAttempts();
        this.throttleInterval = properties.getDelivery().getThrottleInterval();
    }

    /**
     * Call a platform operation, retrying while it is throttled
     *
     * @param operation platform operation
     * @param params operation parameters
     * @param maxAttempts total attempts, including the first one
     * @return Mono with the operation result; fails with {@link DeliveryException} once attempts run out
     */
    public <P, R> Mono<R> call(Function<P, Mono<R>> operation, P params, int maxAttempts) {
        return attempt(operation, params, 1, Math.max(1, maxAttempts));
    }

    /**
     * Post a new message
     */
    public Mono<PostedMessage> post(OutboundMessage message) {
        return call(platform::postMessage, message, maxAttempts);
    }

    /**
     * Edit an existing message in place
     */
    public Mono<PostedMessage> update(MessageUpdate update) {
        return call(platform::updateMessage, update, maxAttempts);
    }

    public boolean isConfigured() {
        return platform.isConfigured();
    }

    private <P, R> Mono<R> attempt(Function<P, Mono<R>> operation, P params, int attempt, int maxAttempts) {
        return Mono.defer(() -> operation.apply(params))
            .onErrorResume(ThrottledException.class, e -> {
                if (attempt >= maxAttempts) {
                    log.warn("Still rate limited after {} attempt(s), giving up", attempt);
                    return Mono.error(new DeliveryException(
                        "Rate limited by messaging platform after " + attempt + " attempt(s)", e));
                }
                Duration wait = e.getRetryAfter().compareTo(throttleInterval) > 0
                    ? e.getRetryAfter()
                    : throttleInterval;
                log.info("Rate limited by messaging platform. Retry {}/{} after {}ms",
                    attempt, maxAttempts - 1, wait.toMillis());
                return Mono.delay(wait)
                    .then(Mono.defer(() -> attempt(operation, params, attempt + 1, maxAttempts)));
            });
    }
}
