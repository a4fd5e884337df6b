package com.whereq.courier.idempotency;

import com.whereq.courier.config.CourierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local idempotency record.
 *
 * Only suppresses duplicates delivered to the same running instance; independently
 * scaled instances do not see each other's entries.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "courier.idempotency", name = "store", havingValue = "MEMORY")
public class InMemoryIdempotencyGuard implements IdempotencyGuard {

    private final Map<String, Long> firstSeen = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public InMemoryIdempotencyGuard(CourierProperties properties, Clock clock) {
        this.clock = clock;
        this.retention = properties.getIdempotency().getRetention();
    }

    @Override
    public Mono<Boolean> shouldProcess(String identity) {
        return Mono.fromSupplier(() -> {
            long now = clock.millis();
            Long previous = firstSeen.putIfAbsent(identity, now);
            if (previous == null) {
                return true;
            }
            if (now - previous >= retention.toMillis() && firstSeen.replace(identity, previous, now)) {
                // expired but not swept yet
                return true;
            }
            log.info("Job {} was already processed", identity);
            return false;
        });
    }

    @Override
    public Mono<Long> sweep() {
        return Mono.fromSupplier(() -> {
            long cutoff = clock.millis() - retention.toMillis();
            long before = firstSeen.size();
            firstSeen.values().removeIf(seenAt -> seenAt < cutoff);
            long evicted = before - firstSeen.size();
            if (evicted > 0) {
                log.debug("Evicted {} expired job identities", evicted);
            }
            return evicted;
        });
    }

    int size() {
        return firstSeen.size();
    }
}
