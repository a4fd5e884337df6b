package com.whereq.courier.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Periodically evicts expired job identities to bound memory
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencySweepScheduler {

    private final IdempotencyGuard idempotencyGuard;

    @Scheduled(fixedDelayString = "${courier.idempotency.sweep-interval:PT15M}",
               initialDelayString = "${courier.idempotency.sweep-interval:PT15M}")
    public void sweep() {
        idempotencyGuard.sweep()
            .doOnError(e -> log.error("Idempotency sweep failed", e))
            .onErrorResume(e -> Mono.empty())
            .subscribe();
    }
}
