package com.whereq.courier.idempotency;

import reactor.core.publisher.Mono;

/**
 * Remembers which jobs were already taken up so a redelivered job is not answered twice.
 *
 * This is a best-effort suppression of duplicate posts; the queue itself remains
 * at-least-once.
 */
public interface IdempotencyGuard {

    /**
     * Record a job identity
     *
     * @param identity stable job identity, see {@link JobIdentity}
     * @return Mono with true the first time an identity is seen within the retention window
     */
    Mono<Boolean> shouldProcess(String identity);

    /**
     * Forget identities older than the retention window
     *
     * @return Mono with the number of evicted identities
     */
    Mono<Long> sweep();
}
