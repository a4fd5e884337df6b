package com.whereq.courier.idempotency;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencySweepSchedulerTest {

    @Test
    void sweepFailureIsLoggedNotThrown() {
        IdempotencyGuard guard = mock(IdempotencyGuard.class);
        when(guard.sweep()).thenReturn(Mono.error(new IllegalStateException("store unavailable")));

        assertThatCode(() -> new IdempotencySweepScheduler(guard).sweep()).doesNotThrowAnyException();

        verify(guard).sweep();
    }
}
