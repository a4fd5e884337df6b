package com.whereq.courier.idempotency;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.support.MutableClock;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryIdempotencyGuardTest {

    private MutableClock clock;
    private InMemoryIdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.START);
        CourierProperties properties = TestFixtures.properties();
        properties.getIdempotency().setRetention(Duration.ofHours(1));
        guard = new InMemoryIdempotencyGuard(properties, clock);
    }

    @Test
    void secondSightingWithinRetentionIsSuppressed() {
        StepVerifier.create(guard.shouldProcess("abc")).expectNext(true).verifyComplete();

        clock.advance(Duration.ofMinutes(59));

        StepVerifier.create(guard.shouldProcess("abc")).expectNext(false).verifyComplete();
        StepVerifier.create(guard.shouldProcess("def")).expectNext(true).verifyComplete();
    }

    @Test
    void expiredIdentityIsProcessedAgainBeforeSweep() {
        guard.shouldProcess("abc").block();

        clock.advance(Duration.ofHours(1));

        StepVerifier.create(guard.shouldProcess("abc")).expectNext(true).verifyComplete();
        StepVerifier.create(guard.shouldProcess("abc")).expectNext(false).verifyComplete();
    }

    @Test
    void sweepEvictsOnlyExpiredEntries() {
        guard.shouldProcess("old").block();
        clock.advance(Duration.ofMinutes(45));
        guard.shouldProcess("recent").block();
        clock.advance(Duration.ofMinutes(30));

        StepVerifier.create(guard.sweep()).expectNext(1L).verifyComplete();

        assertThat(guard.size()).isEqualTo(1);
        StepVerifier.create(guard.shouldProcess("recent")).expectNext(false).verifyComplete();
    }
}
