package com.whereq.courier.idempotency;

import com.whereq.courier.support.MutableClock;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisIdempotencyGuardTest {

    private ReactiveValueOperations<String, String> valueOps;
    private RedisIdempotencyGuard guard;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ReactiveRedisTemplate<String, String> redisTemplate = mock(ReactiveRedisTemplate.class);
        valueOps = mock(ReactiveValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        guard = new RedisIdempotencyGuard(redisTemplate, TestFixtures.properties(), new MutableClock(TestFixtures.START));
    }

    @Test
    void firstSightingSetsKeyWithRetention() {
        when(valueOps.setIfAbsent(eq("courier:processed:abc"), anyString(), eq(Duration.ofHours(1))))
            .thenReturn(Mono.just(true));

        StepVerifier.create(guard.shouldProcess("abc")).expectNext(true).verifyComplete();

        verify(valueOps).setIfAbsent("courier:processed:abc",
            String.valueOf(TestFixtures.START.toEpochMilli()), Duration.ofHours(1));
    }

    @Test
    void existingKeyMeansDuplicate() {
        when(valueOps.setIfAbsent(eq("courier:processed:abc"), anyString(), eq(Duration.ofHours(1))))
            .thenReturn(Mono.just(false));

        StepVerifier.create(guard.shouldProcess("abc")).expectNext(false).verifyComplete();
    }
}
