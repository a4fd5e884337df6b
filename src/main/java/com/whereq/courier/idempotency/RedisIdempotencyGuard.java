package com.whereq.courier.idempotency;

import com.whereq.courier.config.CourierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Idempotency keys in Redis, shared by every worker instance.
 * Each identity is a key written with SET NX and an expiry equal to the retention window.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "courier.idempotency", name = "store", havingValue = "REDIS", matchIfMissing = true)
public class RedisIdempotencyGuard implements IdempotencyGuard {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration retention;

    public RedisIdempotencyGuard(ReactiveRedisTemplate<String, String> redisTemplate,
                                 CourierProperties properties,
                                 Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = properties.getIdempotency().getKeyPrefix();
        this.retention = properties.getIdempotency().getRetention();
    }

    @Override
    public Mono<Boolean> shouldProcess(String identity) {
        return redisTemplate.opsForValue()
            .setIfAbsent(keyPrefix + identity, String.valueOf(clock.millis()), retention)
            .defaultIfEmpty(false)
            .doOnNext(first -> {
                if (!first) {
                    log.info("Job {} was already processed", identity);
                }
            });
    }

    @Override
    public Mono<Long> sweep() {
        // keys expire on their own
        return Mono.just(0L);
    }
}
