package com.whereq.courier.queue;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Queue lists kept in Redis, shared by every running worker
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "courier.queue", name = "store", havingValue = "REDIS", matchIfMissing = true)
public class RedisQueueListStore implements QueueListStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    @Override
    public Mono<Long> rightPush(String key, String value) {
        return redisTemplate.opsForList().rightPush(key, value);
    }

    @Override
    public Mono<String> moveHeadToTail(String sourceKey, String destinationKey) {
        return redisTemplate.opsForList().move(
            ListOperations.MoveFrom.fromHead(sourceKey),
            ListOperations.MoveTo.toTail(destinationKey));
    }

    @Override
    public Mono<Long> remove(String key, String value) {
        return redisTemplate.opsForList().remove(key, 1, value);
    }

    @Override
    public Flux<String> range(String key, long start, long end) {
        return redisTemplate.opsForList().range(key, start, end);
    }

    @Override
    public Mono<Long> size(String key) {
        return redisTemplate.opsForList().size(key)
            .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Long> delete(String... keys) {
        return redisTemplate.delete(keys);
    }

    @Override
    public Mono<String> ping() {
        return redisTemplate.execute(connection -> connection.ping())
            .next();
    }
}
