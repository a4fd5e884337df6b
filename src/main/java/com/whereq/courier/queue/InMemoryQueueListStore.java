package com.whereq.courier.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * Queue lists held in process memory, for local runs without Redis.
 * Jobs are lost on restart and are not shared between instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "courier.queue", name = "store", havingValue = "MEMORY")
public class InMemoryQueueListStore implements QueueListStore {

    private final Map<String, LinkedList<String>> lists = new HashMap<>();

    public InMemoryQueueListStore() {
        log.warn("Using in-memory queue store; queued jobs will not survive a restart");
    }

    @Override
    public Mono<Long> rightPush(String key, String value) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                LinkedList<String> list = lists.computeIfAbsent(key, k -> new LinkedList<>());
                list.addLast(value);
                return (long) list.size();
            }
        });
    }

    @Override
    public Mono<String> moveHeadToTail(String sourceKey, String destinationKey) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                LinkedList<String> source = lists.get(sourceKey);
                if (source == null || source.isEmpty()) {
                    return null;
                }
                String value = source.removeFirst();
                lists.computeIfAbsent(destinationKey, k -> new LinkedList<>()).addLast(value);
                return value;
            }
        });
    }

    @Override
    public Mono<Long> remove(String key, String value) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                LinkedList<String> list = lists.get(key);
                return list != null && list.remove(value) ? 1L : 0L;
            }
        });
    }

    @Override
    public Flux<String> range(String key, long start, long end) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                LinkedList<String> list = lists.get(key);
                if (list == null || start >= list.size()) {
                    return List.<String>of();
                }
                long last = end < 0 ? list.size() + end : Math.min(end, list.size() - 1);
                if (last < start) {
                    return List.<String>of();
                }
                return new ArrayList<>(list.subList((int) start, (int) last + 1));
            }
        }).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Long> size(String key) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                LinkedList<String> list = lists.get(key);
                return list == null ? 0L : (long) list.size();
            }
        });
    }

    @Override
    public Mono<Long> delete(String... keys) {
        return Mono.fromCallable(() -> {
            synchronized (lists) {
                long removed = 0;
                for (String key : keys) {
                    if (lists.remove(key) != null) {
                        removed++;
                    }
                }
                return removed;
            }
        });
    }

    @Override
    public Mono<String> ping() {
        return Mono.just("PONG");
    }
}
