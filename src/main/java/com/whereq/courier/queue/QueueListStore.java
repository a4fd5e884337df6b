package com.whereq.courier.queue;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Atomic list primitives the job queue is built on.
 * Every mutation is a single store command; callers never read-then-write.
 */
public interface QueueListStore {

    /**
     * Append to the tail of a list
     *
     * @return Mono with the list length after the append
     */
    Mono<Long> rightPush(String key, String value);

    /**
     * Move the head of one list to the tail of another
     *
     * @return Mono with the moved value, empty when the source list is empty
     */
    Mono<String> moveHeadToTail(String sourceKey, String destinationKey);

    /**
     * Remove the first occurrence of a value
     *
     * @return Mono with the number of removed values
     */
    Mono<Long> remove(String key, String value);

    /**
     * Read a range of a list, both ends inclusive
     */
    Flux<String> range(String key, long start, long end);

    Mono<Long> size(String key);

    /**
     * Delete whole lists
     *
     * @return Mono with the number of lists that existed
     */
    Mono<Long> delete(String... keys);

    /**
     * Check the store is reachable
     */
    Mono<String> ping();
}
