package com.whereq.courier.queue;

import com.whereq.courier.model.ClaimedJob;
import com.whereq.courier.model.DeadLetterEntry;
import com.whereq.courier.model.Job;
import com.whereq.courier.model.JobEnvelope;
import com.whereq.courier.model.QueueDepth;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable job queue made of three lists: waiting, processing and dead.
 *
 * Delivery is at-least-once. A claim moves one job into processing but does not
 * make the claimer its only processor.
 */
public interface JobQueue {
    /**
     * Append a job to the tail of the waiting list
     *
     * @param job the job to enqueue
     * @return Mono with the waiting depth after the append
     */
    Mono<Long> enqueue(Job job);

    /**
     * Atomically move the head of the waiting list into processing
     *
     * @return Mono with the claimed job, empty when nothing is waiting
     */
    Mono<ClaimedJob> claimNext();

    /**
     * Acknowledge successful processing of a claimed job
     *
     * @param claim the claimed job
     * @return Mono that completes when the job left processing
     */
    Mono<Void> ackSuccess(ClaimedJob claim);

    /**
     * Move a claimed job to the dead-letter list
     *
     * @param claim the claimed job
     * @param error why processing failed
     * @return Mono that completes when the dead-letter entry is written and the job left processing
     */
    Mono<Void> ackFailure(ClaimedJob claim, String error);

    /**
     * Read waiting jobs without removing them
     */
    Flux<JobEnvelope> listWaiting(long offset, long count);

    /**
     * Read dead-letter entries without removing them
     */
    Flux<DeadLetterEntry> listDead(long offset, long count);

    /**
     * Current size of every list
     */
    Mono<QueueDepth> depth();

    /**
     * Move every job in processing back to the tail of waiting, keeping their order.
     * Used after a worker died between claim and acknowledgement.
     *
     * @return Mono with the number of recovered jobs
     */
    Mono<Long> recoverStuck();

    /**
     * Drop everything in waiting and processing. Dead letters are kept.
     */
    Mono<Void> flush();
}
