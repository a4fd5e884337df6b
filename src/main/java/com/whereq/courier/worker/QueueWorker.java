package com.whereq.courier.worker;

import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.model.ClaimedJob;
import com.whereq.courier.model.DispatchMode;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Pull side of the worker: claims one job, dispatches it and settles the claim.
 *
 * Acknowledged results leave the queue, errors go to the dead-letter list.
 * Store failures propagate and leave the claim in processing for manual recovery.
 */
@Slf4j
@Service
public class QueueWorker {

    private final JobQueue jobQueue;
    private final WorkerDispatcher dispatcher;
    private final WorkerChainTrigger chainTrigger;
    private final Counter deadLetteredCounter;

    public QueueWorker(JobQueue jobQueue,
                       WorkerDispatcher dispatcher,
                       WorkerChainTrigger chainTrigger,
                       MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.dispatcher = dispatcher;
        this.chainTrigger = chainTrigger;
        this.deadLetteredCounter = Counter.builder("courier.jobs.dead_lettered")
            .description("Number of claimed jobs moved to the dead-letter list")
            .register(meterRegistry);
    }

    /**
     * Process the next waiting job
     *
     * @return Mono with the dispatch result, {@code no_jobs} when the queue is empty
     */
    public Mono<DispatchResult> processNext() {
        return jobQueue.claimNext()
            .flatMap(this::process)
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.debug("No jobs waiting");
                return DispatchResult.builder()
                    .status(DispatchStatus.NO_JOBS)
                    .message("No jobs in queue")
                    .remainingJobs(0L)
                    .build();
            }));
    }

    private Mono<DispatchResult> process(ClaimedJob claim) {
        log.info("Processing queued job {}", claim.getStreamId());

        return dispatcher.dispatch(claim.getJob())
            .onErrorResume(JobValidationException.class, e -> Mono.just(DispatchResult.builder()
                .status(DispatchStatus.ERROR)
                .mode(DispatchMode.STANDARD)
                .error(e.getMessage())
                .build()))
            .flatMap(result -> settle(claim, result))
            .flatMap(result -> jobQueue.depth()
                .map(depth -> result.toBuilder()
                    .jobId(claim.getStreamId())
                    .remainingJobs(depth.getWaiting())
                    .build()))
            .doOnSuccess(result -> {
                if (result.getRemainingJobs() != null && result.getRemainingJobs() > 0) {
                    chainTrigger.triggerNext(result.getRemainingJobs());
                }
            });
    }

    private Mono<DispatchResult> settle(ClaimedJob claim, DispatchResult result) {
        if (result.getStatus() != null && result.getStatus().isAcknowledged()) {
            return jobQueue.ackSuccess(claim).thenReturn(result);
        }
        String error = result.getError() != null ? result.getError() : "Processing failed";
        return jobQueue.ackFailure(claim, error)
            .doOnSuccess(v -> deadLetteredCounter.increment())
            .thenReturn(result);
    }
}
