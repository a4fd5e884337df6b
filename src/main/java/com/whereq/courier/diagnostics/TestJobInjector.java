package com.whereq.courier.diagnostics;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.dto.TestJobResponse;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.model.Job;
import com.whereq.courier.queue.JobQueue;
import com.whereq.courier.worker.QueueWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Pushes a synthetic job through the queue and the worker, to check a deployment end to end
 */
@Slf4j
@Service
public class TestJobInjector {

    static final String TEST_USER = "force-worker";

    private final JobQueue jobQueue;
    private final QueueWorker queueWorker;
    private final CourierProperties properties;
    private final Clock clock;

    public TestJobInjector(JobQueue jobQueue, QueueWorker queueWorker, CourierProperties properties, Clock clock) {
        this.jobQueue = jobQueue;
        this.queueWorker = queueWorker;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Enqueue a test job for a channel, then run the worker once
     *
     * @param channelId channel to post the test answer to
     * @return Mono with the enqueue and worker outcome
     */
    public Mono<TestJobResponse> inject(String channelId) {
        Job job = Job.builder()
            .channelId(channelId)
            .userId(TEST_USER)
            .questionText(properties.getMessages().getTestQuestion())
            .eventId(eventId(Instant.now(clock)))
            .useStreaming(false)
            .build();

        log.info("Injecting test job for channel {}", channelId);

        return jobQueue.enqueue(job)
            .flatMap(depth -> queueWorker.processNext()
                .onErrorResume(e -> {
                    log.error("Worker run after test job injection failed", e);
                    return Mono.just(DispatchResult.builder()
                        .status(DispatchStatus.ERROR)
                        .error(e.getMessage())
                        .build());
                })
                .map(result -> TestJobResponse.builder()
                    .status(result.isError() ? "error" : "success")
                    .job(job)
                    .queueDepth(depth)
                    .workerResult(result)
                    .timestamp(Instant.now(clock))
                    .build()));
    }

    /**
     * Platform style timestamp, seconds and microseconds
     */
    static String eventId(Instant now) {
        return now.getEpochSecond() + "." + String.format("%06d", now.getNano() / 1000);
    }
}
