package com.whereq.courier.diagnostics;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.dto.QueueOperationResponse;
import com.whereq.courier.dto.QueueSnapshot;
import com.whereq.courier.dto.SampleJob;
import com.whereq.courier.model.DeadLetterEntry;
import com.whereq.courier.model.Job;
import com.whereq.courier.model.JobEnvelope;
import com.whereq.courier.queue.JobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operator view of the queue and the manual recovery operations.
 *
 * Question texts are truncated in every report since they may hold user content.
 */
@Slf4j
@Service
public class QueueDiagnosticsService {

    static final int QUESTION_PREVIEW_LENGTH = 50;

    private final JobQueue jobQueue;
    private final TimestampFormatValidator timestampValidator;
    private final CourierProperties properties;
    private final Clock clock;

    public QueueDiagnosticsService(JobQueue jobQueue,
                                   TimestampFormatValidator timestampValidator,
                                   CourierProperties properties,
                                   Clock clock) {
        this.jobQueue = jobQueue;
        this.timestampValidator = timestampValidator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Depths of all lists, the head of waiting and a sample of dead letters
     */
    public Mono<QueueSnapshot> inspect() {
        Mono<SampleJob> sample = jobQueue.listWaiting(0, 1)
            .next()
            .map(this::toSample);

        Mono<List<DeadLetterEntry>> deadLetters = jobQueue
            .listDead(0, properties.getQueue().getDeadLetterSampleSize())
            .map(QueueDiagnosticsService::truncate)
            .collectList();

        // zip drops everything on an empty source, so the optional head is wrapped
        Mono<Optional<SampleJob>> head = sample.map(Optional::of).defaultIfEmpty(Optional.empty());

        return Mono.zip(jobQueue.depth(), head, deadLetters)
            .map(tuple -> QueueSnapshot.builder()
                .status("success")
                .timestamp(Instant.now(clock))
                .queueName(properties.getQueue().getName())
                .queueHealth(tuple.getT1())
                .sampleJob(tuple.getT2().orElse(null))
                .deadLetterJobs(tuple.getT3().isEmpty() ? null : tuple.getT3())
                .build())
            .doOnSuccess(snapshot -> log.info("Queue diagnostics: {}", snapshot.getQueueHealth()));
    }

    /**
     * Move every job left in processing back to waiting
     */
    public Mono<QueueOperationResponse> recover() {
        return jobQueue.recoverStuck()
            .map(recovered -> QueueOperationResponse.builder()
                .status("success")
                .operation(QueueOperation.RECOVER_STUCK_JOBS.wireName())
                .jobsRecovered(recovered)
                .message(recovered > 0
                    ? "Recovered " + recovered + " job(s) from processing"
                    : "No stuck jobs found")
                .timestamp(Instant.now(clock))
                .build());
    }

    /**
     * Drop every waiting and processing job
     */
    public Mono<QueueOperationResponse> flush() {
        return jobQueue.flush()
            .then(Mono.fromSupplier(() -> QueueOperationResponse.builder()
                .status("success")
                .operation(QueueOperation.FLUSH_QUEUE.wireName())
                .message("Queue flushed")
                .timestamp(Instant.now(clock))
                .build()));
    }

    /**
     * Run an operation by name
     *
     * @throws IllegalArgumentException for an unknown operation
     */
    public Mono<QueueOperationResponse> apply(String operation) {
        return Mono.fromCallable(() -> QueueOperation.fromWireName(operation))
            .flatMap(resolved -> {
                log.warn("Running queue operation {}", resolved.wireName());
                switch (resolved) {
                    case FLUSH_QUEUE:
                        return flush();
                    case RECOVER_STUCK_JOBS:
                        return recover();
                    default:
                        return Mono.error(new IllegalArgumentException("Unknown operation: " + operation));
                }
            });
    }

    private SampleJob toSample(JobEnvelope envelope) {
        Job job = envelope.getBody();
        return SampleJob.builder()
            .streamId(envelope.getStreamId())
            .enqueuedAt(envelope.getEnqueuedAt())
            .original(truncate(job))
            .timestamps(timestampValidator.report(job))
            .build();
    }

    private static DeadLetterEntry truncate(DeadLetterEntry entry) {
        if (entry.getBody() == null) {
            return entry;
        }
        return DeadLetterEntry.builder()
            .streamId(entry.getStreamId())
            .body(truncate(entry.getBody()))
            .error(entry.getError())
            .timestamp(entry.getTimestamp())
            .rawPayload(entry.getRawPayload())
            .build();
    }

    static Job truncate(Job job) {
        String question = job.getQuestionText();
        if (question == null || question.length() <= QUESTION_PREVIEW_LENGTH) {
            return job;
        }
        return job.toBuilder()
            .questionText(question.substring(0, QUESTION_PREVIEW_LENGTH) + "...")
            .build();
    }
}
