package com.whereq.courier.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.CourierException;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.exception.QueueStoreException;
import com.whereq.courier.model.ClaimedJob;
import com.whereq.courier.model.DeadLetterEntry;
import com.whereq.courier.model.Job;
import com.whereq.courier.model.JobEnvelope;
import com.whereq.courier.model.QueueDepth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Job queue on top of three lists.
 *
 * Waiting is consumed from the head and appended at the tail. A claim moves the item
 * into processing with one atomic command; acknowledgement removes exactly that item.
 * Nothing here ever times out: items left in processing stay there until
 * {@link #recoverStuck()} is called.
 */
@Slf4j
@Service
public class ListBackedJobQueue implements JobQueue {

    private static final int LOG_PREVIEW_LENGTH = 100;

    private final QueueListStore store;
    private final EnvelopeCodec codec;
    private final JobValidator validator;
    private final Clock clock;
    private final String waitingKey;
    private final String processingKey;
    private final String deadKey;

    public ListBackedJobQueue(QueueListStore store,
                              EnvelopeCodec codec,
                              JobValidator validator,
                              CourierProperties properties,
                              Clock clock) {
        this.store = store;
        this.codec = codec;
        this.validator = validator;
        this.clock = clock;
        this.waitingKey = properties.getQueue().waitingKey();
        this.processingKey = properties.getQueue().processingKey();
        this.deadKey = properties.getQueue().deadKey();
    }

    @Override
    public Mono<Long> enqueue(Job job) {
        return Mono.fromCallable(() -> codec.wrap(validator.validate(job)))
            .flatMap(envelope -> store.rightPush(waitingKey, codec.encode(envelope))
                .onErrorMap(e -> !(e instanceof CourierException),
                    e -> new QueueStoreException("Failed to enqueue job " + envelope.getStreamId(), e))
                .doOnSuccess(size -> log.info("Enqueued job {} for channel {}, queue size: {}",
                    envelope.getStreamId(), job.getChannelId(), size)));
    }

    @Override
    public Mono<ClaimedJob> claimNext() {
        return store.moveHeadToTail(waitingKey, processingKey)
            .onErrorMap(e -> new QueueStoreException("Failed to claim job from " + waitingKey, e))
            .flatMap(this::toClaim);
    }

    @Override
    public Mono<Void> ackSuccess(ClaimedJob claim) {
        return store.remove(processingKey, claim.getRawPayload())
            .onErrorMap(e -> new QueueStoreException("Failed to acknowledge job " + claim.getStreamId(), e))
            .doOnSuccess(removed -> {
                if (removed != null && removed > 0) {
                    log.info("Acknowledged job {}", claim.getStreamId());
                } else {
                    log.warn("Acknowledged job {} was no longer in processing", claim.getStreamId());
                }
            })
            .then();
    }

    @Override
    public Mono<Void> ackFailure(ClaimedJob claim, String error) {
        DeadLetterEntry entry = DeadLetterEntry.builder()
            .streamId(claim.getStreamId())
            .body(claim.getJob())
            .error(error)
            .timestamp(Instant.now(clock))
            .build();

        return deadLetter(entry, claim.getRawPayload())
            .doOnSuccess(v -> log.warn("Moved job {} to dead letters: {}", claim.getStreamId(), error));
    }

    @Override
    public Flux<JobEnvelope> listWaiting(long offset, long count) {
        if (count <= 0) {
            return Flux.empty();
        }
        return store.range(waitingKey, offset, offset + count - 1)
            .onErrorMap(e -> new QueueStoreException("Failed to read " + waitingKey, e))
            .concatMap(raw -> {
                try {
                    return Mono.just(codec.decode(raw));
                } catch (JobValidationException e) {
                    log.warn("Skipping unparseable waiting item {}: {}", preview(raw), e.getMessage());
                    return Mono.empty();
                }
            });
    }

    @Override
    public Flux<DeadLetterEntry> listDead(long offset, long count) {
        if (count <= 0) {
            return Flux.empty();
        }
        return store.range(deadKey, offset, offset + count - 1)
            .onErrorMap(e -> new QueueStoreException("Failed to read " + deadKey, e))
            .map(raw -> {
                try {
                    return codec.decodeDeadLetter(raw);
                } catch (JsonProcessingException e) {
                    return DeadLetterEntry.builder()
                        .error("Failed to parse dead letter queue item")
                        .rawPayload(preview(raw))
                        .build();
                }
            });
    }

    @Override
    public Mono<QueueDepth> depth() {
        return Mono.zip(store.size(waitingKey), store.size(processingKey), store.size(deadKey))
            .map(sizes -> QueueDepth.builder()
                .waiting(sizes.getT1())
                .processing(sizes.getT2())
                .dead(sizes.getT3())
                .build())
            .onErrorMap(e -> new QueueStoreException("Failed to read queue depth", e));
    }

    @Override
    public Mono<Long> recoverStuck() {
        return moveProcessingToWaiting(0L)
            .doOnSuccess(count -> log.info("Recovered {} stuck job(s) from {}", count, processingKey));
    }

    @Override
    public Mono<Void> flush() {
        return store.delete(waitingKey, processingKey)
            .onErrorMap(e -> new QueueStoreException("Failed to flush queue", e))
            .doOnSuccess(deleted -> log.warn("Flushed {} and {}", waitingKey, processingKey))
            .then();
    }

    /**
     * One LMOVE per item so a concurrent claim never sees a half-moved list
     */
    private Mono<Long> moveProcessingToWaiting(long moved) {
        return store.moveHeadToTail(processingKey, waitingKey)
            .onErrorMap(e -> new QueueStoreException("Failed to recover stuck jobs after " + moved + " moved", e))
            .flatMap(value -> Mono.defer(() -> moveProcessingToWaiting(moved + 1)))
            .switchIfEmpty(Mono.fromSupplier(() -> moved));
    }

    private Mono<ClaimedJob> toClaim(String raw) {
        try {
            JobEnvelope envelope = codec.decode(raw);
            log.debug("Claimed job {} from {}", envelope.getStreamId(), waitingKey);
            return Mono.just(new ClaimedJob(envelope, raw));
        } catch (JobValidationException e) {
            log.error("Moving unparseable queue item to dead letters: {}", preview(raw), e);
            DeadLetterEntry entry = DeadLetterEntry.builder()
                .error(e.getMessage())
                .timestamp(Instant.now(clock))
                .rawPayload(raw)
                .build();
            return deadLetter(entry, raw)
                .then(Mono.defer(this::claimNext));
        }
    }

    private Mono<Void> deadLetter(DeadLetterEntry entry, String rawPayload) {
        return Mono.fromCallable(() -> codec.encode(entry))
            .flatMap(json -> store.rightPush(deadKey, json))
            .then(store.remove(processingKey, rawPayload))
            .onErrorMap(e -> !(e instanceof CourierException),
                e -> new QueueStoreException("Failed to write dead letter for " + entry.getStreamId(), e))
            .then();
    }

    private static String preview(String raw) {
        if (raw == null || raw.length() <= LOG_PREVIEW_LENGTH) {
            return raw;
        }
        return raw.substring(0, LOG_PREVIEW_LENGTH) + "...";
    }
}
