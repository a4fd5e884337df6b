package com.whereq.courier.worker;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.delivery.MessageUpdate;
import com.whereq.courier.delivery.OutboundMessage;
import com.whereq.courier.delivery.RateLimitedDeliveryClient;
import com.whereq.courier.delivery.ResponseUrlClient;
import com.whereq.courier.exception.DeliveryException;
import com.whereq.courier.exception.GenerationException;
import com.whereq.courier.generation.AnswerGenerator;
import com.whereq.courier.idempotency.IdempotencyGuard;
import com.whereq.courier.idempotency.JobIdentity;
import com.whereq.courier.model.DispatchMode;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.model.Job;
import com.whereq.courier.queue.JobValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Answers one job and delivers the result to its conversation.
 *
 * Holds no state between invocations apart from what the idempotency guard records.
 * Every failure after validation ends with a best-effort warning to the user before the
 * error is reported.
 */
@Slf4j
@Service
public class WorkerDispatcher {

    private static final int LOG_QUESTION_LENGTH = 30;

    private final JobValidator validator;
    private final IdempotencyGuard idempotencyGuard;
    private final AnswerGenerator answerGenerator;
    private final RateLimitedDeliveryClient deliveryClient;
    private final ResponseUrlClient responseUrlClient;
    private final StreamingUpdateThrottler streamingThrottler;
    private final CourierProperties properties;

    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;
    private final Timer generationTimer;

    public WorkerDispatcher(JobValidator validator,
                            IdempotencyGuard idempotencyGuard,
                            AnswerGenerator answerGenerator,
                            RateLimitedDeliveryClient deliveryClient,
                            ResponseUrlClient responseUrlClient,
                            StreamingUpdateThrottler streamingThrottler,
                            CourierProperties properties,
                            MeterRegistry meterRegistry) {
        this.validator = validator;
        this.idempotencyGuard = idempotencyGuard;
        this.answerGenerator = answerGenerator;
        this.deliveryClient = deliveryClient;
        this.responseUrlClient = responseUrlClient;
        this.streamingThrottler = streamingThrottler;
        this.properties = properties;

        this.deliveredCounter = Counter.builder("courier.jobs.delivered")
            .description("Number of answers delivered")
            .register(meterRegistry);

        this.failedCounter = Counter.builder("courier.jobs.failed")
            .description("Number of jobs that ended with an error or a partial answer")
            .register(meterRegistry);

        this.skippedCounter = Counter.builder("courier.jobs.skipped")
            .description("Number of duplicate job deliveries skipped")
            .register(meterRegistry);

        this.generationTimer = Timer.builder("courier.generation.time")
            .description("Answer generation time")
            .register(meterRegistry);
    }

    /**
     * Process one job
     *
     * @param job job to answer
     * @return Mono with the dispatch result; fails with
     *         {@link com.whereq.courier.exception.JobValidationException} before any side effect
     *         when the job is incomplete
     */
    public Mono<DispatchResult> dispatch(Job job) {
        return Mono.fromCallable(() -> validator.validate(job))
            .flatMap(valid -> {
                if (!valid.hasEventId()) {
                    return process(valid, null);
                }
                // recorded before generation starts to keep the duplicate window small
                String identity = JobIdentity.of(valid);
                return idempotencyGuard.shouldProcess(identity)
                    .flatMap(first -> first
                        ? process(valid, identity)
                        : Mono.fromSupplier(() -> skipped(identity)));
            });
    }

    private Mono<DispatchResult> process(Job job, String jobId) {
        log.info("Processing job {} for channel {}: \"{}\"",
            jobId, job.getChannelId(), preview(job.getQuestionText()));

        if (isStreamingEligible(job)) {
            return processStreaming(job, jobId);
        }
        return processStandard(job, jobId);
    }

    private boolean isStreamingEligible(Job job) {
        return job.hasPlaceholder()
            && job.hasChannel()
            && job.isUseStreaming()
            && properties.getStreaming().isEnabled()
            && deliveryClient.isConfigured();
    }

    private Mono<DispatchResult> processStandard(Job job, String jobId) {
        DispatchMode mode = usesResponseUrl(job) ? DispatchMode.RESPONSE_URL : DispatchMode.STANDARD;

        return generate(job.getQuestionText())
            .flatMap(answer -> deliver(job, answer, mode))
            .then(Mono.fromSupplier(() -> {
                deliveredCounter.increment();
                log.info("Delivered answer for job {} via {}", jobId, mode.wireName());
                return result(DispatchStatus.SUCCESS, mode, jobId);
            }))
            .onErrorResume(e -> fail(job, jobId, mode, e));
    }

    private Mono<DispatchResult> processStreaming(Job job, String jobId) {
        log.info("Streaming answer for job {} into message {}", jobId, job.getPlaceholderMessageId());

        Duration budget = properties.getStreaming().getTimeout();
        Flux<String> chunks = Flux.defer(() -> answerGenerator.generateStreaming(job.getQuestionText()))
            .timeout(budget)
            .onErrorMap(TimeoutException.class,
                e -> new GenerationException("Streaming answer exceeded " + budget.toMillis() + " ms", e));

        return streamingThrottler.run(chunks, text -> deliveryClient.update(MessageUpdate.builder()
                .channel(job.getChannelId())
                .messageId(job.getPlaceholderMessageId())
                .text(text)
                .build()))
            .map(outcome -> {
                switch (outcome.getKind()) {
                    case COMPLETED:
                        deliveredCounter.increment();
                        return result(DispatchStatus.SUCCESS, DispatchMode.STREAMING, jobId);
                    case PARTIAL:
                        failedCounter.increment();
                        log.warn("Job {} delivered a partial streaming answer: {}", jobId, outcome.getError());
                        return result(DispatchStatus.PARTIAL_SUCCESS, DispatchMode.STREAMING, jobId).toBuilder()
                            .error(outcome.getError())
                            .build();
                    default:
                        failedCounter.increment();
                        log.error("Job {} failed before any streaming content: {}", jobId, outcome.getError());
                        return result(DispatchStatus.ERROR, DispatchMode.STREAMING, jobId).toBuilder()
                            .error(outcome.getError())
                            .build();
                }
            });
    }

    private Mono<String> generate(String question) {
        return Mono.defer(() -> {
            long startTime = System.currentTimeMillis();
            return answerGenerator.generate(question)
                .timeout(properties.getGeneration().getTimeout())
                .switchIfEmpty(Mono.error(new GenerationException("Generation engine returned no answer")))
                .onErrorMap(e -> !(e instanceof GenerationException),
                    e -> new GenerationException("Answer generation failed: " + e.getMessage(), e))
                .doOnSuccess(answer -> generationTimer.record(
                    Duration.ofMillis(System.currentTimeMillis() - startTime)));
        });
    }

    /**
     * Placeholder first, channel second, response URL last
     */
    private Mono<Void> deliver(Job job, String answer, DispatchMode mode) {
        if (mode == DispatchMode.RESPONSE_URL) {
            return responseUrlClient.send(job.getResponseUrl(), answer);
        }
        if (!deliveryClient.isConfigured()) {
            return Mono.error(new DeliveryException("No delivery credential configured and no response URL available"));
        }
        if (job.hasPlaceholder()) {
            return deliveryClient.update(MessageUpdate.builder()
                    .channel(job.getChannelId())
                    .messageId(job.getPlaceholderMessageId())
                    .text(answer)
                    .build())
                .then();
        }
        return deliveryClient.post(OutboundMessage.builder()
                .channel(job.getChannelId())
                .text(answer)
                .threadId(job.replyThreadId())
                .build())
            .then();
    }

    private boolean usesResponseUrl(Job job) {
        return job.hasResponseUrl() && (!deliveryClient.isConfigured() || !job.hasChannel());
    }

    private Mono<DispatchResult> fail(Job job, String jobId, DispatchMode mode, Throwable error) {
        log.error("Job {} failed: {}", jobId, error.getMessage(), error);
        failedCounter.increment();

        return notifyFailure(job, jobId)
            .thenReturn(result(DispatchStatus.ERROR, mode, jobId).toBuilder()
                .error(error.getMessage())
                .build());
    }

    /**
     * Best-effort user-visible warning; its own failures are logged and not retried
     */
    private Mono<Void> notifyFailure(Job job, String jobId) {
        String warning = properties.getMessages().getWarning();
        Mono<Void> notice;

        if (job.hasPlaceholder() && job.hasChannel() && deliveryClient.isConfigured()) {
            notice = deliveryClient.update(MessageUpdate.builder()
                    .channel(job.getChannelId())
                    .messageId(job.getPlaceholderMessageId())
                    .text(warning)
                    .build())
                .then();
        } else if (job.hasResponseUrl()) {
            notice = responseUrlClient.send(job.getResponseUrl(), warning);
        } else if (job.hasChannel() && deliveryClient.isConfigured()) {
            notice = deliveryClient.post(OutboundMessage.builder()
                    .channel(job.getChannelId())
                    .text(warning)
                    .threadId(job.replyThreadId())
                    .build())
                .then();
        } else {
            log.warn("No way to notify the user that job {} failed", jobId);
            return Mono.empty();
        }

        return notice
            .doOnSuccess(v -> log.info("Sent failure notice for job {}", jobId))
            .onErrorResume(e -> {
                log.error("Failed to send failure notice for job {}", jobId, e);
                return Mono.empty();
            });
    }

    private DispatchResult skipped(String identity) {
        skippedCounter.increment();
        log.info("Skipping already processed job {}", identity);
        return DispatchResult.builder()
            .status(DispatchStatus.SKIPPED)
            .jobId(identity)
            .message("Job already processed")
            .build();
    }

    private static DispatchResult result(DispatchStatus status, DispatchMode mode, String jobId) {
        return DispatchResult.builder()
            .status(status)
            .mode(mode)
            .jobId(jobId)
            .build();
    }

    private static String preview(String text) {
        if (text == null || text.length() <= LOG_QUESTION_LENGTH) {
            return text;
        }
        return text.substring(0, LOG_QUESTION_LENGTH) + "...";
    }
}
