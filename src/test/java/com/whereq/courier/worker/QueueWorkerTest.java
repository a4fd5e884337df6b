package com.whereq.courier.worker;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.delivery.MessagingPlatform;
import com.whereq.courier.delivery.PostedMessage;
import com.whereq.courier.delivery.RateLimitedDeliveryClient;
import com.whereq.courier.delivery.ResponseUrlClient;
import com.whereq.courier.exception.GenerationException;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.generation.AnswerGenerator;
import com.whereq.courier.idempotency.InMemoryIdempotencyGuard;
import com.whereq.courier.model.DispatchMode;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.model.QueueDepth;
import com.whereq.courier.queue.EnvelopeCodec;
import com.whereq.courier.queue.InMemoryQueueListStore;
import com.whereq.courier.queue.JobValidator;
import com.whereq.courier.queue.ListBackedJobQueue;
import com.whereq.courier.support.MutableClock;
import com.whereq.courier.support.TestFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueWorkerTest {

    private ListBackedJobQueue jobQueue;
    private WorkerDispatcher dispatcher;
    private WorkerChainTrigger chainTrigger;
    private CourierProperties properties;
    private MeterRegistry meterRegistry;
    private QueueWorker worker;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        MutableClock clock = new MutableClock(TestFixtures.START);
        jobQueue = new ListBackedJobQueue(new InMemoryQueueListStore(),
            new EnvelopeCodec(TestFixtures.objectMapper(), clock), new JobValidator(), properties, clock);
        dispatcher = mock(WorkerDispatcher.class);
        chainTrigger = mock(WorkerChainTrigger.class);
        meterRegistry = new SimpleMeterRegistry();
        worker = new QueueWorker(jobQueue, dispatcher, chainTrigger, meterRegistry);
    }

    @Test
    void emptyQueueReportsNoJobs() {
        StepVerifier.create(worker.processNext())
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(DispatchStatus.NO_JOBS);
                assertThat(result.getRemainingJobs()).isZero();
            })
            .verifyComplete();

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void successfulJobLeavesTheQueueAndChainsWhileJobsRemain() {
        jobQueue.enqueue(TestFixtures.channelJob()).block();
        jobQueue.enqueue(TestFixtures.channelJob().toBuilder().questionText("Second?").build()).block();
        when(dispatcher.dispatch(any())).thenReturn(Mono.just(
            DispatchResult.of(DispatchStatus.SUCCESS, DispatchMode.STANDARD)));

        StepVerifier.create(worker.processNext())
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(DispatchStatus.SUCCESS);
                assertThat(result.getJobId()).startsWith("job-");
                assertThat(result.getRemainingJobs()).isEqualTo(1L);
            })
            .verifyComplete();

        assertThat(jobQueue.depth().block()).isEqualTo(QueueDepth.builder().waiting(1).build());
        verify(chainTrigger).triggerNext(1L);
    }

    @Test
    void lastJobDoesNotChain() {
        jobQueue.enqueue(TestFixtures.channelJob()).block();
        when(dispatcher.dispatch(any())).thenReturn(Mono.just(
            DispatchResult.of(DispatchStatus.SKIPPED, null)));

        worker.processNext().block();

        assertThat(jobQueue.depth().block()).isEqualTo(QueueDepth.builder().build());
        verify(chainTrigger, never()).triggerNext(anyLong());
    }

    @Test
    void errorResultIsDeadLettered() {
        jobQueue.enqueue(TestFixtures.channelJob()).block();
        when(dispatcher.dispatch(any())).thenReturn(Mono.just(DispatchResult.builder()
            .status(DispatchStatus.ERROR)
            .mode(DispatchMode.STANDARD)
            .error("engine unavailable")
            .build()));

        StepVerifier.create(worker.processNext())
            .assertNext(result -> assertThat(result.isError()).isTrue())
            .verifyComplete();

        assertThat(jobQueue.depth().block()).isEqualTo(QueueDepth.builder().dead(1).build());
        assertThat(jobQueue.listDead(0, 1).blockFirst().getError()).isEqualTo("engine unavailable");
        assertThat(meterRegistry.counter("courier.jobs.dead_lettered").count()).isEqualTo(1.0);
    }

    @Test
    void validationFailureIsDeadLetteredAsError() {
        jobQueue.enqueue(TestFixtures.channelJob()).block();
        when(dispatcher.dispatch(any())).thenReturn(Mono.error(new JobValidationException("bad job")));

        StepVerifier.create(worker.processNext())
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(DispatchStatus.ERROR);
                assertThat(result.getError()).isEqualTo("bad job");
            })
            .verifyComplete();

        assertThat(jobQueue.depth().block().getDead()).isEqualTo(1L);
    }

    @Test
    void streamingJobThatFailsBeforeAnyContentIsDeadLettered() {
        properties.getStreaming().setEnabled(true);
        MessagingPlatform platform = mock(MessagingPlatform.class);
        AnswerGenerator answerGenerator = mock(AnswerGenerator.class);
        when(platform.isConfigured()).thenReturn(true);
        when(platform.updateMessage(any())).thenReturn(Mono.just(PostedMessage.builder()
            .channel("C1").messageId("1714557601.000200").build()));
        when(answerGenerator.generateStreaming("What is X?"))
            .thenReturn(Flux.error(new GenerationException("engine down")));
        WorkerDispatcher streamingDispatcher = new WorkerDispatcher(
            new JobValidator(),
            new InMemoryIdempotencyGuard(properties, new MutableClock(TestFixtures.START)),
            answerGenerator,
            new RateLimitedDeliveryClient(platform, properties),
            mock(ResponseUrlClient.class),
            new StreamingUpdateThrottler(properties),
            properties,
            meterRegistry);
        worker = new QueueWorker(jobQueue, streamingDispatcher, chainTrigger, meterRegistry);
        jobQueue.enqueue(TestFixtures.channelJob().toBuilder()
            .placeholderMessageId("1714557601.000200")
            .useStreaming(true)
            .build()).block();

        StepVerifier.create(worker.processNext())
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(DispatchStatus.ERROR);
                assertThat(result.getMode()).isEqualTo(DispatchMode.STREAMING);
            })
            .verifyComplete();

        assertThat(jobQueue.depth().block()).isEqualTo(QueueDepth.builder().dead(1).build());
        assertThat(jobQueue.listDead(0, 1).blockFirst().getError()).isEqualTo("engine down");
    }
}
