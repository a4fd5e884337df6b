package com.whereq.courier.diagnostics;

import com.whereq.courier.model.DispatchMode;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.model.Job;
import com.whereq.courier.queue.JobQueue;
import com.whereq.courier.support.MutableClock;
import com.whereq.courier.support.TestFixtures;
import com.whereq.courier.worker.QueueWorker;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TestJobInjectorTest {

    @Test
    void enqueuesASyntheticJobAndRunsTheWorker() {
        JobQueue jobQueue = mock(JobQueue.class);
        QueueWorker queueWorker = mock(QueueWorker.class);
        ArgumentCaptor<Job> enqueued = ArgumentCaptor.forClass(Job.class);
        when(jobQueue.enqueue(enqueued.capture())).thenReturn(Mono.just(1L));
        when(queueWorker.processNext()).thenReturn(Mono.just(
            DispatchResult.of(DispatchStatus.SUCCESS, DispatchMode.STANDARD)));

        TestJobInjector injector = new TestJobInjector(jobQueue, queueWorker, TestFixtures.properties(),
            new MutableClock(Instant.parse("2024-05-01T10:00:00.123456789Z")));

        StepVerifier.create(injector.inject("C42"))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo("success");
                assertThat(response.getQueueDepth()).isEqualTo(1L);
                assertThat(response.getWorkerResult().getStatus()).isEqualTo(DispatchStatus.SUCCESS);
            })
            .verifyComplete();

        Job job = enqueued.getValue();
        assertThat(job.getChannelId()).isEqualTo("C42");
        assertThat(job.getUserId()).isEqualTo("force-worker");
        assertThat(job.isUseStreaming()).isFalse();
        assertThat(job.getEventId()).isEqualTo("1714557600.123456");
        verify(queueWorker).processNext();
    }

    @Test
    void eventIdIsPaddedToMicroseconds() {
        assertThat(TestJobInjector.eventId(Instant.parse("2024-05-01T10:00:00.000042Z")))
            .isEqualTo("1714557600.000042");
    }
}
