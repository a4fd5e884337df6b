package com.whereq.courier.worker;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.DeliveryException;
import com.whereq.courier.exception.GenerationException;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingUpdateThrottlerTest {

    private CourierProperties properties;
    private StreamingUpdateThrottler throttler;
    private List<String> pushed;
    private Function<String, Mono<?>> recorder;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        throttler = new StreamingUpdateThrottler(properties);
        pushed = new CopyOnWriteArrayList<>();
        recorder = text -> {
            pushed.add(text);
            return Mono.empty();
        };
    }

    @Test
    void tenChunksHalfASecondApartAreThrottled() {
        StepVerifier.withVirtualTime(() -> throttler.run(cumulativeChunks(10, Duration.ofMillis(500)), recorder))
            .thenAwait(Duration.ofSeconds(10))
            .assertNext(outcome -> assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.COMPLETED))
            .verifyComplete();

        // 5 seconds of streaming at one edit per 2 seconds, plus the final flush
        assertThat(pushed).hasSizeLessThanOrEqualTo(4);
        assertThat(pushed).containsExactly("w1 w2 w3 w4", "w1 w2 w3 w4 w5 w6 w7 w8",
            "w1 w2 w3 w4 w5 w6 w7 w8 w9 w10");
    }

    @Test
    void finalContentWaitsForTheFlushInterval() {
        StepVerifier.withVirtualTime(() -> throttler.run(Flux.just("X", "X is", "X is Y."), recorder))
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(999))
            .thenAwait(Duration.ofMillis(1))
            .assertNext(outcome -> assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.COMPLETED))
            .verifyComplete();

        assertThat(pushed).containsExactly("X is Y.");
    }

    @Test
    void placeholderAndBlankChunksAreNeverPushed() {
        StepVerifier.withVirtualTime(() -> throttler.run(Flux.just("Thinking...", " ", ""), recorder))
            .thenAwait(Duration.ofSeconds(5))
            .assertNext(outcome -> assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.COMPLETED))
            .verifyComplete();

        assertThat(pushed).isEmpty();
    }

    @Test
    void errorAfterPartialContentPushesItWithTheNotice() {
        Flux<String> chunks = Flux.concat(Flux.just("X is"), Flux.error(new GenerationException("stream reset")));

        StepVerifier.withVirtualTime(() -> throttler.run(chunks, recorder))
            .thenAwait(Duration.ofSeconds(5))
            .assertNext(outcome -> {
                assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.PARTIAL);
                assertThat(outcome.getError()).isEqualTo("stream reset");
            })
            .verifyComplete();

        assertThat(pushed).containsExactly("X is" + properties.getMessages().getIncompleteNotice());
    }

    @Test
    void errorBeforeAnyContentPushesTheWarning() {
        StepVerifier.withVirtualTime(() -> throttler.run(Flux.error(new GenerationException("refused")), recorder))
            .thenAwait(Duration.ofSeconds(5))
            .assertNext(outcome -> {
                assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.FAILED);
                assertThat(outcome.getError()).isEqualTo("refused");
            })
            .verifyComplete();

        assertThat(pushed).containsExactly(properties.getMessages().getWarning());
    }

    @Test
    void failedEditDoesNotStopTheStream() {
        List<String> attempted = new CopyOnWriteArrayList<>();
        Function<String, Mono<?>> failing = text -> {
            attempted.add(text);
            return Mono.error(new DeliveryException("message_not_found"));
        };

        StepVerifier.withVirtualTime(() -> throttler.run(cumulativeChunks(10, Duration.ofMillis(500)), failing))
            .thenAwait(Duration.ofSeconds(10))
            .assertNext(outcome -> assertThat(outcome.getKind()).isEqualTo(StreamingOutcome.Kind.COMPLETED))
            .verifyComplete();

        assertThat(attempted).hasSize(3);
    }

    private static Flux<String> cumulativeChunks(int count, Duration period) {
        return Flux.interval(period)
            .take(count)
            .map(i -> IntStream.rangeClosed(1, i.intValue() + 1)
                .mapToObj(n -> "w" + n)
                .collect(Collectors.joining(" ")));
    }
}
