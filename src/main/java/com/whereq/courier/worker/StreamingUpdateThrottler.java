package com.whereq.courier.worker;

import com.whereq.courier.config.CourierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Turns a stream of growing answer snapshots into in-place edits of one message.
 *
 * The platform enforces a minimum interval between edits of the same message, so a
 * snapshot is only pushed once the update interval has passed since the previous push.
 * The latest snapshot is always pushed at the end.
 */
@Slf4j
@Component
public class StreamingUpdateThrottler {

    private final Duration updateInterval;
    private final Duration flushInterval;
    private final String placeholderText;
    private final String warningText;
    private final String incompleteNotice;

    public StreamingUpdateThrottler(CourierProperties properties) {
        this.updateInterval = properties.getStreaming().getUpdateInterval();
        this.flushInterval = properties.getStreaming().getFlushInterval();
        this.placeholderText = properties.getStreaming().getPlaceholderText();
        this.warningText = properties.getMessages().getWarning();
        this.incompleteNotice = properties.getMessages().getIncompleteNotice();
    }

    /**
     * Consume a chunk stream and push throttled updates
     *
     * @param chunks answer snapshots, each one the full text so far
     * @param pushUpdate replaces the message text; failures are logged and streaming continues
     * @return Mono with the outcome: completed, partial content delivered, or nothing but the warning delivered
     */
    public Mono<StreamingOutcome> run(Flux<String> chunks, Function<String, Mono<?>> pushUpdate) {
        return Mono.defer(() -> {
            StreamState state = new StreamState(now());

            return chunks
                .concatMap(chunk -> onChunk(chunk, state, pushUpdate))
                .then(Mono.defer(() -> flush(state, pushUpdate)))
                .thenReturn(StreamingOutcome.completed())
                .onErrorResume(e -> {
                    log.error("Streaming generation failed after {} update(s)", state.updates, e);
                    if (state.latestContent != null) {
                        return push(state.latestContent + incompleteNotice, state, pushUpdate)
                            .thenReturn(StreamingOutcome.partial(e.getMessage()));
                    }
                    return push(warningText, state, pushUpdate)
                        .thenReturn(StreamingOutcome.failed(e.getMessage()));
                });
        });
    }

    private Mono<Void> onChunk(String chunk, StreamState state, Function<String, Mono<?>> pushUpdate) {
        if (chunk == null || chunk.isBlank() || chunk.equals(placeholderText)) {
            return Mono.empty();
        }
        state.latestContent = chunk;
        state.dirty = true;

        long now = now();
        if (now - state.lastUpdateTime < updateInterval.toMillis()) {
            return Mono.empty();
        }
        state.lastUpdateTime = now;
        state.dirty = false;
        return push(chunk, state, pushUpdate);
    }

    private Mono<Void> flush(StreamState state, Function<String, Mono<?>> pushUpdate) {
        if (!state.dirty) {
            return Mono.empty();
        }
        long wait = flushInterval.toMillis() - (now() - state.lastUpdateTime);
        Mono<Long> delay = wait > 0 ? Mono.delay(Duration.ofMillis(wait)) : Mono.just(0L);
        return delay.then(Mono.defer(() -> {
            log.debug("Sending final streaming update ({} chars)", state.latestContent.length());
            state.lastUpdateTime = now();
            state.dirty = false;
            return push(state.latestContent, state, pushUpdate);
        }));
    }

    private Mono<Void> push(String text, StreamState state, Function<String, Mono<?>> pushUpdate) {
        return Mono.defer(() -> pushUpdate.apply(text))
            .doOnSuccess(v -> {
                state.updates++;
                log.debug("Updated message with streaming content ({} chars)", text.length());
            })
            .onErrorResume(e -> {
                log.error("Error updating message during streaming", e);
                return Mono.empty();
            })
            .then();
    }

    /**
     * Scheduler clock, so timestamps follow the same (possibly virtual) time as the delays
     */
    private static long now() {
        return Schedulers.parallel().now(TimeUnit.MILLISECONDS);
    }

    private static final class StreamState {
        private long lastUpdateTime;
        private String latestContent;
        private boolean dirty;
        private int updates;

        private StreamState(long startTime) {
            this.lastUpdateTime = startTime;
        }
    }
}
