package com.whereq.courier.generation;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The answer generation engine (retrieval plus completion), consumed as a black box.
 *
 * Failures surface as {@link com.whereq.courier.exception.GenerationException}.
 */
public interface AnswerGenerator {

    /**
     * Generate the full answer to a question
     *
     * @param question question text
     * @return Mono with the answer text
     */
    Mono<String> generate(String question);

    /**
     * Generate an answer incrementally.
     * Each element is the answer assembled so far; the sequence is finite and cannot be restarted.
     *
     * @param question question text
     * @return Flux of growing answer snapshots
     */
    Flux<String> generateStreaming(String question);
}
