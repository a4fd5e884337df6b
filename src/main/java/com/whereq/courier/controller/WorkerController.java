package com.whereq.courier.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.exception.UnauthorizedException;
import com.whereq.courier.model.DispatchMode;
import com.whereq.courier.model.DispatchResult;
import com.whereq.courier.model.DispatchStatus;
import com.whereq.courier.queue.EnvelopeCodec;
import com.whereq.courier.security.SharedSecretVerifier;
import com.whereq.courier.worker.QueueWorker;
import com.whereq.courier.worker.WorkerDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Worker entry points: push delivery of a single job and pull of the next queued job.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/worker")
@Tag(name = "Worker", description = "Answer and deliver queued questions")
public class WorkerController {

    private final WorkerDispatcher dispatcher;
    private final QueueWorker queueWorker;
    private final EnvelopeCodec codec;
    private final SharedSecretVerifier secretVerifier;

    public WorkerController(WorkerDispatcher dispatcher,
                            QueueWorker queueWorker,
                            EnvelopeCodec codec,
                            SharedSecretVerifier secretVerifier) {
        this.dispatcher = dispatcher;
        this.queueWorker = queueWorker;
        this.codec = codec;
        this.secretVerifier = secretVerifier;
    }

    /**
     * Process one pushed job
     *
     * @param body a bare job or a queue envelope
     * @return Mono with the dispatch result
     */
    @PostMapping
    @Operation(summary = "Process a job", description = "Answer one pushed job; health, diagnostic and drain probes return immediately")
    public Mono<ResponseEntity<DispatchResult>> process(
            @RequestParam(value = "health", required = false) String health,
            @RequestParam(value = "diagnostic", required = false) String diagnostic,
            @RequestParam(value = "drain", required = false) String drain,
            @RequestBody(required = false) JsonNode body) {

        if (health != null || diagnostic != null || drain != null) {
            return Mono.just(ResponseEntity.ok(healthy()));
        }

        return Mono.fromCallable(() -> codec.decode(body))
            .flatMap(envelope -> {
                log.info("Received pushed job {}", envelope.getStreamId());
                return dispatcher.dispatch(envelope.getBody());
            })
            .map(WorkerController::toResponse)
            .onErrorResume(JobValidationException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(errorResult(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error while processing pushed job", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(errorResult("Internal server error")));
            });
    }

    @GetMapping
    @Operation(summary = "Worker health", description = "Static health response, touches nothing")
    public Mono<ResponseEntity<DispatchResult>> health() {
        return Mono.just(ResponseEntity.ok(healthy()));
    }

    /**
     * Claim and process the next queued job
     *
     * @param key shared secret
     * @return Mono with the dispatch result
     */
    @PostMapping("/next")
    @Operation(summary = "Process next queued job", description = "Claim one job from the waiting list and answer it")
    public Mono<ResponseEntity<DispatchResult>> processNext(@RequestParam(value = "key", required = false) String key) {
        return secretVerifier.verify(key)
            .then(Mono.defer(queueWorker::processNext))
            .map(WorkerController::toResponse)
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(errorResult(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error processing next queued job", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(errorResult(e.getMessage())));
            });
    }

    private static ResponseEntity<DispatchResult> toResponse(DispatchResult result) {
        if (result.isError()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    private static DispatchResult healthy() {
        return DispatchResult.of(DispatchStatus.HEALTHY, DispatchMode.DIAGNOSTIC);
    }

    private static DispatchResult errorResult(String message) {
        return DispatchResult.builder()
            .status(DispatchStatus.ERROR)
            .error(message)
            .build();
    }
}
