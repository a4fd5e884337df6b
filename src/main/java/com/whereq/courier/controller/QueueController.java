package com.whereq.courier.controller;

import com.whereq.courier.diagnostics.QueueDiagnosticsService;
import com.whereq.courier.diagnostics.TestJobInjector;
import com.whereq.courier.dto.QueueOperationRequest;
import com.whereq.courier.dto.QueueOperationResponse;
import com.whereq.courier.dto.QueueSnapshot;
import com.whereq.courier.dto.TestJobResponse;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.exception.UnauthorizedException;
import com.whereq.courier.model.JobEnvelope;
import com.whereq.courier.queue.JobQueue;
import com.whereq.courier.security.SharedSecretVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Operator endpoints for queue inspection and repair. All of them require the shared secret.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/queue")
@Tag(name = "Queue", description = "Queue diagnostics and recovery")
public class QueueController {

    private static final int MAX_PAGE_SIZE = 100;

    private final JobQueue jobQueue;
    private final QueueDiagnosticsService diagnosticsService;
    private final TestJobInjector testJobInjector;
    private final SharedSecretVerifier secretVerifier;

    public QueueController(JobQueue jobQueue,
                           QueueDiagnosticsService diagnosticsService,
                           TestJobInjector testJobInjector,
                           SharedSecretVerifier secretVerifier) {
        this.jobQueue = jobQueue;
        this.diagnosticsService = diagnosticsService;
        this.testJobInjector = testJobInjector;
        this.secretVerifier = secretVerifier;
    }

    @GetMapping("/diagnostics")
    @Operation(summary = "Inspect the queue", description = "List depths, the head of the waiting list and dead-letter samples")
    public Mono<ResponseEntity<QueueSnapshot>> diagnostics(@RequestParam(value = "key", required = false) String key) {
        return secretVerifier.verify(key)
            .then(Mono.defer(diagnosticsService::inspect))
            .map(ResponseEntity::ok)
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(QueueSnapshot.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Queue diagnostics failed", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(QueueSnapshot.error(e.getMessage())));
            });
    }

    @GetMapping("/waiting")
    @Operation(summary = "List waiting jobs", description = "Page through the waiting list without claiming")
    public Mono<ResponseEntity<List<JobEnvelope>>> waiting(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "offset", defaultValue = "0") long offset,
            @RequestParam(value = "count", defaultValue = "10") long count) {

        if (offset < 0 || count < 1 || count > MAX_PAGE_SIZE) {
            return Mono.just(ResponseEntity.badRequest().build());
        }

        return secretVerifier.verify(key)
            .thenMany(Flux.defer(() -> jobQueue.listWaiting(offset, count)))
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Failed to list waiting jobs", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    @PostMapping("/operations")
    @Operation(summary = "Run a queue operation", description = "flush_queue or recover_stuck_jobs")
    public Mono<ResponseEntity<QueueOperationResponse>> operation(
            @RequestParam(value = "key", required = false) String key,
            @Valid @RequestBody QueueOperationRequest request) {

        return secretVerifier.verify(key)
            .then(Mono.defer(() -> diagnosticsService.apply(request.getOperation())))
            .map(ResponseEntity::ok)
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(QueueOperationResponse.error(request.getOperation(), e.getMessage()))))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Invalid queue operation: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(QueueOperationResponse.error(request.getOperation(), e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Queue operation {} failed", request.getOperation(), e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(QueueOperationResponse.error(request.getOperation(), e.getMessage())));
            });
    }

    @PostMapping("/test-job")
    @Operation(summary = "Inject a test job", description = "Enqueue a synthetic job for a channel and run the worker once")
    public Mono<ResponseEntity<TestJobResponse>> testJob(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "channel", required = false) String channel) {

        return secretVerifier.verify(key)
            .then(Mono.defer(() -> {
                if (channel == null || channel.isBlank()) {
                    return Mono.error(new JobValidationException("Missing required parameter 'channel'"));
                }
                return testJobInjector.inject(channel);
            }))
            .map(ResponseEntity::ok)
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(TestJobResponse.error(e.getMessage()))))
            .onErrorResume(JobValidationException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(TestJobResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Test job injection failed", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(TestJobResponse.error(e.getMessage())));
            });
    }
}
