package com.whereq.courier.controller;

import com.whereq.courier.dto.EnqueueResponse;
import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.exception.UnauthorizedException;
import com.whereq.courier.model.Job;
import com.whereq.courier.queue.JobQueue;
import com.whereq.courier.security.SharedSecretVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Controller for job submission into the waiting list
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Queue questions for the worker")
public class JobController {

    private final JobQueue jobQueue;
    private final SharedSecretVerifier secretVerifier;

    public JobController(JobQueue jobQueue, SharedSecretVerifier secretVerifier) {
        this.jobQueue = jobQueue;
        this.secretVerifier = secretVerifier;
    }

    /**
     * Enqueue a job
     *
     * @param key shared secret
     * @param job job to enqueue
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Enqueue a job", description = "Validate a job and append it to the waiting list")
    public Mono<ResponseEntity<EnqueueResponse>> submit(
            @RequestParam(value = "key", required = false) String key,
            @RequestBody(required = false) Job job) {

        return secretVerifier.verify(key)
            .then(Mono.defer(() -> jobQueue.enqueue(job)))
            .map(depth -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(EnqueueResponse.queued(depth)))
            .onErrorResume(UnauthorizedException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(EnqueueResponse.error(e.getMessage()))))
            .onErrorResume(JobValidationException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(EnqueueResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(EnqueueResponse.error("Internal server error: " + e.getMessage())));
            });
    }
}
