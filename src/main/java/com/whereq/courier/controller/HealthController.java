package com.whereq.courier.controller;

import com.whereq.courier.queue.QueueListStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and queue store status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final QueueListStore queueStore;

    public HealthController(QueueListStore queueStore) {
        this.queueStore = queueStore;
    }

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the queue store are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return queueStore.ping()
                .map(pong -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-courier");

                    Map<String, String> storeInfo = new HashMap<>();
                    storeInfo.put("status", "CONNECTED");
                    storeInfo.put("ping", pong);

                    health.put("store", storeInfo);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-courier");

                    Map<String, String> storeInfo = new HashMap<>();
                    storeInfo.put("status", "ERROR");
                    storeInfo.put("error", e.getMessage());
                    health.put("store", storeInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
