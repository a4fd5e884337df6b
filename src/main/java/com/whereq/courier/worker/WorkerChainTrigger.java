package com.whereq.courier.worker;

import com.whereq.courier.config.CourierProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;

/**
 * Starts the next worker invocation while jobs remain in the queue.
 * The call is fire-and-forget; its outcome never changes the current result.
 */
@Slf4j
@Component
public class WorkerChainTrigger {

    static final String TRIGGER_SOURCE_HEADER = "X-Trigger-Source";
    static final String TRIGGER_SOURCE = "chained-worker";

    private final WebClient webClient;
    private final String chainUrl;
    private final String secretKey;
    private final Duration timeout;

    public WorkerChainTrigger(WebClient.Builder webClientBuilder, CourierProperties properties) {
        this.webClient = webClientBuilder.build();
        this.chainUrl = properties.getWorker().getChainUrl();
        this.secretKey = properties.getWorker().getSecretKey();
        this.timeout = properties.getDelivery().getRequestTimeout();
    }

    public boolean isEnabled() {
        return chainUrl != null && !chainUrl.isBlank();
    }

    /**
     * Fire one POST at the chain URL
     *
     * @param remainingJobs jobs still waiting, for logging
     */
    public void triggerNext(long remainingJobs) {
        if (!isEnabled()) {
            return;
        }

        String uri = UriComponentsBuilder.fromUriString(chainUrl)
            .queryParam("key", secretKey)
            .build()
            .toUriString();

        webClient.post()
            .uri(uri)
            .header(TRIGGER_SOURCE_HEADER, TRIGGER_SOURCE)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .subscribe(
                response -> log.info("Triggered next worker ({} job(s) remaining): {}",
                    remainingJobs, response.getStatusCode()),
                error -> log.error("Failed to trigger next worker: {}", error.getMessage())
            );
    }
}
