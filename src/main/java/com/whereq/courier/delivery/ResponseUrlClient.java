package com.whereq.courier.delivery;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Sends text to a slash-command response URL.
 * Used when the deployment has no bot token, or as the fallback channel for failure notices.
 */
@Slf4j
@Service
public class ResponseUrlClient {

    private final WebClient webClient;
    private final Duration timeout;

    public ResponseUrlClient(WebClient.Builder webClientBuilder, CourierProperties properties) {
        this.webClient = webClientBuilder.build();
        this.timeout = properties.getDelivery().getRequestTimeout();
    }

    /**
     * Post text to a response URL
     *
     * @param responseUrl URL supplied by the platform with the original command
     * @param text message text
     * @return Mono that completes when the platform accepted the message
     */
    public Mono<Void> send(String responseUrl, String text) {
        if (responseUrl == null || responseUrl.isBlank()) {
            return Mono.error(new DeliveryException("No response URL to deliver to"));
        }

        return webClient.post()
            .uri(responseUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("text", text))
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.info("Response URL accepted message: {}", response.getStatusCode()))
            .onErrorMap(e -> new DeliveryException("Failed to send via response URL: " + e.getMessage(), e))
            .then();
    }
}
