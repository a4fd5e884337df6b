package com.whereq.courier.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.DeliveryException;
import com.whereq.courier.exception.ThrottledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Slack Web API client for chat.postMessage and chat.update.
 *
 * Slack reports throttling either as HTTP 429 with a Retry-After header or as
 * {@code {"ok": false, "error": "ratelimited"}}; both become {@link ThrottledException}.
 */
@Slf4j
@Component
public class SlackMessagingPlatform implements MessagingPlatform {

    private static final String RATE_LIMITED = "ratelimited";

    private final WebClient webClient;
    private final String botToken;
    private final Duration requestTimeout;

    public SlackMessagingPlatform(WebClient.Builder webClientBuilder, CourierProperties properties) {
        this.botToken = properties.getSlack().getBotToken();
        this.requestTimeout = properties.getDelivery().getRequestTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getSlack().getBaseUrl())
            .build();
    }

    @Override
    public Mono<PostedMessage> postMessage(OutboundMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", message.getChannel());
        payload.put("text", message.getText());
        payload.put("unfurl_links", false);
        payload.put("unfurl_media", false);
        if (message.getThreadId() != null) {
            payload.put("thread_ts", message.getThreadId());
        }
        return call("chat.postMessage", payload);
    }

    @Override
    public Mono<PostedMessage> updateMessage(MessageUpdate update) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", update.getChannel());
        payload.put("ts", update.getMessageId());
        payload.put("text", update.getText());
        return call("chat.update", payload);
    }

    @Override
    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank();
    }

    private Mono<PostedMessage> call(String method, Map<String, Object> payload) {
        if (!isConfigured()) {
            return Mono.error(new DeliveryException("Slack bot token is not configured"));
        }

        return webClient.post()
            .uri("/{method}", method)
            .headers(headers -> headers.setBearerAuth(botToken))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .exchangeToMono(response -> handleResponse(method, response))
            .timeout(requestTimeout)
            .onErrorMap(e -> !(e instanceof DeliveryException),
                e -> new DeliveryException(method + " call failed: " + e.getMessage(), e))
            .doOnSuccess(posted -> log.debug("{} accepted for channel {}, ts {}",
                method, posted.getChannel(), posted.getMessageId()));
    }

    private Mono<PostedMessage> handleResponse(String method, ClientResponse response) {
        Duration retryAfter = parseRetryAfter(response.headers().asHttpHeaders().getFirst("Retry-After"));

        if (response.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return response.releaseBody()
                .then(Mono.<PostedMessage>error(new ThrottledException(method + " was rate limited", retryAfter)));
        }
        if (response.statusCode().isError()) {
            return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<PostedMessage>error(new DeliveryException(
                    method + " failed with HTTP " + response.statusCode().value() + ": " + body)));
        }

        return response.bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.<JsonNode>error(new DeliveryException(method + " returned an empty body")))
            .flatMap(body -> {
                if (body.path("ok").asBoolean(false)) {
                    return Mono.just(PostedMessage.builder()
                        .channel(body.path("channel").asText(null))
                        .messageId(body.path("ts").asText(null))
                        .build());
                }
                String error = body.path("error").asText("unknown_error");
                if (RATE_LIMITED.equals(error)) {
                    return Mono.<PostedMessage>error(new ThrottledException(method + " was rate limited", retryAfter));
                }
                return Mono.<PostedMessage>error(new DeliveryException(method + " failed: " + error));
            });
    }

    private static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header '{}'", header);
            return Duration.ZERO;
        }
    }
}
