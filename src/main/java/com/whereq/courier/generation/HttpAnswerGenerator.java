package com.whereq.courier.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.GenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Calls the generation engine over HTTP.
 *
 * POST /generate answers {"answer": "..."}; POST /generate/stream answers with
 * server-sent events whose data is the answer assembled so far.
 */
@Slf4j
@Component
public class HttpAnswerGenerator implements AnswerGenerator {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
        new ParameterizedTypeReference<>() {
        };

    private final WebClient webClient;
    private final Duration timeout;

    public HttpAnswerGenerator(WebClient.Builder webClientBuilder, CourierProperties properties) {
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getGeneration().getBaseUrl())
            .build();
        this.timeout = properties.getGeneration().getTimeout();
    }

    @Override
    public Mono<String> generate(String question) {
        long startTime = System.currentTimeMillis();

        return webClient.post()
            .uri("/generate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("question", question))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(body -> body.path("answer").asText(""))
            .filter(answer -> !answer.isBlank())
            .switchIfEmpty(Mono.error(new GenerationException("Generation engine returned no answer")))
            .doOnSuccess(answer -> log.info("Generated answer of {} chars in {}ms",
                answer.length(), System.currentTimeMillis() - startTime))
            .onErrorMap(e -> !(e instanceof GenerationException),
                e -> new GenerationException("Answer generation failed: " + e.getMessage(), e));
    }

    @Override
    public Flux<String> generateStreaming(String question) {
        return webClient.post()
            .uri("/generate/stream")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(Map.of("question", question))
            .retrieve()
            .bodyToFlux(EVENT_TYPE)
            .mapNotNull(ServerSentEvent::data)
            .onErrorMap(e -> !(e instanceof GenerationException),
                e -> new GenerationException("Streaming generation failed: " + e.getMessage(), e));
    }
}
