package com.whereq.courier.delivery;

import com.whereq.courier.exception.DeliveryException;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseUrlClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void postsTextToTheResponseUrl() {
        ResponseUrlClient client = client(HttpStatus.OK);

        StepVerifier.create(client.send("https://hooks.example.com/commands/T1/123", "X is Y."))
            .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo("https://hooks.example.com/commands/T1/123");
    }

    @Test
    void errorStatusIsADeliveryFailure() {
        ResponseUrlClient client = client(HttpStatus.NOT_FOUND);

        StepVerifier.create(client.send("https://hooks.example.com/expired", "X is Y."))
            .expectError(DeliveryException.class)
            .verify();
    }

    @Test
    void blankUrlFailsImmediately() {
        StepVerifier.create(client(HttpStatus.OK).send(" ", "X is Y."))
            .expectError(DeliveryException.class)
            .verify();

        assertThat(requests).isEmpty();
    }

    private ResponseUrlClient client(HttpStatus status) {
        WebClient.Builder builder = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status).build());
            });
        return new ResponseUrlClient(builder, TestFixtures.properties());
    }
}
