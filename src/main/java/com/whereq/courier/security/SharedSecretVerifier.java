package com.whereq.courier.security;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Gate for administrative and queue-pull endpoints.
 * A deployment without a configured secret rejects every gated call.
 */
@Slf4j
@Component
public class SharedSecretVerifier {

    private final byte[] expected;

    public SharedSecretVerifier(CourierProperties properties) {
        String secret = properties.getWorker().getSecretKey();
        this.expected = secret == null || secret.isBlank()
            ? null
            : secret.getBytes(StandardCharsets.UTF_8);
        if (expected == null) {
            log.warn("courier.worker.secret-key is not set; gated endpoints will reject every request");
        }
    }

    /**
     * Check a presented key in constant time
     *
     * @param presented key taken from the request
     * @return true when the key matches the configured secret
     */
    public boolean matches(String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Complete empty when the key matches, otherwise fail with {@link UnauthorizedException}
     */
    public Mono<Void> verify(String presented) {
        return Mono.defer(() -> {
            if (matches(presented)) {
                return Mono.empty();
            }
            log.warn("Rejected request with {} key", presented == null ? "missing" : "invalid");
            return Mono.error(new UnauthorizedException("Unauthorized"));
        });
    }
}
