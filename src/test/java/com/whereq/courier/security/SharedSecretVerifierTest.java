package com.whereq.courier.security;

import com.whereq.courier.config.CourierProperties;
import com.whereq.courier.exception.UnauthorizedException;
import com.whereq.courier.support.TestFixtures;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class SharedSecretVerifierTest {

    @Test
    void acceptsOnlyTheConfiguredSecret() {
        SharedSecretVerifier verifier = new SharedSecretVerifier(TestFixtures.properties());

        assertThat(verifier.matches("s3cret")).isTrue();
        assertThat(verifier.matches("s3cre")).isFalse();
        assertThat(verifier.matches(null)).isFalse();

        StepVerifier.create(verifier.verify("s3cret")).verifyComplete();
        StepVerifier.create(verifier.verify("nope")).expectError(UnauthorizedException.class).verify();
    }

    @Test
    void blankSecretDeniesEverything() {
        CourierProperties properties = TestFixtures.properties();
        properties.getWorker().setSecretKey("");
        SharedSecretVerifier verifier = new SharedSecretVerifier(properties);

        assertThat(verifier.matches("")).isFalse();
        StepVerifier.create(verifier.verify("")).expectError(UnauthorizedException.class).verify();
    }
}
