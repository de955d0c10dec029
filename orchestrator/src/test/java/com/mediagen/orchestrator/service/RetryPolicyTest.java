package com.mediagen.orchestrator.service;

import com.mediagen.orchestrator.config.RetryProperties;
import com.mediagen.orchestrator.generation.GenerationException;
import com.mediagen.orchestrator.model.FailureKind;
import com.mediagen.orchestrator.storage.StorageException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static RetryPolicy policy(double jitter) {
        RetryProperties properties = new RetryProperties();
        properties.setBaseDelay(Duration.ofSeconds(60));
        properties.setBackoffFactor(2.0);
        properties.setMaxDelay(Duration.ofSeconds(300));
        properties.setJitterRatio(jitter);
        properties.setMaxRetries(3);
        return new RetryPolicy(properties);
    }

    @Test
    void delayFor_growsExponentiallyUpToTheCap() {
        RetryPolicy policy = policy(0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(240));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(300));
        assertThat(policy.delayFor(20)).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void delayFor_jitterStaysWithinRatioOfCappedDelay() {
        RetryPolicy policy = policy(0.25);

        for (int i = 0; i < 200; i++) {
            assertThat(policy.delayFor(10)).isBetween(Duration.ofSeconds(300), Duration.ofSeconds(375));
        }
    }

    @Test
    void isExhausted_onlyPastMaxRetries() {
        RetryPolicy policy = policy(0);

        assertThat(policy.isExhausted(3)).isFalse();
        assertThat(policy.isExhausted(4)).isTrue();
    }

    @Test
    void classify_usesTheExceptionsOwnKind() {
        RetryPolicy policy = policy(0);

        assertThat(policy.classify(GenerationException.fatal("HTTP 422"))).isEqualTo(FailureKind.FATAL);
        assertThat(policy.classify(GenerationException.transientFailure("HTTP 503", null)))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new StorageException("disk full", null))).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void classify_ioAnywhereInCauseChainIsTransient() {
        RetryPolicy policy = policy(0);

        assertThat(policy.classify(new RuntimeException(new HttpTimeoutException("timed out"))))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new UncheckedIOException(new IOException("reset"))))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new IllegalArgumentException("bad width"))).isEqualTo(FailureKind.FATAL);
        assertThat(policy.classify(new NullPointerException())).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void constructor_rejectsShrinkingBackoff() {
        RetryProperties properties = new RetryProperties();
        properties.setBackoffFactor(0.5);

        assertThatThrownBy(() -> new RetryPolicy(properties)).isInstanceOf(IllegalArgumentException.class);
    }
}
