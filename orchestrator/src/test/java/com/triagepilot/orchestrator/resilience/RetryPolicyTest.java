package com.triagepilot.orchestrator.resilience;

import com.triagepilot.orchestrator.claude.ClaudeClient.ClaudeApiException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.2,
            new TransientFailureClassifier());

    // ------------------------------------------------------------------
    // backoff()
    // ------------------------------------------------------------------

    @Test
    void backoff_withoutJitter_doublesEachAttempt() {
        assertThat(policy.backoff(0, 0.5)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(1, 0.5)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.backoff(2, 0.5)).isEqualTo(Duration.ofMillis(4000));
    }

    @Test
    void backoff_isCappedAtMaxDelay() {
        assertThat(policy.backoff(3, 0.5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.backoff(10, 0.99)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void backoff_jitterStaysWithinConfiguredFraction() {
        assertThat(policy.backoff(1, 0.0)).isEqualTo(Duration.ofMillis(1600));
        assertThat(policy.backoff(1, 1.0)).isEqualTo(Duration.ofMillis(2400));
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.2,
                new TransientFailureClassifier()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(5), 1.5,
                new TransientFailureClassifier()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // TransientFailureClassifier
    // ------------------------------------------------------------------

    @Test
    void classifier_overloadStatusCodesAreTransient() {
        FailureClassifier classifier = new TransientFailureClassifier();

        assertThat(classifier.isTransient(new ClaudeApiException(429, ""))).isTrue();
        assertThat(classifier.isTransient(new ClaudeApiException(503, ""))).isTrue();
        assertThat(classifier.isTransient(new ClaudeApiException(529, ""))).isTrue();
        assertThat(classifier.isTransient(new ClaudeApiException(400, "bad request"))).isFalse();
    }

    @Test
    void classifier_overloadMarkerInCauseChainIsTransient() {
        FailureClassifier classifier = new TransientFailureClassifier();
        RuntimeException wrapped = new RuntimeException("call failed",
                new IllegalStateException("upstream is Overloaded"));

        assertThat(classifier.isTransient(wrapped)).isTrue();
        assertThat(classifier.isTransient(new EmptyResultException("nothing"))).isTrue();
        assertThat(classifier.isTransient(new NullPointerException())).isFalse();
        assertThat(classifier.isTransient(new IllegalArgumentException("malformed prompt"))).isFalse();
    }
}
