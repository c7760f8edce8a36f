package com.triagepilot.orchestrator.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff with jitter.
 *
 * Stateless and shared by every session; the attempt counter lives on the
 * stack of the invoking call, never here.
 *
 * @param maxAttempts total attempts including the first one (≥ 1)
 * @param baseDelay   delay before the first retry, before jitter
 * @param maxDelay    hard cap applied after jitter
 * @param jitter      fraction in [0, 1]; 0.2 means ±20 %
 * @param classifier  transient vs fatal
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          Duration maxDelay,
                          double jitter,
                          FailureClassifier classifier) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be in [0, 1]");
        Objects.requireNonNull(baseDelay,  "baseDelay");
        Objects.requireNonNull(maxDelay,   "maxDelay");
        Objects.requireNonNull(classifier, "classifier");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.2,
                new TransientFailureClassifier());
    }

    /**
     * Delay before the retry that follows failed attempt {@code attemptIndex} (0-based):
     * min(base * 2^attemptIndex * (1 ± jitter), max).
     *
     * @param unitRandom a value in [0, 1); 0.5 yields the un-jittered delay
     */
    public Duration backoff(int attemptIndex, double unitRandom) {
        double factor = Math.pow(2, attemptIndex) * (1.0 + jitter * (2.0 * unitRandom - 1.0));
        double millis = baseDelay.toMillis() * factor;
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }
}
