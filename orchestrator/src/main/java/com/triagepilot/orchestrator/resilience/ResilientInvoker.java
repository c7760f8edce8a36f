package com.triagepilot.orchestrator.resilience;

import com.triagepilot.orchestrator.model.StageRole;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Retry / backoff / fallback wrapper around reasoning-collaborator calls.
 *
 * Algorithm per call:
 *   1. Attempt the call.
 *   2. Non-blank result → return it.
 *   3. Blank result or exception → classify.
 *   4. Transient and attempts remain → sleep backoff(attempt) and go to 1.
 *   5. Fatal, or attempts exhausted → return the role's fallback text.
 *
 * The invoker never throws for a collaborator failure; the pipeline keeps
 * going in a degraded but well-defined state. Callers opt in per call site
 * via {@link #invoke} or {@link #wrap}.
 *
 * Metrics:
 * <pre>
 *   triagepilot.invoker.calls{role, outcome="success|fallback"}
 *   triagepilot.invoker.retries{role}
 * </pre>
 */
@Component
public class ResilientInvoker {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvoker.class);

    public static final String INTERVIEWER_FALLBACK =
            "I'm having trouble responding right now. Could you please repeat or rephrase your last message?";

    private static final String INTERNAL_FALLBACK_PREFIX = "[%s unavailable] ";
    private static final String INTERNAL_FALLBACK_TEXT =
            "No analysis could be produced for this stage; continue with the information already collected.";

    private final RetryPolicy    policy;
    private final MeterRegistry  meterRegistry;
    private final Sleeper        sleeper;
    private final DoubleSupplier random;

    @Autowired
    public ResilientInvoker(RetryPolicy policy, MeterRegistry meterRegistry) {
        this(policy, meterRegistry, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ResilientInvoker(RetryPolicy policy, MeterRegistry meterRegistry,
                            Sleeper sleeper, DoubleSupplier random) {
        this.policy        = policy;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
        this.random        = random;
    }

    /**
     * Compose resilience over {@code call}: the returned supplier runs the full
     * retry algorithm each time it is invoked.
     */
    public Supplier<String> wrap(StageRole role, Supplier<String> call) {
        return () -> invoke(role, call);
    }

    /**
     * Run {@code call} under the retry policy.
     *
     * @return the trimmed result, or {@link #fallbackFor(StageRole)}
     */
    public String invoke(StageRole role, Supplier<String> call) {
        String roleTag = role.name().toLowerCase();

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            RuntimeException failure;
            try {
                String result = call.get();
                if (result != null && !result.isBlank()) {
                    count(roleTag, "success");
                    return result.strip();
                }
                failure = new EmptyResultException("Empty result from " + role + " call");
            } catch (RuntimeException e) {
                failure = e;
            }

            boolean transientFailure = policy.classifier().isTransient(failure);
            boolean attemptsLeft     = attempt + 1 < policy.maxAttempts();

            if (!transientFailure) {
                log.error("Fatal {} failure on attempt {}/{}, using fallback: {}",
                        role, attempt + 1, policy.maxAttempts(), failure.getMessage());
                break;
            }
            if (!attemptsLeft) {
                log.error("{} still failing after {} attempts, using fallback: {}",
                        role, policy.maxAttempts(), failure.getMessage());
                break;
            }

            Duration delay = policy.backoff(attempt, random.getAsDouble());
            log.warn("Transient {} failure (attempt {}/{}), retrying in {} ms: {}",
                    role, attempt + 1, policy.maxAttempts(), delay.toMillis(), failure.getMessage());
            meterRegistry.counter("triagepilot.invoker.retries", "role", roleTag).increment();
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Backoff for {} interrupted, using fallback", role);
                break;
            }
        }

        count(roleTag, "fallback");
        return fallbackFor(role);
    }

    /** Fallback text: a patient-facing apology for the interviewer, a tagged notice otherwise. */
    public static String fallbackFor(StageRole role) {
        if (role.isHumanFacing()) {
            return INTERVIEWER_FALLBACK;
        }
        return INTERNAL_FALLBACK_PREFIX.formatted(role.name().toLowerCase()) + INTERNAL_FALLBACK_TEXT;
    }

    public static boolean isFallback(String text) {
        if (text == null) return false;
        return text.equals(INTERVIEWER_FALLBACK)
            || (text.startsWith("[") && text.endsWith(INTERNAL_FALLBACK_TEXT));
    }

    private void count(String roleTag, String outcome) {
        meterRegistry.counter("triagepilot.invoker.calls", "role", roleTag, "outcome", outcome).increment();
    }
}
