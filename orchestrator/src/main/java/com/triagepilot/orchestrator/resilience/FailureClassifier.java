package com.triagepilot.orchestrator.resilience;

/**
 * Decides whether a failed collaborator call is worth retrying.
 */
@FunctionalInterface
public interface FailureClassifier {

    /** true for overload / rate-limit style failures, false for everything else. */
    boolean isTransient(Throwable failure);
}
