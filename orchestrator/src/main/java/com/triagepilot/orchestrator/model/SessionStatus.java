package com.triagepilot.orchestrator.model;

/**
 * Lifecycle of one interview session.
 *
 * Transitions:
 *   PENDING → RUNNING → (AWAITING_INPUT ⇄ RUNNING)* → COMPLETED | FAILED
 *
 * AWAITING_INPUT is set just before an interactive stage blocks on the broker,
 * RUNNING again as soon as the answer has been taken off the queue.
 */
public enum SessionStatus {
    PENDING,
    RUNNING,
    AWAITING_INPUT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
