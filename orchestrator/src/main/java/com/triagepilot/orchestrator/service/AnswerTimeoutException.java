package com.triagepilot.orchestrator.service;

import java.time.Duration;

/**
 * The requester's bounded wait for the next question elapsed. The worker and
 * broker are untouched; a later answer or start call can pick up where this left off.
 */
public class AnswerTimeoutException extends RuntimeException {

    private final String sessionId;

    public AnswerTimeoutException(String sessionId, Duration waited) {
        super("No new question for session " + sessionId + " within " + waited.toSeconds() + " s");
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
