package com.triagepilot.orchestrator.service;

import com.triagepilot.orchestrator.model.SessionStatus;
import com.triagepilot.orchestrator.session.Session;

/**
 * What a requester sees after start or answer: the next question, or the
 * terminal outcome if the pipeline finished while it waited.
 */
public record InterviewTurn(
        String        sessionId,
        SessionStatus status,
        String        question,
        String        artifactLocation,
        String        failureReason
) {
    static InterviewTurn of(Session session) {
        return new InterviewTurn(
                session.getId(),
                session.getStatus(),
                session.getStatus().isTerminal() ? null : session.getBroker().getQuestion(),
                session.getArtifactLocation(),
                session.getFailureReason()
        );
    }
}
