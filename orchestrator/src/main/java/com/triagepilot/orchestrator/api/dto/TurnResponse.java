package com.triagepilot.orchestrator.api.dto;

import com.triagepilot.orchestrator.service.InterviewTurn;

/**
 * Response body for start and answer.
 *
 * question is null once the interview reached COMPLETED or FAILED;
 * artifactLocation is set only on COMPLETED.
 */
public record TurnResponse(
        String sessionId,
        String status,
        String question,
        String artifactLocation,
        String failureReason
) {
    public static TurnResponse from(InterviewTurn turn) {
        return new TurnResponse(
                turn.sessionId(),
                turn.status().name(),
                turn.question(),
                turn.artifactLocation(),
                turn.failureReason()
        );
    }
}
