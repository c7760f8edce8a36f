package com.triagepilot.orchestrator.api.dto;

import com.triagepilot.orchestrator.session.Session;

import java.time.Instant;

/**
 * Read-only view of a live session returned by GET /interviews/{id}.
 */
public record SessionResponse(
        String  sessionId,
        String  status,
        String  question,
        int     pendingMessages,
        boolean workerRunning,
        Instant createdAt,
        Instant abandonedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getStatus().name(),
                s.getBroker().getQuestion(),
                s.getBroker().pendingMessages(),
                s.hasLiveWorker(),
                s.getCreatedAt(),
                s.getAbandonedAt()
        );
    }
}
