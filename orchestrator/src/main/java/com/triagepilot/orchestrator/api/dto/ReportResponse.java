package com.triagepilot.orchestrator.api.dto;

import com.triagepilot.orchestrator.model.ReportRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * One stored report, as listed by GET /interviews/{id}/reports.
 */
public record ReportResponse(UUID id, String fileName, String storagePath, Instant createdAt) {

    public static ReportResponse from(ReportRecord r) {
        return new ReportResponse(r.getId(), r.getFileName(), r.getStoragePath(), r.getCreatedAt());
    }
}
