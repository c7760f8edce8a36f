package com.triagepilot.orchestrator.repository;

import com.triagepilot.orchestrator.model.ReportRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + lookup for stored report metadata.
 */
public interface ReportRecordRepository extends JpaRepository<ReportRecord, UUID> {

    /** All reports stored for a session, oldest first. */
    List<ReportRecord> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
