package com.triagepilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for one stored interview report.
 *
 * Sessions themselves live only in memory; this row is what remains after a
 * session is cleaned up, so a caller can still locate the report it produced.
 *
 * DB table: report_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "report_records")
public class ReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    // Relative to the storage root, e.g. patients/<session>/reports/<file>
    @Column(name = "storage_path", nullable = false)
    private String storagePath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ReportRecord() {}   // required by JPA

    public ReportRecord(String sessionId, String fileName, String storagePath) {
        this.sessionId   = sessionId;
        this.fileName    = fileName;
        this.storagePath = storagePath;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID    getId()          { return id; }
    public String  getSessionId()   { return sessionId; }
    public String  getFileName()    { return fileName; }
    public String  getStoragePath() { return storagePath; }
    public Instant getCreatedAt()   { return createdAt; }
}
