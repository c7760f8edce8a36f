package com.triagepilot.orchestrator.storage;

import com.triagepilot.orchestrator.model.ReportRecord;
import com.triagepilot.orchestrator.repository.ReportRecordRepository;
import com.triagepilot.orchestrator.session.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Durable home for rendered reports.
 *
 * Layout under triagepilot.storage.dir:
 *   patients/<base64url(session id)>/reports/<file name>
 *
 * Each stored file also gets a {@link ReportRecord} row so the report can be
 * found after the in-memory session is gone. Failures are reported to the
 * caller as {@link StorageException} and never retried here.
 */
@Component
public class ReportStorage {

    private static final Logger log = LoggerFactory.getLogger(ReportStorage.class);

    private final Path                   storageRoot;
    private final ReportRecordRepository records;

    @Autowired
    public ReportStorage(@Value("${triagepilot.storage.dir:storage}") String storageRoot,
                         ReportRecordRepository records) {
        this(Path.of(storageRoot), records);
    }

    public ReportStorage(Path storageRoot, ReportRecordRepository records) {
        this.storageRoot = storageRoot;
        this.records     = records;
    }

    /**
     * Copy {@code file} into the session's report folder and record it.
     *
     * @return the storage path, relative to the storage root
     * @throws StorageException if the file is missing or cannot be copied
     */
    @Transactional
    public String store(Path file, String sessionId) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new StorageException("Report file does not exist: " + file);
        }
        String fileName    = file.getFileName().toString();
        String storagePath = "patients/" + SessionIds.pathSegment(sessionId) + "/reports/" + fileName;
        Path   target      = storageRoot.resolve(storagePath);

        try {
            Files.createDirectories(target.getParent());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Could not store report " + fileName + " for session " + sessionId, e);
        }

        records.save(new ReportRecord(sessionId, fileName, storagePath));
        log.info("Stored report {} for session {}", storagePath, sessionId);
        return storagePath;
    }

    @Transactional(readOnly = true)
    public List<ReportRecord> reportsFor(String sessionId) {
        return records.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }
}
