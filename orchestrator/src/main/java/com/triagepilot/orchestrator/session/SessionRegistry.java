package com.triagepilot.orchestrator.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagepilot.orchestrator.broker.MessageBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, in-memory store of live interview sessions.
 *
 * A single lock guards insert and remove. Sessions are created lazily on the
 * first lookup of an id and removed at most once by {@link #cleanup}. After
 * cleanup, the same id maps to a brand-new session with a fresh broker.
 *
 * Nothing here survives a process restart.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ReentrantLock        lock     = new ReentrantLock();
    private final Map<String, Session> sessions = new HashMap<>();

    private final Path         transcriptDir;   // null disables transcripts
    private final ObjectMapper objectMapper;

    @Autowired
    public SessionRegistry(@Value("${triagepilot.transcript.dir:}") String transcriptDir,
                           ObjectMapper objectMapper) {
        this(transcriptDir.isBlank() ? null : Path.of(transcriptDir), objectMapper);
    }

    public SessionRegistry(Path transcriptDir, ObjectMapper objectMapper) {
        this.transcriptDir = transcriptDir;
        this.objectMapper  = objectMapper;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Return the session for {@code id}, creating it (with a new broker and
     * transcript) if none exists. Concurrent callers with the same id always
     * receive the same instance.
     */
    public Session getOrCreate(String id) {
        lock.lock();
        try {
            Session existing = sessions.get(id);
            if (existing != null) {
                return existing;
            }
            Session created = new Session(id, new MessageBroker(), newTranscript(id));
            sessions.put(id, created);
            log.info("Created session {}", id);
            return created;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Session> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(id));
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the live sessions; safe to iterate without holding the lock. */
    public List<Session> sessions() {
        lock.lock();
        try {
            return List.copyOf(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    /**
     * Remove the session for {@code id} and release its transcript.
     * Later calls for the same id are no-ops until a new session is created.
     */
    public void cleanup(String id) {
        Session removed;
        lock.lock();
        try {
            removed = sessions.remove(id);
        } finally {
            lock.unlock();
        }
        release(removed);
    }

    /**
     * Remove {@code session} only while it is still the instance registered
     * under its id. A worker finishing late must not evict a newer session
     * that reuses the same id.
     */
    public void cleanup(Session session) {
        lock.lock();
        try {
            sessions.remove(session.getId(), session);
        } finally {
            lock.unlock();
        }
        release(session);
    }

    private void release(Session session) {
        if (session == null) {
            return;
        }
        session.releaseResources();
        log.info("Cleaned up session {} (status={})", session.getId(), session.getStatus());
    }

    private TranscriptLog newTranscript(String id) {
        if (transcriptDir == null) {
            return null;
        }
        String fileName = "human_interaction_" + SessionIds.pathSegment(id) + ".log";
        return new TranscriptLog(transcriptDir.resolve(fileName), objectMapper);
    }
}
