package com.triagepilot.orchestrator.session;

import com.triagepilot.orchestrator.broker.MessageBroker;
import com.triagepilot.orchestrator.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one interview, keyed by an opaque session id.
 *
 * Ownership rules (no extra locking inside a session relies on them):
 *   - only the worker mutates status, question, artifact and failure fields
 *   - only request handlers push messages into the broker
 *
 * The worker handle and the terminal / released flags are the exceptions:
 * they may be touched from several threads and are atomics.
 */
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String        id;
    private final MessageBroker broker;
    private final TranscriptLog transcript;   // nullable
    private final Instant       createdAt = Instant.now();

    private final AtomicReference<Future<?>> worker   = new AtomicReference<>();
    private final AtomicBoolean              terminal = new AtomicBoolean(false);
    private final AtomicBoolean              released = new AtomicBoolean(false);
    private final AtomicBoolean              openingTurn = new AtomicBoolean(true);

    private volatile SessionStatus status = SessionStatus.PENDING;
    private volatile String        artifact;
    private volatile String        artifactLocation;
    private volatile String        failureReason;
    private volatile Instant       abandonedAt;

    public Session(String id, MessageBroker broker, TranscriptLog transcript) {
        this.id         = id;
        this.broker     = broker;
        this.transcript = transcript;
    }

    // ------------------------------------------------------------------
    // Worker handle
    // ------------------------------------------------------------------

    /**
     * Attach a worker if none is attached yet.
     *
     * @return false if a worker was already attached (start is then a no-op)
     */
    public boolean attachWorker(Future<?> future) {
        return worker.compareAndSet(null, future);
    }

    public Optional<Future<?>> worker() {
        return Optional.ofNullable(worker.get());
    }

    public boolean hasLiveWorker() {
        Future<?> f = worker.get();
        return f != null && !f.isDone();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Move to a terminal status. Only the first caller wins; every later call
     * (a racing error path, a reaper) returns false and must not clean up again.
     */
    public boolean markTerminal(SessionStatus finalStatus, String reason) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + finalStatus);
        }
        if (!terminal.compareAndSet(false, true)) {
            return false;
        }
        this.failureReason = reason;
        this.status        = finalStatus;
        return true;
    }

    /** Release per-session resources once. IO errors are logged and swallowed. */
    void releaseResources() {
        if (!released.compareAndSet(false, true) || transcript == null) {
            return;
        }
        try {
            transcript.delete();
        } catch (Exception e) {
            log.warn("Could not delete transcript {} for session {}: {}",
                    transcript.path(), id, e.getMessage());
        }
    }

    /** True exactly once: for the first interactive prompt of this session. */
    public boolean consumeOpeningTurn() {
        return openingTurn.compareAndSet(true, false);
    }

    /** A requester gave up waiting; the worker keeps running regardless. */
    public void markAbandoned() {
        markAbandoned(Instant.now());
    }

    /** Record the first abandonment only; later timeouts keep the original instant. */
    public synchronized void markAbandoned(Instant at) {
        if (abandonedAt == null) {
            abandonedAt = at;
        }
    }

    public void clearAbandoned() {
        abandonedAt = null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String        getId()               { return id; }
    public MessageBroker getBroker()           { return broker; }
    public Instant       getCreatedAt()        { return createdAt; }
    public SessionStatus getStatus()           { return status; }
    public String        getArtifact()         { return artifact; }
    public String        getArtifactLocation() { return artifactLocation; }
    public String        getFailureReason()    { return failureReason; }
    public Instant       getAbandonedAt()      { return abandonedAt; }
    public boolean       isTerminal()          { return terminal.get(); }
    public boolean       isReleased()          { return released.get(); }

    public Optional<TranscriptLog> transcript() { return Optional.ofNullable(transcript); }

    public void setStatus(SessionStatus status) {
        if (!terminal.get()) {
            this.status = status;
        }
    }
    public void setArtifact(String artifact)                 { this.artifact = artifact; }
    public void setArtifactLocation(String artifactLocation) { this.artifactLocation = artifactLocation; }
}
