package com.triagepilot.orchestrator.service;

import com.triagepilot.orchestrator.model.SessionStatus;
import com.triagepilot.orchestrator.pipeline.PipelineResult;
import com.triagepilot.orchestrator.pipeline.PipelineRunner;
import com.triagepilot.orchestrator.pipeline.StageExecutionException;
import com.triagepilot.orchestrator.session.Session;
import com.triagepilot.orchestrator.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts and finishes the background worker of each interview session.
 *
 * Workers spend most of their life blocked on the broker waiting for the
 * patient, so each live session holds its own pooled thread until it finishes.
 *
 * Every worker ends in exactly one terminal transition (COMPLETED or FAILED),
 * after which the session is cleaned up once.
 */
@Component
@EnableScheduling
public class WorkerManager {

    private static final Logger log = LoggerFactory.getLogger(WorkerManager.class);

    private final AtomicInteger   threadSeq = new AtomicInteger();
    private final ExecutorService workers   = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "interview-worker-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final PipelineRunner  runner;
    private final SessionRegistry registry;
    private final Clock           clock;

    // Zero disables reaping: abandoned workers then wait for their next message indefinitely.
    private final Duration reapAfter;

    @Autowired
    public WorkerManager(PipelineRunner runner,
                         SessionRegistry registry,
                         @Value("${triagepilot.session.reap-abandoned-after-minutes:0}") long reapAfterMinutes) {
        this(runner, registry, Duration.ofMinutes(reapAfterMinutes), Clock.systemUTC());
    }

    public WorkerManager(PipelineRunner runner, SessionRegistry registry, Duration reapAfter, Clock clock) {
        this.runner    = runner;
        this.registry  = registry;
        this.reapAfter = reapAfter;
        this.clock     = clock;
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Start the pipeline worker for {@code session} unless one is already attached.
     *
     * @return true if this call started the worker, false if it was a no-op
     */
    public boolean start(Session session) {
        FutureTask<PipelineResult> task = new FutureTask<>(() -> runToCompletion(session));
        if (!session.attachWorker(task)) {
            log.debug("Session {} already has a worker, start ignored", session.getId());
            return false;
        }
        workers.execute(task);
        log.info("Started worker for session {}", session.getId());
        return true;
    }

    // ------------------------------------------------------------------
    // Worker body
    // ------------------------------------------------------------------

    private PipelineResult runToCompletion(Session session) {
        MDC.put("sessionId", session.getId());
        try {
            session.setStatus(SessionStatus.RUNNING);
            PipelineResult result = runner.run(session);
            finish(session, SessionStatus.COMPLETED, null, null);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker for session {} interrupted", session.getId());
            finish(session, SessionStatus.FAILED, null, "Interview cancelled");
            return null;
        } catch (StageExecutionException e) {
            log.error("Session {} failed in stage '{}': {}", session.getId(), e.getStage(), e.getMessage(), e);
            finish(session, SessionStatus.FAILED, e.getStage(), e.getMessage());
            return null;
        } catch (Exception e) {
            log.error("Unhandled error in worker for session {}: {}", session.getId(), e.getMessage(), e);
            finish(session, SessionStatus.FAILED, null, "Unhandled exception: " + e.getMessage());
            return null;
        } finally {
            // Pool threads are reused; never leak one session's context into the next.
            MDC.clear();
        }
    }

    /**
     * Terminal transition. Guarded by {@link Session#markTerminal}, so racing
     * completion and error paths clean up exactly once.
     */
    void finish(Session session, SessionStatus status, String stage, String reason) {
        if (!session.markTerminal(status, reason)) {
            return;
        }
        session.transcript().ifPresent(t -> {
            if (status == SessionStatus.COMPLETED) {
                t.recordCompletion(session.getArtifactLocation(), runner.graph().size());
            } else {
                t.recordError(stage, reason);
            }
        });
        session.getBroker().close();
        registry.cleanup(session);
        log.info("Session {} {}", session.getId(), status);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /** Interrupt the session's worker, if it has one still running. */
    public boolean cancel(Session session) {
        return session.worker()
                .filter(f -> !f.isDone())
                .map(f -> f.cancel(true))
                .orElse(false);
    }

    /**
     * Reap workers whose requester gave up long ago.
     *
     * A requester that times out marks its session abandoned but leaves the
     * worker blocked on the broker. When reaping is enabled, workers abandoned
     * for longer than the threshold are cancelled; cancellation fails the
     * session and cleans it up. Runs every 60 seconds.
     */
    @Scheduled(fixedDelay = 60_000)
    public void reapAbandonedWorkers() {
        if (reapAfter.isZero() || reapAfter.isNegative()) {
            return;
        }
        Instant cutoff = clock.instant().minus(reapAfter);
        for (Session session : registry.sessions()) {
            Instant abandonedAt = session.getAbandonedAt();
            if (abandonedAt != null && abandonedAt.isBefore(cutoff) && cancel(session)) {
                log.warn("Reaped abandoned worker for session {} (abandoned since {})",
                        session.getId(), abandonedAt);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
