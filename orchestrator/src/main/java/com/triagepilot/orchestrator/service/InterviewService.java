package com.triagepilot.orchestrator.service;

import com.triagepilot.orchestrator.broker.MessageBroker;
import com.triagepilot.orchestrator.model.ReportRecord;
import com.triagepilot.orchestrator.model.SessionStatus;
import com.triagepilot.orchestrator.session.Session;
import com.triagepilot.orchestrator.session.SessionNotFoundException;
import com.triagepilot.orchestrator.session.SessionRegistry;
import com.triagepilot.orchestrator.storage.ReportStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request-side operations of the interview.
 *
 * Each method runs on a web request thread and talks to the session's worker
 * only through its {@link MessageBroker}. Waiting for the next question is
 * bounded; on timeout the requester gets an {@link AnswerTimeoutException}
 * while the worker keeps waiting for a message (an "abandoned worker").
 */
@Service
public class InterviewService {

    private static final Logger log = LoggerFactory.getLogger(InterviewService.class);

    private final SessionRegistry registry;
    private final WorkerManager   workerManager;
    private final ReportStorage   reportStorage;
    private final Duration        answerTimeout;

    public InterviewService(SessionRegistry registry,
                            WorkerManager workerManager,
                            ReportStorage reportStorage,
                            @Value("${triagepilot.session.answer-timeout-seconds:300}") long answerTimeoutSeconds) {
        this.registry      = registry;
        this.workerManager = workerManager;
        this.reportStorage = reportStorage;
        this.answerTimeout = Duration.ofSeconds(answerTimeoutSeconds);
    }

    // ------------------------------------------------------------------
    // Start / answer
    // ------------------------------------------------------------------

    /**
     * Get or create the session, start its worker if needed, and wait for the
     * first question. Calling start again returns the current question at once
     * while it is still unanswered; otherwise it waits for the next one.
     */
    public InterviewTurn start(String sessionId) {
        Session session = registry.getOrCreate(sessionId);
        workerManager.start(session);

        MessageBroker broker = session.getBroker();
        boolean answered = broker.pendingMessages() > 0
                || session.getStatus() != SessionStatus.AWAITING_INPUT;
        return awaitTurn(session, answered ? broker.questionVersion() : 0L);
    }

    /**
     * Deliver the patient's message and wait for the next question, or for the
     * pipeline to finish.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws IllegalArgumentException if the message is blank
     * @throws AnswerTimeoutException   if nothing new arrives within the timeout
     */
    public InterviewTurn answer(String sessionId, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        Session session = require(sessionId);
        MessageBroker broker = session.getBroker();

        // Read the version before delivering, or a fast worker could publish
        // the next question before we start waiting and we would miss it.
        long seen = broker.questionVersion();
        broker.addMessage(message);
        log.info("Delivered answer to session {} ({} queued)", sessionId, broker.pendingMessages());

        return awaitTurn(session, seen);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Session> find(String sessionId) {
        return registry.find(sessionId);
    }

    public List<Map<String, Object>> transcript(String sessionId) {
        Session session = require(sessionId);
        return session.transcript()
                .map(t -> {
                    try {
                        return t.readAll();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Could not read transcript for session " + sessionId, e);
                    }
                })
                .orElse(List.of());
    }

    public List<ReportRecord> reports(String sessionId) {
        return reportStorage.reportsFor(sessionId);
    }

    /**
     * Cancel the worker (if any) and remove the session.
     *
     * @return true if a session existed
     */
    public boolean end(String sessionId) {
        Optional<Session> session = registry.find(sessionId);
        session.ifPresent(workerManager::cancel);
        registry.cleanup(sessionId);
        return session.isPresent();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Session require(String sessionId) {
        return registry.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private InterviewTurn awaitTurn(Session session, long seenVersion) {
        boolean changed;
        try {
            changed = session.getBroker().awaitQuestionAfter(seenVersion, answerTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnswerTimeoutException(session.getId(), answerTimeout);
        }
        if (!changed) {
            session.markAbandoned();
            log.warn("Requester for session {} timed out after {} s; worker left running (abandoned worker)",
                    session.getId(), answerTimeout.toSeconds());
            throw new AnswerTimeoutException(session.getId(), answerTimeout);
        }
        return InterviewTurn.of(session);
    }
}
