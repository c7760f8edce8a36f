package com.triagepilot.orchestrator.broker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session rendezvous between the request layer and the interview worker.
 *
 * Two channels with deliberately different semantics:
 *   - messages  (requester → worker): FIFO queue, nothing is ever dropped
 *   - question  (worker → requester): single slot, last write wins
 *
 * Each session owns exactly one broker; brokers are never shared.
 *
 * Both directions suspend on a {@link Condition} rather than polling, so a
 * waiting worker or request thread costs nothing while it waits.
 */
public class MessageBroker {

    private final ReentrantLock lock             = new ReentrantLock();
    private final Condition     messageAvailable = lock.newCondition();
    private final Condition     questionChanged  = lock.newCondition();

    private final Deque<String> messages = new ArrayDeque<>();
    private String  question;
    private long    questionVersion;
    private boolean closed;

    // ------------------------------------------------------------------
    // Requester → worker
    // ------------------------------------------------------------------

    /**
     * Append a message to the queue and wake one waiting consumer, if any.
     */
    public void addMessage(String text) {
        Objects.requireNonNull(text, "message");
        lock.lock();
        try {
            messages.addLast(text);
            messageAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pop the oldest message, suspending until one is available.
     *
     * There is no timeout at this layer. The only early exit is an interrupt,
     * which the worker treats as a request to stop.
     */
    public String getMessage() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (messages.isEmpty()) {
                messageAvailable.await();
            }
            return messages.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int pendingMessages() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Worker → requester
    // ------------------------------------------------------------------

    /** Publish the current outstanding question, replacing any previous one. */
    public void setQuestion(String text) {
        lock.lock();
        try {
            question = text;
            questionVersion++;
            questionChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** The current question, or null if none has been asked yet. Not consumed. */
    public String getQuestion() {
        lock.lock();
        try {
            return question;
        } finally {
            lock.unlock();
        }
    }

    /** Incremented on every setQuestion; 0 means no question has been asked. */
    public long questionVersion() {
        lock.lock();
        try {
            return questionVersion;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until a question newer than {@code seenVersion} is published or the
     * broker is closed.
     *
     * @return true if something changed, false if the timeout elapsed first
     */
    public boolean awaitQuestionAfter(long seenVersion, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (questionVersion <= seenVersion && !closed) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = questionChanged.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark the conversation finished and release every requester waiting for a
     * question. Called once by the worker when the pipeline reaches a terminal state.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            questionChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
