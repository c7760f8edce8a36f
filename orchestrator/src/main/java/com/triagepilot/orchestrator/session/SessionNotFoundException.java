package com.triagepilot.orchestrator.session;

/**
 * Thrown when a request names a session id the registry does not hold.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
