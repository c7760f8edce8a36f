package com.triagepilot.orchestrator.resilience;

/**
 * Raised by the invoker itself when a call returns null or blank text.
 * Classified as transient: no usable output is treated like an overload.
 */
public class EmptyResultException extends RuntimeException {

    public EmptyResultException(String message) {
        super(message);
    }
}
