package com.triagepilot.orchestrator.storage;

/**
 * Thrown when a rendered report cannot be stored. Never retried here; the
 * caller decides what a storage failure means.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
