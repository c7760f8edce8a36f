package com.triagepilot.orchestrator.pipeline;

/**
 * Unrecoverable failure inside a pipeline stage. Aborts the remaining stages
 * and marks the session FAILED.
 */
public class StageExecutionException extends RuntimeException {

    private final String stage;

    public StageExecutionException(String stage, String message, Throwable cause) {
        super("Stage '" + stage + "' failed: " + message, cause);
        this.stage = stage;
    }

    public String getStage() { return stage; }
}
