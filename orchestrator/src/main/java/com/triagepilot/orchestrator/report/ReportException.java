package com.triagepilot.orchestrator.report;

/**
 * Thrown when the report document cannot be rendered to disk.
 */
public class ReportException extends RuntimeException {

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
