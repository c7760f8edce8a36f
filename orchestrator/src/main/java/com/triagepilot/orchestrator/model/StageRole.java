package com.triagepilot.orchestrator.model;

/**
 * Which reasoning persona resolves a pipeline stage.
 *
 * The role picks the system prompt and the fallback text used when the
 * reasoning collaborator cannot produce an answer.
 */
public enum StageRole {
    INTERVIEWER,    // Talks to the patient; the only human-facing role
    VALIDATOR,      // Extracts and sanity-checks the reported symptoms
    ASSESSOR,       // Preliminary assessment and red-flag screening
    REPORTER;       // Produces the structured report fields

    public boolean isHumanFacing() {
        return this == INTERVIEWER;
    }
}
