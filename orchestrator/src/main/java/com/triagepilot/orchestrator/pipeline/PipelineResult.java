package com.triagepilot.orchestrator.pipeline;

import java.util.Map;

/**
 * Outcome of one complete pipeline run.
 *
 * @param outputs          every stage's output, keyed by stage name, in execution order
 * @param artifact         output of the final stage
 * @param artifactLocation where the published report was stored; null if nothing was published
 */
public record PipelineResult(Map<String, String> outputs, String artifact, String artifactLocation) {}
