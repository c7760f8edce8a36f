package com.triagepilot.orchestrator.pipeline;

import com.triagepilot.orchestrator.model.StageRole;

import java.util.List;
import java.util.Objects;

/**
 * One unit of work in the interview pipeline.
 *
 * @param name         unique stage name; dependency lists refer to it
 * @param dependencies stages whose outputs feed this one, in the order they are concatenated
 * @param role         reasoning persona that resolves the stage
 * @param instruction  fixed instruction appended after the dependency context
 * @param interactive  true if the stage asks the patient a question and blocks for the answer
 */
public record PipelineStage(String name,
                            List<String> dependencies,
                            StageRole role,
                            String instruction,
                            boolean interactive) {

    public PipelineStage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        instruction  = instruction == null ? "" : instruction;
    }

    public static PipelineStage interactive(String name, StageRole role, String instruction, String... deps) {
        return new PipelineStage(name, List.of(deps), role, instruction, true);
    }

    public static PipelineStage automated(String name, StageRole role, String instruction, String... deps) {
        return new PipelineStage(name, List.of(deps), role, instruction, false);
    }
}
