package com.triagepilot.orchestrator.pipeline;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered set of pipeline stages.
 *
 * The declaration order is the execution order. Every dependency must name a
 * stage declared earlier, which makes the graph acyclic by construction and
 * guarantees dependencies always run before their dependents.
 */
public class StageGraph {

    private final List<PipelineStage> stages;

    public StageGraph(List<PipelineStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        Set<String> declared = new HashSet<>();
        for (PipelineStage stage : stages) {
            for (String dep : stage.dependencies()) {
                if (!declared.contains(dep)) {
                    throw new IllegalArgumentException(
                            "Stage '" + stage.name() + "' depends on '" + dep + "', which is not declared before it");
                }
            }
            if (!declared.add(stage.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
        }
        this.stages = List.copyOf(stages);
    }

    public List<PipelineStage> stages() {
        return stages;
    }

    public PipelineStage finalStage() {
        return stages.get(stages.size() - 1);
    }

    public int size() {
        return stages.size();
    }

    /**
     * Build the input for {@code stage}: dependency outputs in declaration
     * order, then the stage's own instruction.
     *
     * @throws IllegalStateException if a dependency has not produced output yet
     */
    public String inputFor(PipelineStage stage, Map<String, String> outputs) {
        StringBuilder sb = new StringBuilder();

        if (!stage.dependencies().isEmpty()) {
            sb.append("=== CONTEXT FROM PREVIOUS STAGES ===\n");
            for (String dep : stage.dependencies()) {
                String output = outputs.get(dep);
                if (output == null) {
                    throw new IllegalStateException(
                            "Stage '" + stage.name() + "' cannot run: '" + dep + "' has no output");
                }
                sb.append("[ ").append(dep).append(" output ]\n").append(output).append("\n\n");
            }
            sb.append("=== END CONTEXT ===\n\n");
        }

        sb.append(stage.instruction());
        return sb.toString();
    }
}
