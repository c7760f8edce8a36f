package com.triagepilot.orchestrator.pipeline;

import com.triagepilot.orchestrator.claude.ClaudeClient;
import com.triagepilot.orchestrator.claude.ClaudeClient.Message;
import com.triagepilot.orchestrator.model.SessionStatus;
import com.triagepilot.orchestrator.report.ReportPublisher;
import com.triagepilot.orchestrator.resilience.ResilientInvoker;
import com.triagepilot.orchestrator.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the stage graph for one session, on that session's worker thread.
 *
 * For each stage, in declaration order:
 *   1. Build the input from the dependency outputs + the stage instruction
 *   2. Interactive stage:
 *        → generate a question through the invoker
 *        → AWAITING_INPUT, publish the question, block on the broker
 *        → RUNNING again; the patient's answer is the stage output
 *      Other stages:
 *        → call the reasoning collaborator through the invoker
 *   3. Store the output for the stages that depend on it
 *
 * After the final stage its output is the artifact, which is published once.
 * Collaborator trouble degrades to fallback text inside the invoker; anything
 * that escapes this method is fatal for the session.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final StageGraph       graph;
    private final ClaudeClient     claude;
    private final ResilientInvoker invoker;
    private final StagePrompts     prompts;
    private final ReportPublisher  publisher;
    private final String           model;

    public PipelineRunner(StageGraph graph,
                          ClaudeClient claude,
                          ResilientInvoker invoker,
                          StagePrompts prompts,
                          ReportPublisher publisher,
                          @Value("${triagepilot.claude.model:claude-sonnet-4-5}") String model) {
        this.graph     = graph;
        this.claude    = claude;
        this.invoker   = invoker;
        this.prompts   = prompts;
        this.publisher = publisher;
        this.model     = model;
    }

    public StageGraph graph() {
        return graph;
    }

    /**
     * Run every stage to completion.
     *
     * @throws InterruptedException if the worker is cancelled while waiting for an answer
     * @throws StageExecutionException on an unrecoverable stage error
     */
    public PipelineResult run(Session session) throws InterruptedException {
        Map<String, String> outputs = new LinkedHashMap<>();

        for (PipelineStage stage : graph.stages()) {
            MDC.put("stage", stage.name());
            try {
                log.info("Running stage '{}' (role={}, interactive={})",
                        stage.name(), stage.role(), stage.interactive());

                String input  = graph.inputFor(stage, outputs);
                String output = stage.interactive()
                        ? runInteractive(session, stage, input)
                        : runAutomated(stage, input);

                outputs.put(stage.name(), output);
                log.info("Stage '{}' produced {} chars", stage.name(), output.length());
            } catch (InterruptedException | StageExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StageExecutionException(stage.name(), e.getMessage(), e);
            } finally {
                MDC.remove("stage");
            }
        }

        String artifact = outputs.get(graph.finalStage().name());
        session.setArtifact(artifact);

        String location = null;
        if (publisher != null) {
            try {
                location = publisher.publish(session.getId(), artifact);
            } catch (RuntimeException e) {
                throw new StageExecutionException(graph.finalStage().name(),
                        "report publishing failed: " + e.getMessage(), e);
            }
            session.setArtifactLocation(location);
        }
        return new PipelineResult(Collections.unmodifiableMap(outputs), artifact, location);
    }

    // ------------------------------------------------------------------
    // Stage kinds
    // ------------------------------------------------------------------

    private String runInteractive(Session session, PipelineStage stage, String input)
            throws InterruptedException {
        String prompt = session.consumeOpeningTurn()
                ? input + "\n\n" + StagePrompts.OPENING_TURN_HINT
                : input;

        String question = invoker.invoke(stage.role(), () -> ask(stage, prompt));

        // Status first: a requester woken by setQuestion must already see AWAITING_INPUT.
        session.setStatus(SessionStatus.AWAITING_INPUT);
        session.getBroker().setQuestion(question);

        String answer = session.getBroker().getMessage();
        session.clearAbandoned();
        session.setStatus(SessionStatus.RUNNING);

        session.transcript().ifPresent(t -> t.recordInteraction(stage.name(), question, answer));
        return answer;
    }

    private String runAutomated(PipelineStage stage, String input) {
        return invoker.invoke(stage.role(), () -> ask(stage, input));
    }

    private String ask(PipelineStage stage, String input) {
        return claude.complete(model, List.of(new Message("user", input)), prompts.get(stage.role()));
    }
}
