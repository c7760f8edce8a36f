package com.triagepilot.orchestrator.pipeline;

import com.triagepilot.orchestrator.model.StageRole;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * The medical intake pipeline.
 *
 *   interview ─┬─> follow_up ─┐
 *              └──────────────┴─> validate ─> assessment ─> report
 *
 * (report also reads interview, follow_up and validate directly.)
 */
@Configuration
public class InterviewPipelineConfig {

    @Bean
    StageGraph interviewPipeline() {
        return new StageGraph(List.of(
                PipelineStage.interactive("interview", StageRole.INTERVIEWER,
                        "Ask the patient to describe the main symptom or concern that brings them here today."),
                PipelineStage.interactive("follow_up", StageRole.INTERVIEWER,
                        "Ask one follow-up question about the onset, duration or severity of the symptom "
                        + "described above, whichever is least clear.",
                        "interview"),
                PipelineStage.automated("validate", StageRole.VALIDATOR,
                        "Extract and validate the symptoms reported in the answers above.",
                        "interview", "follow_up"),
                PipelineStage.automated("assessment", StageRole.ASSESSOR,
                        "Write the preliminary assessment for the validated symptoms above.",
                        "validate"),
                PipelineStage.automated("report", StageRole.REPORTER,
                        "Produce the report fields from everything above.",
                        "interview", "follow_up", "validate", "assessment")
        ));
    }
}
