package com.triagepilot.orchestrator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagepilot.orchestrator.pipeline.ResponseParser;
import com.triagepilot.orchestrator.storage.ReportStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Turns the final stage output into a stored report: parse → render → store.
 *
 * Called once per completed pipeline, outside the retry logic. Rendering and
 * storage failures propagate and fail the session.
 */
@Component
public class ReportPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReportPublisher.class);

    private final ReportRenderer renderer;
    private final ReportStorage  storage;
    private final ObjectMapper   objectMapper;

    public ReportPublisher(ReportRenderer renderer, ReportStorage storage, ObjectMapper objectMapper) {
        this.renderer     = renderer;
        this.storage      = storage;
        this.objectMapper = objectMapper;
    }

    /**
     * @return storage location of the published report
     */
    public String publish(String sessionId, String finalOutput) {
        Path rendered = renderer.render(parseFields(finalOutput), sessionId);
        return storage.store(rendered, sessionId);
    }

    /**
     * Read report fields from the REPORTER output. Anything that is not the
     * expected JSON still yields a report, with the raw text as the assessment.
     */
    ReportFields parseFields(String finalOutput) {
        String payload = ResponseParser.structuredPayload(finalOutput);
        try {
            ReportFields fields = objectMapper.readValue(payload, ReportFields.class);
            if (fields != null) {
                return fields;
            }
        } catch (Exception e) {
            log.warn("Final output is not report JSON, rendering it as plain text: {}", e.getMessage());
        }
        return ReportFields.fromText(finalOutput);
    }
}
