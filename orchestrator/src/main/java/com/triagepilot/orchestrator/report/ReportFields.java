package com.triagepilot.orchestrator.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured fields handed to the document renderer.
 * Field names on the wire match the REPORTER prompt (snake_case).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportFields(
        @JsonProperty("chief_complaint")            String chiefComplaint,
        @JsonProperty("history_of_present_illness") String historyOfPresentIllness,
        @JsonProperty("symptoms")                   Map<String, String> symptoms,
        @JsonProperty("assessment")                 String assessment,
        @JsonProperty("recommendations")            String recommendations
) {
    public ReportFields {
        symptoms = symptoms == null ? Map.of() : new LinkedHashMap<>(symptoms);
    }

    /** Used when the final stage output is not parseable JSON. */
    public static ReportFields fromText(String text) {
        return new ReportFields("Symptom report", null, Map.of(), text, null);
    }
}
