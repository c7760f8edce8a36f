package com.triagepilot.orchestrator.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, newline-delimited JSON record of one interview.
 *
 * Every line has the shape {timestamp, type, ...fields} where type is one of
 * interaction | error | completion. Written by the worker; deleted when the
 * session is cleaned up. Records arriving after deletion are dropped.
 *
 * A failed append is logged and dropped: losing a transcript line must never
 * take down the interview itself.
 */
public class TranscriptLog {

    private static final Logger log = LoggerFactory.getLogger(TranscriptLog.class);

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Path         file;
    private final ObjectMapper json;

    // Set by delete(); guarded by this.
    private boolean closed;

    public TranscriptLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.json = objectMapper;
    }

    public Path path() {
        return file;
    }

    // ------------------------------------------------------------------
    // Writers
    // ------------------------------------------------------------------

    public void recordInteraction(String stage, String question, String answer) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("stage",    stage);
        fields.put("question", question);
        fields.put("answer",   answer);
        append("interaction", fields);
    }

    public void recordError(String stage, String message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (stage != null) fields.put("stage", stage);
        fields.put("message", message);
        append("error", fields);
    }

    public void recordCompletion(String artifactLocation, int stageCount) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("artifactLocation", artifactLocation);
        fields.put("stageCount",       stageCount);
        append("completion", fields);
    }

    private synchronized void append(String type, Map<String, Object> fields) {
        if (closed) {
            log.debug("Transcript {} already deleted, dropping {} record", file, type);
            return;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", Instant.now().toString());
        record.put("type",      type);
        record.putAll(fields);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, json.writeValueAsString(record) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not append {} record to transcript {}: {}", type, file, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Readers / lifecycle
    // ------------------------------------------------------------------

    /** Parsed records in write order; empty if nothing has been written yet. */
    public synchronized List<Map<String, Object>> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<Map<String, Object>> records = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                records.add(json.readValue(line, RECORD_TYPE));
            }
        }
        return records;
    }

    /** Remove the file and stop accepting records. Safe to call more than once. */
    public synchronized void delete() throws IOException {
        closed = true;
        Files.deleteIfExists(file);
    }
}
