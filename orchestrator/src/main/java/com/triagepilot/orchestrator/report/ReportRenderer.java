package com.triagepilot.orchestrator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Renders a medical symptom report as a Markdown document.
 *
 * Files land in triagepilot.report.dir as
 *   medical_report_<yyyyMMdd_HHmmss>_<chief complaint, 30 chars>.md
 * and are handed to {@link com.triagepilot.orchestrator.storage.ReportStorage}
 * afterwards; this class never uploads anything.
 */
@Component
public class ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(ReportRenderer.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter HUMAN_STAMP = DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' HH:mm");

    private static final String DISCLAIMER =
            "This report was generated from an automated patient interview. It is not a diagnosis "
            + "and must be reviewed by a qualified clinician.";

    private final Path  reportDir;
    private final Clock clock;

    @Autowired
    public ReportRenderer(@Value("${triagepilot.report.dir:reports}") String reportDir) {
        this(Path.of(reportDir), Clock.systemDefaultZone());
    }

    public ReportRenderer(Path reportDir, Clock clock) {
        this.reportDir = reportDir;
        this.clock     = clock;
    }

    /**
     * Write the report and return its path.
     *
     * @throws ReportException if the directory or file cannot be written
     */
    public Path render(ReportFields fields, String sessionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path file = reportDir.resolve("medical_report_" + now.format(FILE_STAMP) + "_"
                + shortComplaint(fields.chiefComplaint()) + ".md");
        try {
            Files.createDirectories(reportDir);
            Files.writeString(file, toMarkdown(fields, sessionId, now), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportException("Could not write report " + file, e);
        }
        log.info("Rendered report {} for session {}", file.getFileName(), sessionId);
        return file;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    String toMarkdown(ReportFields fields, String sessionId, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# MEDICAL SYMPTOM REPORT\n\n");
        sb.append("| | |\n|---|---|\n");
        sb.append("| Report Generated | ").append(generatedAt.format(HUMAN_STAMP)).append(" |\n");
        sb.append("| Report Type | Symptom Assessment |\n");
        sb.append("| Source | AI-Assisted Patient Interview |\n");
        sb.append("| Session | ").append(sessionId).append(" |\n\n");

        int n = 1;
        n = section(sb, n, "CHIEF COMPLAINT", fields.chiefComplaint());
        n = section(sb, n, "HISTORY OF PRESENT ILLNESS", fields.historyOfPresentIllness());
        if (!fields.symptoms().isEmpty()) {
            sb.append("## ").append(n++).append(". SYMPTOMS\n\n");
            for (Map.Entry<String, String> e : fields.symptoms().entrySet()) {
                sb.append("- **").append(e.getKey()).append("**: ").append(e.getValue()).append('\n');
            }
            sb.append('\n');
        }
        n = section(sb, n, "PRELIMINARY ASSESSMENT", fields.assessment());
        section(sb, n, "RECOMMENDATIONS", fields.recommendations());

        sb.append("---\n\n_").append(DISCLAIMER).append("_\n");
        return sb.toString();
    }

    private static int section(StringBuilder sb, int n, String title, String body) {
        if (body == null || body.isBlank()) return n;
        sb.append("## ").append(n).append(". ").append(title).append("\n\n").append(body.strip()).append("\n\n");
        return n + 1;
    }

    static String shortComplaint(String chiefComplaint) {
        if (chiefComplaint == null || chiefComplaint.isBlank()) return "symptom_report";
        String cleaned = chiefComplaint.strip()
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Za-z0-9_-]", "");
        if (cleaned.isEmpty()) return "symptom_report";
        return cleaned.length() > 30 ? cleaned.substring(0, 30) : cleaned;
    }
}
