package com.triagepilot.orchestrator.api;

import com.triagepilot.orchestrator.api.dto.AnswerRequest;
import com.triagepilot.orchestrator.api.dto.ReportResponse;
import com.triagepilot.orchestrator.api.dto.SessionResponse;
import com.triagepilot.orchestrator.api.dto.TurnResponse;
import com.triagepilot.orchestrator.service.AnswerTimeoutException;
import com.triagepilot.orchestrator.service.InterviewService;
import com.triagepilot.orchestrator.session.SessionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for the interview lifecycle.
 *
 * POST   /interviews/{id}/start        start (or rejoin) an interview, returns the first question
 * POST   /interviews/{id}/answer       deliver the patient's answer, returns the next question
 * GET    /interviews/{id}              current state of a live session
 * GET    /interviews/{id}/transcript   interaction log of a live session
 * GET    /interviews/{id}/reports      reports stored for the id (survive session cleanup)
 * DELETE /interviews/{id}              cancel the worker and drop the session
 *
 * start and answer block the request thread for up to
 * triagepilot.session.answer-timeout-seconds and answer 504 on timeout.
 */
@RestController
@RequestMapping("/interviews")
public class InterviewController {

    private final InterviewService interviewService;

    public InterviewController(InterviewService interviewService) {
        this.interviewService = interviewService;
    }

    /**
     * Start an interview.
     *
     * Example:
     *   curl -X POST http://localhost:8080/interviews/patient-42/start
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<?> start(@PathVariable String id) {
        try {
            return ResponseEntity.ok(TurnResponse.from(interviewService.start(id)));
        } catch (AnswerTimeoutException e) {
            return timeout(e);
        }
    }

    /**
     * Answer the outstanding question.
     *
     * Example:
     *   curl -X POST http://localhost:8080/interviews/patient-42/answer \
     *     -H "Content-Type: application/json" \
     *     -d '{"message":"I have a headache"}'
     */
    @PostMapping("/{id}/answer")
    public ResponseEntity<?> answer(@PathVariable String id, @RequestBody AnswerRequest req) {
        try {
            return ResponseEntity.ok(TurnResponse.from(interviewService.answer(id, req.message())));
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (AnswerTimeoutException e) {
            return timeout(e);
        }
    }

    @GetMapping("/{id}")
    public SessionResponse get(@PathVariable String id) {
        return interviewService.find(id)
                .map(SessionResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + id));
    }

    @GetMapping("/{id}/transcript")
    public List<Map<String, Object>> transcript(@PathVariable String id) {
        try {
            return interviewService.transcript(id);
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/{id}/reports")
    public List<ReportResponse> reports(@PathVariable String id) {
        return interviewService.reports(id).stream()
                .map(ReportResponse::from)
                .toList();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> end(@PathVariable String id) {
        if (!interviewService.end(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    // The worker is still alive; the client may simply call again.
    private static ResponseEntity<Map<String, Object>> timeout(AnswerTimeoutException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(Map.of("status",    "timeout",
                             "sessionId", e.getSessionId(),
                             "error",     e.getMessage()));
    }
}
