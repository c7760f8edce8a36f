package com.triagepilot.orchestrator.api;

import com.triagepilot.orchestrator.broker.MessageBroker;
import com.triagepilot.orchestrator.model.ReportRecord;
import com.triagepilot.orchestrator.model.SessionStatus;
import com.triagepilot.orchestrator.service.AnswerTimeoutException;
import com.triagepilot.orchestrator.service.InterviewService;
import com.triagepilot.orchestrator.service.InterviewTurn;
import com.triagepilot.orchestrator.session.Session;
import com.triagepilot.orchestrator.session.SessionNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for InterviewController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no workers, no Claude).
 * InterviewService is replaced by a mock.
 */
@WebMvcTest(InterviewController.class)
class InterviewControllerTest {

    @Autowired   MockMvc          mockMvc;
    @MockitoBean InterviewService interviewService;

    // ------------------------------------------------------------------
    // POST /interviews/{id}/start
    // ------------------------------------------------------------------

    @Test
    void start_returns200WithFirstQuestion() throws Exception {
        when(interviewService.start("patient-1")).thenReturn(new InterviewTurn(
                "patient-1", SessionStatus.AWAITING_INPUT, "What brings you in today?", null, null));

        mockMvc.perform(post("/interviews/patient-1/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("patient-1"))
                .andExpect(jsonPath("$.status").value("AWAITING_INPUT"))
                .andExpect(jsonPath("$.question").value("What brings you in today?"));
    }

    @Test
    void start_timeout_returns504() throws Exception {
        when(interviewService.start("patient-1"))
                .thenThrow(new AnswerTimeoutException("patient-1", Duration.ofSeconds(300)));

        mockMvc.perform(post("/interviews/patient-1/start"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.status").value("timeout"))
                .andExpect(jsonPath("$.sessionId").value("patient-1"));
    }

    // ------------------------------------------------------------------
    // POST /interviews/{id}/answer
    // ------------------------------------------------------------------

    @Test
    void answer_returnsNextQuestion() throws Exception {
        when(interviewService.answer("patient-1", "I have a headache")).thenReturn(new InterviewTurn(
                "patient-1", SessionStatus.AWAITING_INPUT, "How long have you had it?", null, null));

        mockMvc.perform(post("/interviews/patient-1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"I have a headache"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.question").value("How long have you had it?"));
    }

    @Test
    void answer_completedInterview_returnsArtifactLocation() throws Exception {
        when(interviewService.answer(eq("patient-1"), any())).thenReturn(new InterviewTurn(
                "patient-1", SessionStatus.COMPLETED, null, "patients/patient-1/reports/r.md", null));

        mockMvc.perform(post("/interviews/patient-1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"That's all\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.question").isEmpty())
                .andExpect(jsonPath("$.artifactLocation").value("patients/patient-1/reports/r.md"));
    }

    @Test
    void answer_unknownSession_returns404() throws Exception {
        when(interviewService.answer(eq("ghost"), any())).thenThrow(new SessionNotFoundException("ghost"));

        mockMvc.perform(post("/interviews/ghost/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void answer_blankMessage_returns400() throws Exception {
        when(interviewService.answer(eq("patient-1"), any()))
                .thenThrow(new IllegalArgumentException("message must not be blank"));

        mockMvc.perform(post("/interviews/patient-1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void answer_timeout_returns504() throws Exception {
        when(interviewService.answer(eq("patient-1"), any()))
                .thenThrow(new AnswerTimeoutException("patient-1", Duration.ofSeconds(300)));

        mockMvc.perform(post("/interviews/patient-1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"I have a headache\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").isNotEmpty());
    }

    // ------------------------------------------------------------------
    // Queries / DELETE
    // ------------------------------------------------------------------

    @Test
    void get_liveSession_returnsState() throws Exception {
        Session session = new Session("patient-1", new MessageBroker(), null);
        session.getBroker().setQuestion("What brings you in today?");
        when(interviewService.find("patient-1")).thenReturn(Optional.of(session));

        mockMvc.perform(get("/interviews/patient-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.question").value("What brings you in today?"))
                .andExpect(jsonPath("$.workerRunning").value(false));
    }

    @Test
    void get_unknownSession_returns404() throws Exception {
        when(interviewService.find("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/interviews/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    void transcript_returnsRecords() throws Exception {
        when(interviewService.transcript("patient-1")).thenReturn(List.of(
                Map.of("type", "interaction", "stage", "interview", "answer", "I have a headache")));

        mockMvc.perform(get("/interviews/patient-1/transcript"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("interaction"))
                .andExpect(jsonPath("$[0].answer").value("I have a headache"));
    }

    @Test
    void reports_listsStoredReports() throws Exception {
        when(interviewService.reports("patient-1")).thenReturn(List.of(
                new ReportRecord("patient-1", "r.md", "patients/patient-1/reports/r.md")));

        mockMvc.perform(get("/interviews/patient-1/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].fileName").value("r.md"))
                .andExpect(jsonPath("$[0].storagePath").value("patients/patient-1/reports/r.md"));
    }

    @Test
    void delete_existingSession_returns204_unknown_returns404() throws Exception {
        when(interviewService.end("patient-1")).thenReturn(true);
        when(interviewService.end("ghost")).thenReturn(false);

        mockMvc.perform(delete("/interviews/patient-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/interviews/ghost"))
                .andExpect(status().isNotFound());
    }
}
