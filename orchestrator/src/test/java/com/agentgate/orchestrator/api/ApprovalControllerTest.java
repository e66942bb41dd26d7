package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.approval.ApprovalCoordinator;
import com.agentgate.orchestrator.approval.ApprovalRequest;
import com.agentgate.orchestrator.model.RiskLevel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

    @Autowired MockMvc                 mockMvc;
    @MockitoBean ApprovalCoordinator   coordinator;
    @MockitoBean PromptStreamService   streams;

    @Test
    void pending_listsOutstandingPrompts() throws Exception {
        ApprovalRequest request = new ApprovalRequest("prompt-1", "runCommand", "rm old.log",
                "This operation may pose security risks (rm)", RiskLevel.HIGH, "rm old.log",
                Instant.parse("2025-01-01T00:00:00Z"));
        when(coordinator.pendingRequests()).thenReturn(List.of(request));

        mockMvc.perform(get("/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("prompt-1"))
                .andExpect(jsonPath("$[0].target").value("rm old.log"))
                .andExpect(jsonPath("$[0].riskLevel").value("high"));
    }

    @Test
    void resolve_pendingPrompt_returnsResolvedTrue() throws Exception {
        when(coordinator.resolveApproval("prompt-1", true, true)).thenReturn(true);

        mockMvc.perform(post("/approvals/{id}", "prompt-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"approved":true,"alwaysAllow":true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.promptId").value("prompt-1"))
                .andExpect(jsonPath("$.resolved").value(true));
    }

    @Test
    void resolve_staleOrUnknownPrompt_returnsResolvedFalse() throws Exception {
        when(coordinator.resolveApproval("prompt-gone", false, false)).thenReturn(false);

        mockMvc.perform(post("/approvals/{id}", "prompt-gone")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"approved":false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolved").value(false));
    }

    @Test
    void resolve_missingDecision_returns400() throws Exception {
        mockMvc.perform(post("/approvals/{id}", "prompt-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(coordinator, never()).resolveApproval(anyString(), anyBoolean(), anyBoolean());
    }

    @Test
    void stream_opensServerSentEventChannel() throws Exception {
        when(streams.createEmitter()).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/approvals/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
    }
}
