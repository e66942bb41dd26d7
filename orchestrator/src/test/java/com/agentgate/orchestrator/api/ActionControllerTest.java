package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.agent.ActionExtractor;
import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.ActionOutcome;
import com.agentgate.orchestrator.model.ActionState;
import com.agentgate.orchestrator.model.ParseResult;
import com.agentgate.orchestrator.model.ParsedAction;
import com.agentgate.orchestrator.model.RiskLevel;
import com.agentgate.orchestrator.service.ActionOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for ActionController.
 *
 * Extractor and orchestrator are mocks; the async endpoints are driven with
 * asyncDispatch once the returned future is complete.
 */
@WebMvcTest(ActionController.class)
class ActionControllerTest {

    @Autowired MockMvc                mockMvc;
    @MockitoBean ActionExtractor      extractor;
    @MockitoBean ActionOrchestrator   orchestrator;

    // ------------------------------------------------------------------
    // POST /actions/parse
    // ------------------------------------------------------------------

    @Test
    void parse_returnsActionsAndSummary() throws Exception {
        when(extractor.extract("I'll run `npm test`"))
                .thenReturn(ParseResult.of(List.of(ParsedAction.runCommand("npm test", 0.85))));

        mockMvc.perform(post("/actions/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"I'll run `npm test`"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasActionableContent").value(true))
                .andExpect(jsonPath("$.summary").value("Detected 1 command"))
                .andExpect(jsonPath("$.actions[0].type").value("runCommand"))
                .andExpect(jsonPath("$.actions[0].command").value("npm test"));
    }

    @Test
    void parse_withMinConfidence_passesThreshold() throws Exception {
        when(extractor.extract(anyString(), eq(0.95))).thenReturn(ParseResult.empty());

        mockMvc.perform(post("/actions/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"I'll run `npm test`","minConfidence":0.95}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasActionableContent").value(false))
                .andExpect(jsonPath("$.summary").value(ParseResult.NO_ACTIONS_SUMMARY));
    }

    @Test
    void parse_blankText_returns400() throws Exception {
        mockMvc.perform(post("/actions/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"   "}
                                """))
                .andExpect(status().isBadRequest());

        verify(extractor, never()).extract(anyString());
        verify(extractor, never()).extract(anyString(), anyDouble());
    }

    // ------------------------------------------------------------------
    // POST /actions/process
    // ------------------------------------------------------------------

    @Test
    void process_returnsOneOutcomePerAction() throws Exception {
        ActionOutcome outcome = new ActionOutcome("action-1", ParsedAction.createFile("src/a.ts", "x", 0.9),
                ActionState.EXECUTED, RiskLevel.LOW, "ok", null, 0, ExecutionResult.ok(""));
        when(orchestrator.processResponse(any())).thenReturn(CompletableFuture.completedFuture(List.of(outcome)));

        MvcResult pending = mockMvc.perform(post("/actions/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"I'll create src/a.ts"}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].actionId").value("action-1"))
                .andExpect(jsonPath("$[0].type").value("createFile"))
                .andExpect(jsonPath("$[0].state").value("EXECUTED"))
                .andExpect(jsonPath("$[0].riskLevel").value("low"))
                .andExpect(jsonPath("$[0].exitCode").value(0))
                .andExpect(jsonPath("$[0].retryAfterSeconds").doesNotExist());
    }

    // ------------------------------------------------------------------
    // POST /commands
    // ------------------------------------------------------------------

    @Test
    void runCommand_executed_returns200() throws Exception {
        ActionOutcome outcome = new ActionOutcome("action-2", ParsedAction.runCommand("npm test", 1.0),
                ActionState.EXECUTED, RiskLevel.MEDIUM, "ok", null, 0, ExecutionResult.ok("passed"));
        when(orchestrator.executeCommand("npm test", "chg-1")).thenReturn(CompletableFuture.completedFuture(outcome));

        MvcResult pending = mockMvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"command":"  npm test ","changeId":"chg-1"}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("EXECUTED"))
                .andExpect(jsonPath("$.stdout").value("passed"));
    }

    @Test
    void runCommand_rateLimited_returns429WithRetryAfter() throws Exception {
        ActionOutcome outcome = new ActionOutcome("action-3", ParsedAction.runCommand("npm test", 1.0),
                ActionState.RATE_LIMITED, null, "Rate limit exceeded", null, 42, null);
        when(orchestrator.executeCommand("npm test", null)).thenReturn(CompletableFuture.completedFuture(outcome));

        MvcResult pending = mockMvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"command":"npm test"}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(42))
                .andExpect(jsonPath("$.reason").value("Rate limit exceeded"));
    }

    @Test
    void runCommand_blankCommand_returns400() throws Exception {
        mockMvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"command":""}
                                """))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).executeCommand(any(), any());
    }
}
