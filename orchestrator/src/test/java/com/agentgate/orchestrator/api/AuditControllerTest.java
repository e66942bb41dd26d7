package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.audit.AuditEntry;
import com.agentgate.orchestrator.audit.AuditLog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired MockMvc      mockMvc;
    @MockitoBean AuditLog   auditLog;

    @Test
    void entries_returnsEverything() throws Exception {
        when(auditLog.entries()).thenReturn(sample());

        mockMvc.perform(get("/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].type").value("action_executed"))
                .andExpect(jsonPath("$[0].details.command").value("npm test"));
    }

    @Test
    void entries_filteredByType() throws Exception {
        when(auditLog.entries()).thenReturn(sample());

        mockMvc.perform(get("/audit").param("type", "approval_denied"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].approved").value(false))
                .andExpect(jsonPath("$[0].details.reason").value("timeout"));
    }

    private static List<AuditEntry> sample() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        return List.of(
                new AuditEntry("action_executed", now, true, Map.of("command", "npm test")),
                new AuditEntry("approval_denied", now, false, Map.of("command", "rm a.txt", "reason", "timeout")));
    }
}
