package com.agentgate.orchestrator.service;

import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AutoExecutionGateTest {

    @Test
    void defaults_promptOnlyForHighRisk() {
        AutoExecutionGate gate = AutoExecutionGate.defaults();

        assertThat(gate.requiresApproval(ActionType.RUN_COMMAND, RiskLevel.HIGH)).isTrue();
        assertThat(gate.requiresApproval(ActionType.RUN_COMMAND, RiskLevel.MEDIUM)).isFalse();
        assertThat(gate.requiresApproval(ActionType.CREATE_FILE, RiskLevel.LOW)).isFalse();
        assertThat(gate.parsingEnabled()).isTrue();
        assertThat(gate.approvalsEnabled()).isTrue();
    }

    @Test
    void mediumThreshold_promptsForMediumAndHigh() {
        AutoExecutionGate gate = new AutoExecutionGate(true, true, RiskLevel.MEDIUM, Set.of());

        assertThat(gate.requiresApproval(ActionType.RUN_COMMAND, RiskLevel.MEDIUM)).isTrue();
        assertThat(gate.requiresApproval(ActionType.RUN_COMMAND, RiskLevel.LOW)).isFalse();
    }

    @Test
    void alwaysPromptType_promptsEvenAtLowRisk() {
        AutoExecutionGate gate = new AutoExecutionGate(true, true, RiskLevel.HIGH, Set.of(ActionType.CREATE_FILE));

        assertThat(gate.requiresApproval(ActionType.CREATE_FILE, RiskLevel.LOW)).isTrue();
        assertThat(gate.requiresApproval(ActionType.OPEN_FILE, RiskLevel.LOW)).isFalse();
    }
}
