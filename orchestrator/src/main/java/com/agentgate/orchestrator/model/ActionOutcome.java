package com.agentgate.orchestrator.model;

import com.agentgate.orchestrator.executor.dto.ExecutionResult;

/**
 * Machine-readable result of pushing one action through the orchestrator.
 *
 * @param actionId          Correlates log lines and the audit entry for this action.
 * @param action            The action as dispatched.
 * @param state             Terminal state.
 * @param riskLevel         Classification, null when the action never reached it.
 * @param reason            Short reason ("timeout", "denied", validation message, ...).
 * @param promptId          Approval correlation id, null when no prompt was raised.
 * @param retryAfterSeconds Only meaningful for RATE_LIMITED.
 * @param executionResult   Executor response for EXECUTED / unsuccessful runs.
 */
public record ActionOutcome(
        String          actionId,
        ParsedAction    action,
        ActionState     state,
        RiskLevel       riskLevel,
        String          reason,
        String          promptId,
        int             retryAfterSeconds,
        ExecutionResult executionResult) {

    public boolean executed() {
        return state == ActionState.EXECUTED;
    }
}
