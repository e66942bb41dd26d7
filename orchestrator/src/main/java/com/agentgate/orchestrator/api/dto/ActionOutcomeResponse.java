package com.agentgate.orchestrator.api.dto;

import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.ActionOutcome;
import com.agentgate.orchestrator.model.ActionState;
import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.model.ParsedAction;
import com.agentgate.orchestrator.model.RiskLevel;

/**
 * Flattened view of an {@link ActionOutcome} for the REST API.
 * Executor fields are null unless the executor was actually called.
 */
public record ActionOutcomeResponse(
        String      actionId,
        ActionType  type,
        String      description,
        String      filePath,
        String      command,
        ActionState state,
        RiskLevel   riskLevel,
        String      reason,
        String      promptId,
        Integer     retryAfterSeconds,
        Integer     exitCode,
        String      stdout,
        String      stderr
) {
    public static ActionOutcomeResponse from(ActionOutcome outcome) {
        ParsedAction    action = outcome.action();
        ExecutionResult result = outcome.executionResult();
        return new ActionOutcomeResponse(
                outcome.actionId(),
                action.type(),
                action.description(),
                action.filePath(),
                action.command(),
                outcome.state(),
                outcome.riskLevel(),
                outcome.reason(),
                outcome.promptId(),
                outcome.state() == ActionState.RATE_LIMITED ? outcome.retryAfterSeconds() : null,
                result != null ? result.exit_code() : null,
                result != null ? result.stdout()    : null,
                result != null ? result.stderr()    : null
        );
    }
}
