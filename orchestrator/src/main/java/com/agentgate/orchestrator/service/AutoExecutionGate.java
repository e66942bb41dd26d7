package com.agentgate.orchestrator.service;

import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.model.RiskLevel;

import java.util.EnumSet;
import java.util.Set;

/**
 * The one place that decides whether an action may run without asking.
 *
 * An action needs a human decision when its risk reaches the approval
 * threshold, or when its type is listed as always-prompt. Whether AI
 * responses are parsed for actions at all is also decided here.
 */
public class AutoExecutionGate {

    private final boolean         parsingEnabled;
    private final boolean         approvalsEnabled;
    private final RiskLevel       threshold;
    private final Set<ActionType> alwaysPrompt;

    public AutoExecutionGate(boolean parsingEnabled, boolean approvalsEnabled,
                             RiskLevel threshold, Set<ActionType> alwaysPromptFor) {
        this.parsingEnabled   = parsingEnabled;
        this.approvalsEnabled = approvalsEnabled;
        this.threshold        = threshold;
        this.alwaysPrompt     = alwaysPromptFor.isEmpty()
                ? EnumSet.noneOf(ActionType.class)
                : EnumSet.copyOf(alwaysPromptFor);
    }

    /** Prompt on HIGH risk only; parsing and approvals on. */
    public static AutoExecutionGate defaults() {
        return new AutoExecutionGate(true, true, RiskLevel.HIGH, Set.of());
    }

    public boolean parsingEnabled() {
        return parsingEnabled;
    }

    /** False means gated actions are refused outright instead of prompted. */
    public boolean approvalsEnabled() {
        return approvalsEnabled;
    }

    public boolean requiresApproval(ActionType type, RiskLevel risk) {
        return risk.atLeast(threshold) || alwaysPrompt.contains(type);
    }

    public RiskLevel threshold() {
        return threshold;
    }
}
