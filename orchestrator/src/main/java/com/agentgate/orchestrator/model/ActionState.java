package com.agentgate.orchestrator.model;

/**
 * Lifecycle of a single action inside the orchestrator.
 *
 * Transitions:
 *   PARSED    → VALIDATED      (path / command shape check passed)
 *   PARSED    → REJECTED       (validation failed at dispatch)
 *   VALIDATED → RATE_LIMITED   (category window exhausted)
 *   VALIDATED → RISK_DENIED    (needs approval but approvals are disabled)
 *   VALIDATED → DENIED         (user declined, or the prompt timed out)
 *   VALIDATED → APPROVED       (low risk, allow-listed, or user approved)
 *   APPROVED  → EXECUTED | EXECUTION_FAILED
 *
 * Every terminal state appends exactly one audit entry of {@link #auditType()}.
 */
public enum ActionState {
    PARSED(null),
    VALIDATED(null),
    APPROVED(null),
    REJECTED("validation_error"),
    RATE_LIMITED("rate_limited"),
    RISK_DENIED("risk_denied"),
    DENIED("approval_denied"),
    EXECUTED("action_executed"),
    EXECUTION_FAILED("execution_failed");

    private final String auditType;

    ActionState(String auditType) {
        this.auditType = auditType;
    }

    public boolean isTerminal() {
        return auditType != null;
    }

    public String auditType() {
        return auditType;
    }
}
