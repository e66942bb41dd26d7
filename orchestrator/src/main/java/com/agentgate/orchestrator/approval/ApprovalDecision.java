package com.agentgate.orchestrator.approval;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an approval request. A timeout or shutdown looks exactly like
 * a denial except for {@link #reason()}.
 */
public record ApprovalDecision(boolean approved, boolean alwaysAllow, Reason reason) {

    public enum Reason {
        APPROVED, DENIED, TIMEOUT, CANCELLED;

        @JsonValue
        public String label() {
            return name().toLowerCase();
        }
    }

    public static ApprovalDecision approved(boolean alwaysAllow) {
        return new ApprovalDecision(true, alwaysAllow, Reason.APPROVED);
    }

    public static ApprovalDecision denied() {
        return new ApprovalDecision(false, false, Reason.DENIED);
    }

    public static ApprovalDecision timedOut() {
        return new ApprovalDecision(false, false, Reason.TIMEOUT);
    }

    public static ApprovalDecision cancelled() {
        return new ApprovalDecision(false, false, Reason.CANCELLED);
    }
}
