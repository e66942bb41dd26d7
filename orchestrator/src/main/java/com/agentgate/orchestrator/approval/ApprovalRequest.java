package com.agentgate.orchestrator.approval;

import com.agentgate.orchestrator.model.RiskLevel;

import java.time.Instant;

/**
 * A question put to the user, owned by {@link ApprovalCoordinator} while pending.
 *
 * @param id           Correlation id echoed back with the decision.
 * @param operation    "runCommand", "createFile", ...
 * @param target       The command text or file path being approved.
 * @param details      Free-text explanation shown with the prompt.
 * @param riskLevel    Classification of {@code target}.
 * @param allowListKey Exact string stored when the user picks "always allow".
 * @param createdAt    When the prompt was raised.
 */
public record ApprovalRequest(
        String    id,
        String    operation,
        String    target,
        String    details,
        RiskLevel riskLevel,
        String    allowListKey,
        Instant   createdAt) {}
