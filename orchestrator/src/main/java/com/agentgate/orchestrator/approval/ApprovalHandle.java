package com.agentgate.orchestrator.approval;

import java.util.concurrent.CompletableFuture;

/**
 * Returned immediately by {@link ApprovalCoordinator#requestApproval}; the
 * decision completes later, on whichever thread resolves or times out the prompt.
 */
public record ApprovalHandle(String promptId, CompletableFuture<ApprovalDecision> decision) {}
