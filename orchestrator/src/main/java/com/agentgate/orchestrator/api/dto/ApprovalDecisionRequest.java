package com.agentgate.orchestrator.api.dto;

/**
 * Request body for POST /approvals/{promptId}.
 */
public record ApprovalDecisionRequest(Boolean approved, boolean alwaysAllow) {}
