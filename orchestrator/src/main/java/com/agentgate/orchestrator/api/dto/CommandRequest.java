package com.agentgate.orchestrator.api.dto;

/**
 * Request body for POST /commands: a terminal command the UI wants to run.
 * changeId is optional and only recorded in the audit trail.
 */
public record CommandRequest(String command, String changeId) {}
