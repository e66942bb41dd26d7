package com.agentgate.orchestrator.api.dto;

/**
 * resolved=false means the prompt was unknown, already answered or timed out.
 */
public record ResolveResponse(String promptId, boolean resolved) {}
