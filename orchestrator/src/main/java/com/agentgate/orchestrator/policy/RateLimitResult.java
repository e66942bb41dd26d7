package com.agentgate.orchestrator.policy;

/**
 * @param allowed           Whether the call fits in the current window.
 * @param retryAfterSeconds Seconds until the window resets; 0 when allowed.
 * @param reason            "Request allowed" / "Rate limit exceeded".
 * @param remaining         Calls left in the current window.
 */
public record RateLimitResult(boolean allowed, int retryAfterSeconds, String reason, int remaining) {}
