package com.agentgate.orchestrator.policy;

import java.time.Instant;

/**
 * Counter for one category's current window. Immutable; the limiter swaps
 * in a new instance on every call.
 */
public record RateLimitState(String category, Instant windowStart, int count) {

    RateLimitState next(Instant now, RateLimitRule rule) {
        if (!now.isBefore(windowStart.plus(rule.window()))) {
            return new RateLimitState(category, now, 1);
        }
        return new RateLimitState(category, windowStart, count + 1);
    }
}
