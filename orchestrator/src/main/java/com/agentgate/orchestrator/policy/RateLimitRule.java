package com.agentgate.orchestrator.policy;

import java.time.Duration;

/**
 * Ceiling for one rate-limit category: at most {@code maxRequests} calls per
 * fixed {@code window}.
 */
public record RateLimitRule(int maxRequests, Duration window) {

    public RateLimitRule {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RateLimitRule perMinute(int maxRequests) {
        return new RateLimitRule(maxRequests, Duration.ofMinutes(1));
    }
}
