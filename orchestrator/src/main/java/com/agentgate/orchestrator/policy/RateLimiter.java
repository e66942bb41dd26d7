package com.agentgate.orchestrator.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window rate limiter with one independent counter per category.
 *
 * A window resets once {@code now - windowStart >= window}. Every call counts,
 * including rejected ones, so a caller hammering a closed window does not get
 * extra calls when it reopens. Updates go through
 * {@link ConcurrentHashMap#compute}, which is atomic per key: callers of
 * different categories never contend.
 *
 * Categories without a configured rule share the ceiling of
 * {@link #FALLBACK_CATEGORY} but keep their own counter.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final String FALLBACK_CATEGORY = "api_calls";

    /** Defaults carried over from the editor extension's limiter. */
    public static final Map<String, RateLimitRule> DEFAULT_RULES = defaultRules();

    private final Map<String, RateLimitRule>  rules;
    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiter(Map<String, RateLimitRule> rules, Clock clock) {
        Map<String, RateLimitRule> merged = new LinkedHashMap<>(DEFAULT_RULES);
        merged.putAll(rules);
        this.rules = Map.copyOf(merged);
        this.clock = clock;
    }

    public RateLimitResult checkLimit(String category) {
        RateLimitRule rule = ruleFor(category);
        Instant now = clock.instant();

        RateLimitState state = states.compute(category, (key, current) ->
                current == null ? new RateLimitState(key, now, 1) : current.next(now, rule));

        if (state.count() > rule.maxRequests()) {
            int retryAfter = secondsUntilReset(state, rule, now);
            log.warn("Rate limit exceeded for '{}' ({} calls in window, max {}); retry after {}s",
                    category, state.count(), rule.maxRequests(), retryAfter);
            return new RateLimitResult(false, retryAfter, "Rate limit exceeded", 0);
        }
        return new RateLimitResult(true, 0, "Request allowed", rule.maxRequests() - state.count());
    }

    /** Current counter for a category, without counting a call. */
    public Optional<RateLimitState> getStatus(String category) {
        return Optional.ofNullable(states.get(category));
    }

    public RateLimitRule ruleFor(String category) {
        RateLimitRule rule = rules.get(category);
        return rule != null ? rule : rules.get(FALLBACK_CATEGORY);
    }

    public void reset(String category) {
        states.remove(category);
    }

    public void resetAll() {
        states.clear();
    }

    private static int secondsUntilReset(RateLimitState state, RateLimitRule rule, Instant now) {
        Duration elapsed   = Duration.between(state.windowStart(), now);
        long     remaining = rule.window().minus(elapsed).toMillis();
        return (int) Math.max(1, (remaining + 999) / 1000);
    }

    private static Map<String, RateLimitRule> defaultRules() {
        Map<String, RateLimitRule> defaults = new LinkedHashMap<>();
        defaults.put("api_calls",         RateLimitRule.perMinute(100));
        defaults.put("terminal_commands", RateLimitRule.perMinute(20));
        defaults.put("file_operations",   RateLimitRule.perMinute(50));
        defaults.put("chat_messages",     RateLimitRule.perMinute(200));
        defaults.put("code_completion",   RateLimitRule.perMinute(500));
        return Map.copyOf(defaults);
    }
}
