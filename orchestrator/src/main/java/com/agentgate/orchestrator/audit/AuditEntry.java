package com.agentgate.orchestrator.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One decision record.
 *
 * @param type      "action_executed", "approval_denied", "rate_limited", ...
 * @param timestamp When the decision was taken.
 * @param approved  Whether the operation went ahead.
 * @param details   Unmodifiable copy in insertion order; null values are dropped.
 */
public record AuditEntry(String type, Instant timestamp, boolean approved, Map<String, Object> details) {

    public AuditEntry {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Audit entry type is required");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        details = Collections.unmodifiableMap(copy);
    }

    public Object detail(String key) {
        return details.get(key);
    }
}
