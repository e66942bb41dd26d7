package com.agentgate.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier of a command or operation. Declaration order is severity order,
 * so {@code compareTo} can be used against an approval threshold.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean atLeast(RiskLevel threshold) {
        return compareTo(threshold) >= 0;
    }
}
