package com.agentgate.orchestrator.policy;

import com.agentgate.orchestrator.model.RiskLevel;

import java.util.List;

/**
 * @param level     Highest tier whose keywords matched.
 * @param rationale Human-readable explanation shown in the approval prompt.
 * @param matched   Keywords of that tier found in the input, in configuration order.
 */
public record RiskAssessment(RiskLevel level, String rationale, List<String> matched) {

    public RiskAssessment {
        matched = List.copyOf(matched);
    }
}
