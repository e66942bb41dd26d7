package com.agentgate.orchestrator.approval;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound UI event.
 *
 * @param eventType {@link #SECURITY_PROMPT} or {@link #HIDE_SECURITY_PROMPT}
 * @param promptId  Correlation id of the approval request.
 * @param payload   Event data forwarded to the client as-is.
 * @param timestamp When the event was raised.
 */
public record PromptEvent(String eventType, String promptId, Map<String, Object> payload, Instant timestamp) {

    public static final String SECURITY_PROMPT      = "securityPrompt";
    public static final String HIDE_SECURITY_PROMPT = "hideSecurityPrompt";

    public PromptEvent {
        payload = Map.copyOf(payload);
    }

    static PromptEvent prompt(ApprovalRequest request, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("promptId",  request.id());
        payload.put("operation", request.operation());
        payload.put("target",    request.target());
        payload.put("riskLevel", request.riskLevel().wireName());
        payload.put("details",   request.details() == null ? "" : request.details());
        return new PromptEvent(SECURITY_PROMPT, request.id(), payload, now);
    }

    static PromptEvent hide(String promptId, Instant now) {
        return new PromptEvent(HIDE_SECURITY_PROMPT, promptId, Map.of("promptId", promptId), now);
    }
}
