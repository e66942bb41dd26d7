package com.agentgate.orchestrator.approval;

/**
 * Outbound channel to whatever renders approval prompts.
 */
@FunctionalInterface
public interface PromptPublisher {

    void publish(PromptEvent event);
}
