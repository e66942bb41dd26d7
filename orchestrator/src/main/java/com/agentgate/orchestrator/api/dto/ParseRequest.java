package com.agentgate.orchestrator.api.dto;

/**
 * Request body for POST /actions/parse and POST /actions/process.
 *
 * Required: text (the assistant response)
 * Optional: minConfidence, only honoured by /actions/parse; the configured
 *   threshold applies when omitted.
 */
public record ParseRequest(String text, Double minConfidence) {}
