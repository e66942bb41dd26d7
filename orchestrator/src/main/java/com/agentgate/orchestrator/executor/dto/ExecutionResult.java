package com.agentgate.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response body returned by every executor endpoint.
 * Field names follow the executor service's snake_case JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionResult(
        int exit_code,
        String stdout,
        String stderr,
        double elapsed_sec,
        String error_type    // "TIMEOUT" | "NOT_FOUND" | "IO_ERROR" | null
) {
    public static ExecutionResult ok(String stdout) {
        return new ExecutionResult(0, stdout, "", 0.0, null);
    }

    public boolean success() {
        return exit_code == 0 && error_type == null;
    }

    /** One-line failure description for outcomes and audit details. */
    public String failureSummary() {
        StringBuilder sb = new StringBuilder("exit_code ").append(exit_code);
        if (error_type != null) {
            sb.append(" (").append(error_type).append(')');
        }
        if (stderr != null && !stderr.isBlank()) {
            sb.append(": ").append(stderr.strip());
        }
        return sb.toString();
    }
}
