package com.agentgate.orchestrator.model;

/**
 * Inclusive, 1-based line span targeted by a modifyFile action.
 */
public record LineRange(int start, int end) {

    public LineRange {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("Invalid line range " + start + "-" + end);
        }
    }
}
