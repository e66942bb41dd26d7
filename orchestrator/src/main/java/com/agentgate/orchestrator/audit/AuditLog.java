package com.agentgate.orchestrator.audit;

import java.util.List;

/**
 * Append-only sink of security decisions. Implementations must accept
 * concurrent appends.
 */
public interface AuditLog {

    void append(AuditEntry entry);

    /** Snapshot in append order. */
    List<AuditEntry> entries();

    int size();
}
