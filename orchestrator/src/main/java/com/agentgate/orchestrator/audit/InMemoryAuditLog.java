package com.agentgate.orchestrator.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free in-memory audit sink, bounded to the most recent
 * {@code maxEntries} records. Every entry is also written to the
 * {@code AUDIT} logger, which outlives the in-memory window.
 */
public class InMemoryAuditLog implements AuditLog {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final Queue<AuditEntry> entries = new ConcurrentLinkedQueue<>();
    private final AtomicInteger     count   = new AtomicInteger();
    private final int               maxEntries;

    public InMemoryAuditLog() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public InMemoryAuditLog(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public void append(AuditEntry entry) {
        entries.add(entry);
        audit.info("{} approved={} {}", entry.type(), entry.approved(), entry.details());

        if (count.incrementAndGet() > maxEntries && entries.poll() != null) {
            count.decrementAndGet();
        }
    }

    @Override
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public int size() {
        return Math.min(count.get(), maxEntries);
    }
}
