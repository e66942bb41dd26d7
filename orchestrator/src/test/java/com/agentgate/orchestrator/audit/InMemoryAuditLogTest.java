package com.agentgate.orchestrator.audit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAuditLogTest {

    @Test
    void append_keepsInsertionOrder() {
        InMemoryAuditLog log = new InMemoryAuditLog();

        log.append(entry("action_executed", 1));
        log.append(entry("approval_denied", 2));

        assertThat(log.entries()).extracting(AuditEntry::type)
                .containsExactly("action_executed", "approval_denied");
        assertThat(log.size()).isEqualTo(2);
    }

    @Test
    void entry_dropsNullDetailsAndIsImmutable() {
        Map<String, Object> details = new HashMap<>();
        details.put("command", "npm test");
        details.put("filePath", null);

        AuditEntry entry = new AuditEntry("action_executed", Instant.now(), true, details);
        details.put("command", "changed");

        assertThat(entry.details()).containsOnlyKeys("command");
        assertThat(entry.detail("command")).isEqualTo("npm test");
        assertThatThrownBy(() -> entry.details().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void entry_keepsDetailInsertionOrder() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actionId", "action-1");
        details.put("command", "npm test");
        details.put("reason", "ok");
        details.put("changeId", "chg-1");

        AuditEntry entry = new AuditEntry("action_executed", Instant.now(), true, details);

        assertThat(entry.details().keySet()).containsExactly("actionId", "command", "reason", "changeId");
    }

    @Test
    void entry_requiresType() {
        assertThatThrownBy(() -> new AuditEntry(" ", Instant.now(), false, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void append_beyondCapacity_evictsOldest() {
        InMemoryAuditLog log = new InMemoryAuditLog(3);

        for (int i = 1; i <= 5; i++) {
            log.append(entry("action_executed", i));
        }

        assertThat(log.size()).isEqualTo(3);
        assertThat(log.entries()).extracting(e -> e.detail("seq")).containsExactly(3, 4, 5);
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryAuditLog(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void append_concurrentWriters_loseNothing() throws Exception {
        InMemoryAuditLog log = new InMemoryAuditLog();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            IntStream.range(0, 400).forEach(i -> pool.submit(() -> log.append(entry("action_executed", i))));
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(log.size()).isEqualTo(400);
        assertThat(log.entries()).hasSize(400);
    }

    private static AuditEntry entry(String type, int seq) {
        return new AuditEntry(type, Instant.now(), true, Map.of("seq", seq));
    }
}
