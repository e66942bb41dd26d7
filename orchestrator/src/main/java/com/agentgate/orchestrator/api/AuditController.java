package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.audit.AuditEntry;
import com.agentgate.orchestrator.audit.AuditLog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /audit            : every retained audit entry, oldest first
 * GET /audit?type=...   : only entries of one type, e.g. approval_denied
 */
@RestController
@RequestMapping("/audit")
public class AuditController {

    private final AuditLog auditLog;

    public AuditController(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @GetMapping
    public List<AuditEntry> entries(@RequestParam(required = false) String type) {
        List<AuditEntry> entries = auditLog.entries();
        if (type == null || type.isBlank()) {
            return entries;
        }
        return entries.stream().filter(e -> e.type().equals(type)).toList();
    }
}
