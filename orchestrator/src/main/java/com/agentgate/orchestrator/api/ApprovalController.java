package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.api.dto.ApprovalDecisionRequest;
import com.agentgate.orchestrator.api.dto.ResolveResponse;
import com.agentgate.orchestrator.approval.ApprovalCoordinator;
import com.agentgate.orchestrator.approval.ApprovalRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Approval prompts, seen from the UI.
 *
 * GET  /approvals             : prompts still waiting for an answer
 * POST /approvals/{promptId}  : answer one: {"approved": true, "alwaysAllow": false}
 * GET  /approvals/stream      : SSE feed of securityPrompt / hideSecurityPrompt events
 */
@RestController
@RequestMapping("/approvals")
public class ApprovalController {

    private final ApprovalCoordinator coordinator;
    private final PromptStreamService streams;

    public ApprovalController(ApprovalCoordinator coordinator, PromptStreamService streams) {
        this.coordinator = coordinator;
        this.streams     = streams;
    }

    @GetMapping
    public List<ApprovalRequest> pending() {
        return coordinator.pendingRequests();
    }

    /**
     * Always 200 once the body is valid; "resolved": false tells the UI the
     * prompt had already been answered or had timed out.
     */
    @PostMapping("/{promptId}")
    public ResolveResponse resolve(@PathVariable String promptId, @RequestBody ApprovalDecisionRequest req) {
        if (req.approved() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "approved is required");
        }
        boolean resolved = coordinator.resolveApproval(promptId, req.approved(), req.alwaysAllow());
        return new ResolveResponse(promptId, resolved);
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return streams.createEmitter();
    }
}
