package com.agentgate.orchestrator.api;

import com.agentgate.orchestrator.agent.ActionExtractor;
import com.agentgate.orchestrator.api.dto.ActionOutcomeResponse;
import com.agentgate.orchestrator.api.dto.CommandRequest;
import com.agentgate.orchestrator.api.dto.ParseRequest;
import com.agentgate.orchestrator.model.ActionState;
import com.agentgate.orchestrator.model.ParseResult;
import com.agentgate.orchestrator.service.ActionOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST API for action extraction and execution.
 *
 * POST /actions/parse    : extract actions from an assistant response, run nothing
 * POST /actions/process  : extract and push every action through the safety pipeline
 * POST /commands         : run one command requested directly by the UI
 *
 * /actions/process and /commands answer asynchronously: the response is written
 * once every action has reached a terminal state, which may include waiting for
 * a user to answer an approval prompt.
 */
@RestController
public class ActionController {

    private final ActionExtractor    extractor;
    private final ActionOrchestrator orchestrator;

    public ActionController(ActionExtractor extractor, ActionOrchestrator orchestrator) {
        this.extractor    = extractor;
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/actions/parse \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"I will create src/app.ts with this code: ..."}'
     */
    @PostMapping("/actions/parse")
    public ParseResult parse(@RequestBody ParseRequest req) {
        requireText(req.text());
        return req.minConfidence() == null
                ? extractor.extract(req.text())
                : extractor.extract(req.text(), req.minConfidence());
    }

    @PostMapping("/actions/process")
    public CompletableFuture<List<ActionOutcomeResponse>> process(@RequestBody ParseRequest req) {
        requireText(req.text());
        return orchestrator.processResponse(req.text())
                .thenApply(outcomes -> outcomes.stream().map(ActionOutcomeResponse::from).toList());
    }

    /**
     * HTTP 200 : the command reached a terminal state (see "state" in the body)
     * HTTP 400 : command missing or blank
     * HTTP 429 : terminal_commands rate limit exceeded; Retry-After is set
     */
    @PostMapping("/commands")
    public CompletableFuture<ResponseEntity<ActionOutcomeResponse>> runCommand(@RequestBody CommandRequest req) {
        if (req.command() == null || req.command().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "command is required");
        }
        return orchestrator.executeCommand(req.command().strip(), req.changeId())
                .thenApply(outcome -> {
                    ActionOutcomeResponse body = ActionOutcomeResponse.from(outcome);
                    if (outcome.state() == ActionState.RATE_LIMITED) {
                        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                                .header(HttpHeaders.RETRY_AFTER, String.valueOf(outcome.retryAfterSeconds()))
                                .body(body);
                    }
                    return ResponseEntity.ok(body);
                });
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text is required");
        }
    }
}
