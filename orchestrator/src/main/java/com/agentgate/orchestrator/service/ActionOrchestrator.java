package com.agentgate.orchestrator.service;

import com.agentgate.orchestrator.agent.ActionExtractor;
import com.agentgate.orchestrator.agent.ActionValidator;
import com.agentgate.orchestrator.approval.ApprovalCoordinator;
import com.agentgate.orchestrator.approval.ApprovalDecision;
import com.agentgate.orchestrator.approval.ApprovalHandle;
import com.agentgate.orchestrator.audit.AuditEntry;
import com.agentgate.orchestrator.audit.AuditLog;
import com.agentgate.orchestrator.executor.ActionExecutor;
import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.ActionOutcome;
import com.agentgate.orchestrator.model.ActionState;
import com.agentgate.orchestrator.model.ParseResult;
import com.agentgate.orchestrator.model.ParsedAction;
import com.agentgate.orchestrator.model.RiskLevel;
import com.agentgate.orchestrator.policy.AllowListStore;
import com.agentgate.orchestrator.policy.RateLimitResult;
import com.agentgate.orchestrator.policy.RateLimiter;
import com.agentgate.orchestrator.policy.RiskAssessment;
import com.agentgate.orchestrator.policy.RiskClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives each action through the safety pipeline.
 *
 * Per action:
 *   1. validate        → REJECTED on a bad path / blocked command
 *   2. rate limit      → RATE_LIMITED (with retryAfterSeconds)
 *   3. classify risk   (command text, or "create file src/a.ts" for file actions)
 *   4. gate            → needs approval when risk reaches the threshold or the
 *                        type is always-prompt, unless the exact key is allow-listed
 *   5. approval        → RISK_DENIED when approvals are off; DENIED on "no" or timeout
 *   6. execute         → EXECUTED / EXECUTION_FAILED on the worker pool
 *
 * Every terminal state appends exactly one audit entry. Nothing here blocks
 * the caller: approvals and executor calls complete the returned future later.
 */
@Service
public class ActionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ActionOrchestrator.class);

    private final ActionExtractor     extractor;
    private final ActionValidator     validator;
    private final RateLimiter         rateLimiter;
    private final RiskClassifier      classifier;
    private final ApprovalCoordinator approvals;
    private final AllowListStore      allowList;
    private final AuditLog            auditLog;
    private final ActionExecutor      executor;
    private final AutoExecutionGate   gate;
    private final Executor            workers;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;

    public ActionOrchestrator(ActionExtractor extractor,
                              ActionValidator validator,
                              RateLimiter rateLimiter,
                              RiskClassifier classifier,
                              ApprovalCoordinator approvals,
                              AllowListStore allowList,
                              AuditLog auditLog,
                              ActionExecutor executor,
                              AutoExecutionGate gate,
                              @Qualifier("actionWorkers") Executor workers,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.extractor     = extractor;
        this.validator     = validator;
        this.rateLimiter   = rateLimiter;
        this.classifier    = classifier;
        this.approvals     = approvals;
        this.allowList     = allowList;
        this.auditLog      = auditLog;
        this.executor      = executor;
        this.gate          = gate;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Extract actions from an assistant response and process them. Completes
     * with an empty list when response parsing is switched off.
     */
    public CompletableFuture<List<ActionOutcome>> processResponse(String text) {
        if (!gate.parsingEnabled()) {
            log.debug("AI response parsing disabled, ignoring {} chars", text == null ? 0 : text.length());
            return CompletableFuture.completedFuture(List.of());
        }
        return process(extractor.extract(text));
    }

    /**
     * Process actions one after another in source order. A failure in one
     * action becomes that action's outcome; the rest still run.
     */
    public CompletableFuture<List<ActionOutcome>> process(ParseResult result) {
        CompletableFuture<List<ActionOutcome>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (ParsedAction action : result.actions()) {
            chain = chain.thenCompose(outcomes -> dispatch(action)
                    .exceptionally(ex -> unexpectedFailure(action, ex))
                    .thenApply(outcome -> {
                        outcomes.add(outcome);
                        return outcomes;
                    }));
        }
        return chain.thenApply(List::copyOf);
    }

    public CompletableFuture<ActionOutcome> dispatch(ParsedAction action) {
        return dispatch(action, null);
    }

    /**
     * A command requested directly by the UI, bypassing extraction.
     * {@code changeId} is carried into the audit record.
     */
    public CompletableFuture<ActionOutcome> executeCommand(String command, String changeId) {
        return dispatch(ParsedAction.runCommand(command, 1.0), changeId);
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private CompletableFuture<ActionOutcome> dispatch(ParsedAction action, String changeId) {
        ActionContext ctx = new ActionContext("action-" + UUID.randomUUID(), action, changeId,
                Timer.start(meterRegistry));
        try {
            return admit(ctx);
        } catch (RuntimeException e) {
            log.error("Action {} failed before execution", ctx.actionId(), e);
            return CompletableFuture.completedFuture(
                    finish(ctx, ActionState.EXECUTION_FAILED, null, e.getMessage(), null, 0, null));
        }
    }

    private CompletableFuture<ActionOutcome> admit(ActionContext ctx) {
        ParsedAction action = ctx.action();

        // PARSED → VALIDATED
        Optional<String> rejection = validator.check(action);
        if (rejection.isPresent()) {
            return done(finish(ctx, ActionState.REJECTED, null, rejection.get(), null, 0, null));
        }

        RateLimitResult limit = rateLimiter.checkLimit(action.type().rateLimitCategory());
        if (!limit.allowed()) {
            return done(finish(ctx, ActionState.RATE_LIMITED, null, limit.reason(), null,
                    limit.retryAfterSeconds(), null));
        }

        RiskAssessment risk = classifier.classify(riskSubject(action));
        String key = allowListKey(action);
        boolean gated = gate.requiresApproval(action.type(), risk.level()) && !allowList.isAllowed(key);

        if (!gated) {
            log.debug("Action {} ({}) runs without prompt, risk={}",
                    ctx.actionId(), action.description(), risk.level().wireName());
            return execute(ctx, risk.level(), null);
        }
        if (!gate.approvalsEnabled()) {
            return done(finish(ctx, ActionState.RISK_DENIED, risk.level(),
                    "Approval required but approvals are disabled", null, 0, null));
        }

        String target = action.type().touchesFile() ? action.filePath() : action.command();
        ApprovalHandle handle = approvals.requestApproval(
                action.type().wireName(), target, risk.rationale(), risk.level(), key);

        return handle.decision().thenCompose(decision -> {
            if (decision.approved()) {
                return execute(ctx, risk.level(), handle.promptId());
            }
            return done(finish(ctx, ActionState.DENIED, risk.level(),
                    reasonLabel(decision), handle.promptId(), 0, null));
        });
    }

    private CompletableFuture<ActionOutcome> execute(ActionContext ctx, RiskLevel risk, String promptId) {
        return CompletableFuture.supplyAsync(() -> runOnExecutor(ctx, risk, promptId), workers);
    }

    private ActionOutcome runOnExecutor(ActionContext ctx, RiskLevel risk, String promptId) {
        ParsedAction action = ctx.action();
        MDC.put("actionId",   ctx.actionId());
        MDC.put("actionType", action.type().wireName());
        try {
            ExecutionResult result = switch (action.type()) {
                case CREATE_FILE  -> executor.createFile(action.filePath(), action.content());
                case MODIFY_FILE  -> executor.modifyFile(action.filePath(), action.content(), action.lineRange());
                case RUN_COMMAND  -> executor.runCommand(action.command());
                case OPEN_FILE    -> executor.openFile(action.filePath());
                case ANALYZE_FILE -> executor.analyzeFile(action.filePath());
            };
            if (result == null) {
                return finish(ctx, ActionState.EXECUTION_FAILED, risk, "Executor returned no result", promptId, 0, null);
            }
            if (!result.success()) {
                return finish(ctx, ActionState.EXECUTION_FAILED, risk, result.failureSummary(), promptId, 0, result);
            }
            return finish(ctx, ActionState.EXECUTED, risk, "ok", promptId, 0, result);
        } catch (RuntimeException e) {
            log.error("Executor failed for {}", action.description(), e);
            return finish(ctx, ActionState.EXECUTION_FAILED, risk, e.getMessage(), promptId, 0, null);
        } finally {
            MDC.remove("actionId");
            MDC.remove("actionType");
        }
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    /** Build the outcome, append its one audit entry and record metrics. */
    private ActionOutcome finish(ActionContext ctx, ActionState state, RiskLevel risk, String reason,
                                 String promptId, int retryAfterSeconds, ExecutionResult result) {
        ParsedAction action = ctx.action();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actionId",   ctx.actionId());
        details.put("actionType", action.type().wireName());
        details.put("filePath",   action.filePath());
        details.put("command",    action.command());
        details.put("changeId",   ctx.changeId());
        details.put("riskLevel",  risk == null ? null : risk.wireName());
        details.put("reason",     reason);
        details.put("promptId",   promptId);
        details.put("confidence", action.confidence());
        if (retryAfterSeconds > 0) {
            details.put("retryAfterSeconds", retryAfterSeconds);
        }
        if (state == ActionState.EXECUTION_FAILED) {
            details.put("error", reason);
        }

        boolean wentAhead = state == ActionState.EXECUTED || state == ActionState.EXECUTION_FAILED;
        auditLog.append(new AuditEntry(state.auditType(), clock.instant(), wentAhead, details));

        String typeTag = action.type().wireName();
        meterRegistry.counter("agentgate.action.outcomes", "type", typeTag, "state", state.name().toLowerCase())
                .increment();
        ctx.sample().stop(meterRegistry.timer("agentgate.action.duration", "type", typeTag));

        if (state == ActionState.EXECUTED) {
            log.info("Action {} {}: {}", ctx.actionId(), state, action.description());
        } else {
            log.warn("Action {} {}: {} ({})", ctx.actionId(), state, action.description(), reason);
        }
        return new ActionOutcome(ctx.actionId(), action, state, risk, reason, promptId, retryAfterSeconds, result);
    }

    private ActionOutcome unexpectedFailure(ParsedAction action, Throwable ex) {
        log.error("Unexpected failure processing {}", action.description(), ex);
        ActionContext ctx = new ActionContext("action-" + UUID.randomUUID(), action, null, Timer.start(meterRegistry));
        return finish(ctx, ActionState.EXECUTION_FAILED, null, String.valueOf(ex.getMessage()), null, 0, null);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** What the classifier reads: the command itself, or an operation description. */
    static String riskSubject(ParsedAction action) {
        return switch (action.type()) {
            case RUN_COMMAND  -> action.command();
            case CREATE_FILE  -> "create file " + action.filePath();
            case MODIFY_FILE  -> "modify file " + action.filePath();
            case OPEN_FILE    -> "open file " + action.filePath();
            case ANALYZE_FILE -> "analyze file " + action.filePath();
        };
    }

    /** The exact string an "always allow" decision exempts. */
    static String allowListKey(ParsedAction action) {
        return action.type().touchesFile()
                ? action.type().wireName() + ":" + action.filePath()
                : action.command();
    }

    private static String reasonLabel(ApprovalDecision decision) {
        return decision.reason().label();
    }

    private static CompletableFuture<ActionOutcome> done(ActionOutcome outcome) {
        return CompletableFuture.completedFuture(outcome);
    }

    private record ActionContext(String actionId, ParsedAction action, String changeId, Timer.Sample sample) {}
}
