package com.agentgate.orchestrator.approval;

import com.agentgate.orchestrator.model.RiskLevel;
import com.agentgate.orchestrator.policy.AllowListStore;
import com.agentgate.orchestrator.policy.RiskClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Tracks outstanding human approvals by correlation id.
 *
 * Lifecycle of a prompt:
 *   requestApproval  → entry stored, "securityPrompt" published, timeout scheduled,
 *                      handle returned without blocking
 *   resolveApproval  → entry removed, timer cancelled, "hideSecurityPrompt" published,
 *                      future completed with the user's decision
 *   timeout          → same, completed as a denial with reason TIMEOUT
 *
 * The resolver and the timer race on {@code pending.remove(id)}; the atomic
 * remove lets exactly one of them through and the other becomes a no-op.
 * There is no global lock: unrelated prompts never wait on each other.
 */
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ConcurrentHashMap<String, Pending> pending = new ConcurrentHashMap<>();

    private final PromptPublisher          publisher;
    private final AllowListStore           allowList;
    private final RiskClassifier           classifier;
    private final Duration                 timeout;
    private final Clock                    clock;
    private final ScheduledExecutorService timer;

    public ApprovalCoordinator(PromptPublisher publisher, AllowListStore allowList,
                               RiskClassifier classifier, Duration timeout, Clock clock) {
        this(publisher, allowList, classifier, timeout, clock, newTimeoutScheduler());
    }

    ApprovalCoordinator(PromptPublisher publisher, AllowListStore allowList, RiskClassifier classifier,
                        Duration timeout, Clock clock, ScheduledExecutorService timer) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Approval timeout must be positive: " + timeout);
        }
        this.publisher  = publisher;
        this.allowList  = allowList;
        this.classifier = classifier;
        this.timeout    = timeout;
        this.clock      = clock;
        this.timer      = timer;
    }

    /** Single daemon thread; a cancelled timeout leaves the queue at once. */
    static ScheduledThreadPoolExecutor newTimeoutScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "approval-timeout");
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    // ------------------------------------------------------------------
    // Request
    // ------------------------------------------------------------------

    /**
     * Classifies {@code target} itself and uses it verbatim as the
     * allow-list key.
     */
    public ApprovalHandle requestApproval(String operation, String target, String details) {
        return requestApproval(operation, target, details, classifier.classify(target).level(), target);
    }

    public ApprovalHandle requestApproval(String operation, String target, String details,
                                          RiskLevel riskLevel, String allowListKey) {
        Objects.requireNonNull(riskLevel, "riskLevel");

        String id = "prompt-" + UUID.randomUUID();
        ApprovalRequest request = new ApprovalRequest(
                id, operation, target, details, riskLevel, allowListKey, clock.instant());
        Pending entry = new Pending(request);
        if (pending.putIfAbsent(id, entry) != null) {
            throw new IllegalStateException("Duplicate prompt id " + id);
        }

        log.info("Approval requested: {} {} '{}' (risk={})", id, operation, target, riskLevel.wireName());
        publisher.publish(PromptEvent.prompt(request, clock.instant()));

        try {
            entry.timer = timer.schedule(() -> expire(id), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Timeout scheduler is shut down, cancelling {}", id);
            finish(id, ApprovalDecision.cancelled());
        }
        return new ApprovalHandle(id, entry.future);
    }

    // ------------------------------------------------------------------
    // Resolve
    // ------------------------------------------------------------------

    /**
     * Applies a user decision. Returns false, without throwing, when the id
     * is unknown, already resolved or already timed out.
     */
    public boolean resolveApproval(String promptId, boolean approved, boolean alwaysAllow) {
        Pending entry = promptId == null ? null : pending.remove(promptId);
        if (entry == null) {
            log.warn("No pending approval for '{}' (unknown, already resolved or timed out)", promptId);
            return false;
        }
        cancelTimer(entry);

        ApprovalRequest request = entry.request;
        if (approved && alwaysAllow) {
            allowList.allow(request.allowListKey());
        }
        log.info("Approval {} {}{}", promptId, approved ? "granted" : "denied",
                approved && alwaysAllow ? " (always allow)" : "");

        publisher.publish(PromptEvent.hide(promptId, clock.instant()));
        entry.future.complete(approved ? ApprovalDecision.approved(alwaysAllow) : ApprovalDecision.denied());
        return true;
    }

    private void expire(String promptId) {
        if (finish(promptId, ApprovalDecision.timedOut())) {
            log.warn("Approval {} timed out after {}s", promptId, timeout.toSeconds());
        }
    }

    /** Denies every pending prompt with reason CANCELLED. */
    public int cancelAll() {
        int cancelled = 0;
        for (String id : List.copyOf(pending.keySet())) {
            if (finish(id, ApprovalDecision.cancelled())) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending approval(s)", cancelled);
        }
        return cancelled;
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        timer.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Pending requests, oldest first. */
    public List<ApprovalRequest> pendingRequests() {
        return pending.values().stream()
                .map(p -> p.request)
                .sorted(Comparator.comparing(ApprovalRequest::createdAt))
                .toList();
    }

    public int pendingCount() {
        return pending.size();
    }

    public Duration timeout() {
        return timeout;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private boolean finish(String promptId, ApprovalDecision decision) {
        Pending entry = pending.remove(promptId);
        if (entry == null) {
            return false;
        }
        cancelTimer(entry);
        publisher.publish(PromptEvent.hide(promptId, clock.instant()));
        entry.future.complete(decision);
        return true;
    }

    private static void cancelTimer(Pending entry) {
        ScheduledFuture<?> scheduled = entry.timer;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }

    private static final class Pending {
        final ApprovalRequest                     request;
        final CompletableFuture<ApprovalDecision> future = new CompletableFuture<>();
        volatile ScheduledFuture<?>               timer;

        Pending(ApprovalRequest request) {
            this.request = request;
        }
    }
}
