package com.agentgate.orchestrator.config;

import com.agentgate.orchestrator.agent.ActionExtractor;
import com.agentgate.orchestrator.agent.ActionValidator;
import com.agentgate.orchestrator.approval.ApprovalCoordinator;
import com.agentgate.orchestrator.approval.PromptEventBus;
import com.agentgate.orchestrator.audit.AuditLog;
import com.agentgate.orchestrator.audit.InMemoryAuditLog;
import com.agentgate.orchestrator.executor.ActionExecutor;
import com.agentgate.orchestrator.executor.ExecutorClient;
import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.policy.AllowListStore;
import com.agentgate.orchestrator.policy.InMemoryAllowListStore;
import com.agentgate.orchestrator.policy.RateLimitRule;
import com.agentgate.orchestrator.policy.RateLimiter;
import com.agentgate.orchestrator.policy.RiskClassifier;
import com.agentgate.orchestrator.service.AutoExecutionGate;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the security pipeline from {@link GuardProperties}. Every component
 * gets its configuration through its constructor; none of them reads
 * settings on its own.
 */
@Configuration
@EnableConfigurationProperties(GuardProperties.class)
public class GuardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ActionValidator actionValidator(GuardProperties props) {
        GuardProperties.Extraction ex = props.getExtraction();
        return new ActionValidator(ex.getMaxPathLength(), ex.getMaxCommandLength(),
                ex.getDangerousCommandPatterns(), ex.getForbiddenPathPrefixes());
    }

    @Bean
    public ActionExtractor actionExtractor(ActionValidator validator, GuardProperties props) {
        return new ActionExtractor(validator, props.getExtraction().getMinConfidence());
    }

    @Bean
    public RiskClassifier riskClassifier(GuardProperties props) {
        return new RiskClassifier(props.getRisk().getHighKeywords(), props.getRisk().getMediumKeywords());
    }

    @Bean
    public RateLimiter rateLimiter(GuardProperties props, Clock clock) {
        Map<String, RateLimitRule> rules = new LinkedHashMap<>();
        props.getRateLimits().forEach((category, limit) ->
                rules.put(category, new RateLimitRule(limit.getMaxRequests(), limit.getWindow())));
        return new RateLimiter(rules, clock);
    }

    @Bean
    public AllowListStore allowListStore() {
        return new InMemoryAllowListStore();
    }

    @Bean
    public AuditLog auditLog(GuardProperties props) {
        return new InMemoryAuditLog(props.getAudit().getMaxEntries());
    }

    @Bean
    public PromptEventBus promptEventBus() {
        return new PromptEventBus();
    }

    @Bean
    public ApprovalCoordinator approvalCoordinator(PromptEventBus bus, AllowListStore allowList,
                                                   RiskClassifier classifier, GuardProperties props,
                                                   Clock clock, MeterRegistry meterRegistry) {
        ApprovalCoordinator coordinator = new ApprovalCoordinator(
                bus, allowList, classifier, props.getApproval().getTimeout(), clock);
        Gauge.builder("agentgate.approvals.pending", coordinator, ApprovalCoordinator::pendingCount)
                .description("Approval prompts waiting for a user decision")
                .register(meterRegistry);
        return coordinator;
    }

    @Bean
    public AutoExecutionGate autoExecutionGate(GuardProperties props) {
        GuardProperties.Approval approval = props.getApproval();
        return new AutoExecutionGate(
                props.getExtraction().isAiResponseParsing(),
                approval.isEnabled(),
                approval.getThreshold(),
                approval.getAlwaysPromptFor().isEmpty()
                        ? EnumSet.noneOf(ActionType.class)
                        : EnumSet.copyOf(approval.getAlwaysPromptFor()));
    }

    @Bean
    public ActionExecutor actionExecutor(GuardProperties props, ObjectMapper objectMapper) {
        return new ExecutorClient(props.getExecutor().getBaseUrl(),
                props.getExecutor().getCommandTimeout(), objectMapper);
    }

    /**
     * Bounded pool for executor calls, so a burst of approved actions
     * cannot open unbounded connections to the executor service.
     */
    @Bean(name = "actionWorkers", destroyMethod = "shutdown")
    public ExecutorService actionWorkers(GuardProperties props) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.getWorkers()), r -> {
            Thread t = new Thread(r, "action-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
