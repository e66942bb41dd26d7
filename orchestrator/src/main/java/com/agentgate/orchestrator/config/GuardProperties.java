package com.agentgate.orchestrator.config;

import com.agentgate.orchestrator.agent.ActionExtractor;
import com.agentgate.orchestrator.agent.ActionValidator;
import com.agentgate.orchestrator.approval.ApprovalCoordinator;
import com.agentgate.orchestrator.audit.InMemoryAuditLog;
import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.model.RiskLevel;
import com.agentgate.orchestrator.policy.RiskClassifier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code agentgate.*} in application.yml.
 * Defaults match the values the components fall back to on their own.
 */
@ConfigurationProperties(prefix = "agentgate")
public class GuardProperties {

    private Extraction extraction = new Extraction();
    private Risk risk = new Risk();
    private Approval approval = new Approval();
    private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();
    private Executor executor = new Executor();
    private Audit audit = new Audit();
    private int workers = 4;

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Risk getRisk() {
        return risk;
    }

    public void setRisk(Risk risk) {
        this.risk = risk;
    }

    public Approval getApproval() {
        return approval;
    }

    public void setApproval(Approval approval) {
        this.approval = approval;
    }

    public Map<String, RateLimit> getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(Map<String, RateLimit> rateLimits) {
        this.rateLimits = rateLimits;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public static class Extraction {
        private double minConfidence = ActionExtractor.DEFAULT_MIN_CONFIDENCE;
        private boolean aiResponseParsing = true;
        private int maxPathLength = ActionValidator.DEFAULT_MAX_PATH_LENGTH;
        private int maxCommandLength = ActionValidator.DEFAULT_MAX_COMMAND_LENGTH;
        private List<String> dangerousCommandPatterns =
                new ArrayList<>(ActionValidator.DEFAULT_DANGEROUS_COMMAND_PATTERNS);
        private List<String> forbiddenPathPrefixes =
                new ArrayList<>(ActionValidator.DEFAULT_FORBIDDEN_PATH_PREFIXES);

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public boolean isAiResponseParsing() {
            return aiResponseParsing;
        }

        public void setAiResponseParsing(boolean aiResponseParsing) {
            this.aiResponseParsing = aiResponseParsing;
        }

        public int getMaxPathLength() {
            return maxPathLength;
        }

        public void setMaxPathLength(int maxPathLength) {
            this.maxPathLength = maxPathLength;
        }

        public int getMaxCommandLength() {
            return maxCommandLength;
        }

        public void setMaxCommandLength(int maxCommandLength) {
            this.maxCommandLength = maxCommandLength;
        }

        public List<String> getDangerousCommandPatterns() {
            return dangerousCommandPatterns;
        }

        public void setDangerousCommandPatterns(List<String> dangerousCommandPatterns) {
            this.dangerousCommandPatterns = dangerousCommandPatterns;
        }

        public List<String> getForbiddenPathPrefixes() {
            return forbiddenPathPrefixes;
        }

        public void setForbiddenPathPrefixes(List<String> forbiddenPathPrefixes) {
            this.forbiddenPathPrefixes = forbiddenPathPrefixes;
        }
    }

    public static class Risk {
        private List<String> highKeywords = new ArrayList<>(RiskClassifier.DEFAULT_HIGH_RISK_KEYWORDS);
        private List<String> mediumKeywords = new ArrayList<>(RiskClassifier.DEFAULT_MEDIUM_RISK_KEYWORDS);

        public List<String> getHighKeywords() {
            return highKeywords;
        }

        public void setHighKeywords(List<String> highKeywords) {
            this.highKeywords = highKeywords;
        }

        public List<String> getMediumKeywords() {
            return mediumKeywords;
        }

        public void setMediumKeywords(List<String> mediumKeywords) {
            this.mediumKeywords = mediumKeywords;
        }
    }

    public static class Approval {
        private boolean enabled = true;
        private Duration timeout = ApprovalCoordinator.DEFAULT_TIMEOUT;
        private RiskLevel threshold = RiskLevel.HIGH;
        private List<ActionType> alwaysPromptFor = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public RiskLevel getThreshold() {
            return threshold;
        }

        public void setThreshold(RiskLevel threshold) {
            this.threshold = threshold;
        }

        public List<ActionType> getAlwaysPromptFor() {
            return alwaysPromptFor;
        }

        public void setAlwaysPromptFor(List<ActionType> alwaysPromptFor) {
            this.alwaysPromptFor = alwaysPromptFor;
        }
    }

    public static class RateLimit {
        private int maxRequests = 100;
        private Duration window = Duration.ofMinutes(1);

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class Executor {
        private String baseUrl = "http://localhost:8090";
        private Duration commandTimeout = Duration.ofSeconds(120);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getCommandTimeout() {
            return commandTimeout;
        }

        public void setCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
        }
    }

    public static class Audit {
        private int maxEntries = InMemoryAuditLog.DEFAULT_MAX_ENTRIES;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
