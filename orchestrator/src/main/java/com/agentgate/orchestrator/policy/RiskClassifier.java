package com.agentgate.orchestrator.policy;

import com.agentgate.orchestrator.model.RiskLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword-based risk tiering for commands and operation descriptions.
 *
 * Pure and deterministic: the keyword tables are fixed at construction and
 * {@link #classify} keeps no state, so one instance is shared by every thread.
 * High-risk keywords dominate medium ones; anything else is low.
 *
 * Keywords match as whole words, case-insensitively. A multi-word keyword
 * such as "chmod 777" tolerates any run of whitespace between its words.
 */
public class RiskClassifier {

    public static final List<String> DEFAULT_HIGH_RISK_KEYWORDS = List.of(
            "delete", "rm", "rmdir", "unlink", "format", "shutdown", "reboot",
            "sudo", "chmod 777", "kill", "mkfs", "dd");

    public static final List<String> DEFAULT_MEDIUM_RISK_KEYWORDS = List.of(
            "install", "update", "upgrade", "move", "rename", "copy", "mkdir",
            "git", "mv", "cp", "curl", "wget", "download", "npm", "pip");

    private final Map<String, Pattern> highRisk;
    private final Map<String, Pattern> mediumRisk;

    public RiskClassifier() {
        this(DEFAULT_HIGH_RISK_KEYWORDS, DEFAULT_MEDIUM_RISK_KEYWORDS);
    }

    public RiskClassifier(List<String> highRiskKeywords, List<String> mediumRiskKeywords) {
        this.highRisk   = compile(highRiskKeywords);
        this.mediumRisk = compile(mediumRiskKeywords);
    }

    public RiskAssessment classify(String text) {
        if (text == null || text.isBlank()) {
            return new RiskAssessment(RiskLevel.LOW, "Empty input", List.of());
        }

        List<String> high = matches(highRisk, text);
        if (!high.isEmpty()) {
            return new RiskAssessment(RiskLevel.HIGH,
                    "This operation may pose security risks (" + String.join(", ", high) + ")", high);
        }

        List<String> medium = matches(mediumRisk, text);
        if (!medium.isEmpty()) {
            return new RiskAssessment(RiskLevel.MEDIUM,
                    "This operation modifies the system or workspace (" + String.join(", ", medium) + ")", medium);
        }

        return new RiskAssessment(RiskLevel.LOW, "Operation appears safe to execute", List.of());
    }

    private static List<String> matches(Map<String, Pattern> table, String text) {
        List<String> found = new ArrayList<>();
        table.forEach((keyword, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(keyword);
            }
        });
        return found;
    }

    private static Map<String, Pattern> compile(List<String> keywords) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String keyword : keywords) {
            String normalized = keyword.strip().toLowerCase();
            if (normalized.isEmpty()) {
                continue;
            }
            StringBuilder regex = new StringBuilder("(?<!\\w)");
            String[] words = normalized.split("\\s+");
            for (int i = 0; i < words.length; i++) {
                if (i > 0) regex.append("\\s+");
                regex.append(Pattern.quote(words[i]));
            }
            regex.append("(?!\\w)");
            compiled.put(normalized, Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE));
        }
        return compiled;
    }
}
