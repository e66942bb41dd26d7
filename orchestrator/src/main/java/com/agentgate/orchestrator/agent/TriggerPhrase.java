package com.agentgate.orchestrator.agent;

import com.agentgate.orchestrator.model.ActionType;

import java.util.regex.Pattern;

/**
 * Ordered trigger table: phrase family → action type → base confidence.
 *
 * Phrases are matched case-insensitively as whole words, and accept both
 * straight and typographic apostrophes ("I'll" / "I’ll").
 */
enum TriggerPhrase {

    CREATE(ActionType.CREATE_FILE, 0.90,
            "(?:I'll|I will|Let me|I'm going to|I'll go ahead and|Let's)\\s+create"
            + "|(?:I'm\\s+)?Creating"),

    MODIFY(ActionType.MODIFY_FILE, 0.80,
            "(?:I'll|I will|Let me|Let's)\\s+(?:modify|update|edit|change|add)"
            + "|Modifying|Updating|Editing"
            + "|(?:Add|Insert|Replace)\\s+(?:to|this|the following)"),

    RUN(ActionType.RUN_COMMAND, 0.85,
            "(?:I'll|I will|Let me|Let's)\\s+(?:run|execute)"
            + "|(?:First|Next|Then),?\\s+(?:run|execute)"),

    OPEN(ActionType.OPEN_FILE, 0.75,
            "(?:I'll|Let me|Let's)\\s+(?:open|look at|examine|check)"
            + "|Opening|Looking at|Examining"),

    ANALYZE(ActionType.ANALYZE_FILE, 0.80,
            "(?:I'll|Let me|Let's)\\s+(?:analyze|review|debug|investigate)"
            + "|Analyzing|Reviewing|Debugging|Investigating");

    private final ActionType type;
    private final double     confidence;
    private final Pattern    pattern;

    TriggerPhrase(ActionType type, double confidence, String phrases) {
        this.type       = type;
        this.confidence = confidence;
        this.pattern    = Pattern.compile(
                "(?<![\\w'’])(?:" + phrases.replace("'", "['’]") + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    ActionType type()       { return type; }
    double     confidence() { return confidence; }
    Pattern    pattern()    { return pattern; }

    /** Triggers whose following code block is the action's payload. */
    boolean takesContent() {
        return type == ActionType.CREATE_FILE || type == ActionType.MODIFY_FILE;
    }
}
