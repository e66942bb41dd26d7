package com.agentgate.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of side-effecting operation the extractor can propose.
 *
 * The wire name (camelCase) is what the webview and the executor service
 * expect; {@link #rateLimitCategory()} routes each action to its counter.
 */
public enum ActionType {
    CREATE_FILE ("createFile",  "file creation",        "file_operations"),
    MODIFY_FILE ("modifyFile",  "file modification",    "file_operations"),
    RUN_COMMAND ("runCommand",  "command",              "terminal_commands"),
    OPEN_FILE   ("openFile",    "file open",            "file_operations"),
    ANALYZE_FILE("analyzeFile", "file analysis action", "file_operations");

    private final String wireName;
    private final String summaryNoun;
    private final String rateLimitCategory;

    ActionType(String wireName, String summaryNoun, String rateLimitCategory) {
        this.wireName          = wireName;
        this.summaryNoun       = summaryNoun;
        this.rateLimitCategory = rateLimitCategory;
    }

    @JsonValue
    public String wireName()          { return wireName; }
    public String rateLimitCategory() { return rateLimitCategory; }

    /** "1 file creation", "3 commands". */
    public String countLabel(int count) {
        return count + " " + summaryNoun + (count == 1 ? "" : "s");
    }

    public boolean touchesFile() {
        return this != RUN_COMMAND;
    }
}
