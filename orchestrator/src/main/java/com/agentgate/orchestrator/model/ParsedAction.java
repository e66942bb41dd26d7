package com.agentgate.orchestrator.model;

/**
 * One typed, confidence-scored candidate operation extracted from AI text.
 *
 * Immutable. Exactly one of {@code filePath} / {@code command} is set,
 * depending on {@link ActionType#touchesFile()}.
 *
 * @param type        What the action does.
 * @param filePath    Target path for file actions, null for commands.
 * @param content     Payload for createFile / modifyFile (may be null).
 * @param command     Shell command for runCommand, null otherwise.
 * @param lineRange   Optional span for modifyFile.
 * @param confidence  Extractor certainty in [0,1].
 * @param description Human-readable label shown in prompts and logs.
 */
public record ParsedAction(
        ActionType type,
        String     filePath,
        String     content,
        String     command,
        LineRange  lineRange,
        double     confidence,
        String     description) {

    public ParsedAction {
        if (type == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
        }
    }

    public static ParsedAction createFile(String path, String content, double confidence) {
        return new ParsedAction(ActionType.CREATE_FILE, path, content, null, null, confidence,
                "Create " + path + (content != null && !content.isEmpty() ? " with extracted content" : ""));
    }

    public static ParsedAction modifyFile(String path, String content, LineRange lineRange, double confidence) {
        return new ParsedAction(ActionType.MODIFY_FILE, path, content, null, lineRange, confidence,
                "Modify " + path + (content != null && !content.isEmpty() ? " with extracted content" : ""));
    }

    public static ParsedAction runCommand(String command, double confidence) {
        return new ParsedAction(ActionType.RUN_COMMAND, null, null, command, null, confidence,
                "Execute: " + command);
    }

    public static ParsedAction openFile(String path, double confidence) {
        return new ParsedAction(ActionType.OPEN_FILE, path, null, null, null, confidence, "Open " + path);
    }

    public static ParsedAction analyzeFile(String path, double confidence) {
        return new ParsedAction(ActionType.ANALYZE_FILE, path, null, null, null, confidence, "Analyze " + path);
    }

    /** Identity used for de-duplication: type, path and command. */
    public String dedupKey() {
        return type.wireName() + ":" + (filePath == null ? "" : filePath) + ":" + (command == null ? "" : command);
    }
}
