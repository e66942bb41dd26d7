package com.agentgate.orchestrator.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fenced code block in an AI response.
 *
 * @param start    Offset of the opening fence.
 * @param end      Offset just past the closing fence.
 * @param language Lower-cased info string, "" when unlabelled.
 * @param body     Text between the fences, leading blank lines and trailing whitespace removed.
 * @param pathHint Path named by a leading comment such as {@code // src/app.ts}, or null.
 *                 Always null for shell-labelled blocks.
 */
record CodeFence(int start, int end, String language, String body, String pathHint) {

    // Matches ```lang\n ... ``` with an optional language label
    private static final Pattern FENCE = Pattern.compile(
            "```([\\w+#.\\-]*)[ \\t]*\\r?\\n(.*?)\\r?\\n?```",
            Pattern.DOTALL
    );

    // "// path", "# path", "/* path */", "<!-- path -->", "-- path", optionally "file: path"
    private static final Pattern PATH_HINT = Pattern.compile(
            "^\\s*(?://|#|/\\*|<!--|--)\\s*(?:(?:file|filename|path)\\s*:\\s*)?([\\w@+.\\-/\\\\]+)\\s*(?:\\*/|-->)?\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SHELL_PROMPT = Pattern.compile("^\\$\\s*");

    private static final Set<String> SHELL_LANGUAGES = Set.of("bash", "sh", "shell", "zsh", "console");

    static List<CodeFence> findAll(String text) {
        List<CodeFence> fences = new ArrayList<>();
        Matcher m = FENCE.matcher(text);
        while (m.find()) {
            String body     = m.group(2).replaceFirst("^(?:[ \\t]*\\r?\\n)+", "").stripTrailing();
            String language = m.group(1).toLowerCase();
            // In a shell block a leading "# name" line is a comment, not a file name
            String hint     = SHELL_LANGUAGES.contains(language) ? null : pathHintOf(body);
            fences.add(new CodeFence(m.start(), m.end(), language, body, hint));
        }
        return fences;
    }

    /** The body without its path-hint line. */
    String content() {
        if (pathHint == null) {
            return body;
        }
        int newline = body.indexOf('\n');
        return newline < 0 ? "" : body.substring(newline + 1).replaceFirst("^(?:[ \\t]*\\r?\\n)+", "");
    }

    /**
     * bash / sh / shell / zsh / console, or an unlabelled block whose
     * non-empty lines all start with a {@code $} prompt.
     */
    boolean isShell() {
        if (SHELL_LANGUAGES.contains(language)) {
            return true;
        }
        if (!language.isEmpty()) {
            return false;
        }
        List<String> lines = nonEmptyLines();
        return !lines.isEmpty() && lines.stream().allMatch(l -> l.startsWith("$"));
    }

    /**
     * One entry per command line, in order, with any {@code $ } prompt
     * stripped. Shell comments are skipped. In a console transcript only
     * prompted lines are commands; the rest is output.
     */
    List<String> commands() {
        List<String> lines = nonEmptyLines();
        boolean promptedOnly = language.equals("console") && lines.stream().anyMatch(l -> l.startsWith("$"));

        List<String> commands = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("#") || (promptedOnly && !line.startsWith("$"))) {
                continue;
            }
            String command = SHELL_PROMPT.matcher(line).replaceFirst("").strip();
            if (!command.isEmpty()) {
                commands.add(command);
            }
        }
        return commands;
    }

    private List<String> nonEmptyLines() {
        return body.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
    }

    private static String pathHintOf(String body) {
        String firstLine = body.lines().findFirst().orElse("");
        Matcher m = PATH_HINT.matcher(firstLine);
        if (m.matches() && PathTokens.isPathShaped(m.group(1))) {
            return m.group(1);
        }
        return null;
    }
}
