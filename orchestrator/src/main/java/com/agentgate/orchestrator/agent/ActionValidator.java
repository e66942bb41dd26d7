package com.agentgate.orchestrator.agent;

import com.agentgate.orchestrator.model.ParsedAction;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shape and blacklist checks for extracted paths and commands.
 *
 * Used twice: by the extractor, so that malformed candidates never reach a
 * ParseResult, and by the orchestrator at dispatch time, since actions can
 * also arrive through the REST surface without passing the extractor.
 *
 * Every check returns the rejection reason, or empty when the input is fine.
 */
public class ActionValidator {

    public static final int DEFAULT_MAX_PATH_LENGTH    = 260;
    public static final int DEFAULT_MAX_COMMAND_LENGTH = 200;

    public static final List<String> DEFAULT_DANGEROUS_COMMAND_PATTERNS = List.of(
            "\\brm\\s+-[a-z]*(?:rf|fr)[a-z]*\\b",
            "\\brm\\s+-r\\s+-f\\b|\\brm\\s+-f\\s+-r\\b",
            "\\bshutdown\\b",
            "\\bformat\\b",
            "\\bsudo\\b",
            "\\bchmod\\s+(?:-R\\s+)?777\\b",
            "\\breboot\\b",
            "\\bmkfs(?:\\.\\w+)?\\b",
            "\\bdd\\s+if=",
            "\\b(?:curl|wget)\\b[^|]*\\|\\s*(?:ba|z)?sh\\b",
            ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:",
            "\\bdel\\s+/");

    public static final List<String> DEFAULT_FORBIDDEN_PATH_PREFIXES = List.of(
            "/etc/", "/bin/", "/usr/bin/", "/System/", "C:\\Windows\\");

    private static final Pattern FORBIDDEN_PATH_CHARS = Pattern.compile("[<>|*?\":\\p{Cntrl}]");
    private static final Pattern PATH_SHAPE           = Pattern.compile("[\\w@+.\\-/\\\\][\\w@+.\\-/\\\\ ]*");
    private static final Pattern EXTENSION            = Pattern.compile("\\.[A-Za-z0-9]+$");
    private static final Pattern SEPARATOR            = Pattern.compile("[/\\\\]");

    private final int           maxPathLength;
    private final int           maxCommandLength;
    private final List<Pattern> dangerousCommands;
    private final List<String>  forbiddenPrefixes;

    public ActionValidator() {
        this(DEFAULT_MAX_PATH_LENGTH, DEFAULT_MAX_COMMAND_LENGTH,
                DEFAULT_DANGEROUS_COMMAND_PATTERNS, DEFAULT_FORBIDDEN_PATH_PREFIXES);
    }

    public ActionValidator(int maxPathLength, int maxCommandLength,
                           List<String> dangerousCommandPatterns, List<String> forbiddenPathPrefixes) {
        this.maxPathLength     = maxPathLength;
        this.maxCommandLength  = maxCommandLength;
        this.dangerousCommands = dangerousCommandPatterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.forbiddenPrefixes = List.copyOf(forbiddenPathPrefixes);
    }

    public Optional<String> check(ParsedAction action) {
        return action.type().touchesFile()
                ? checkPath(action.filePath())
                : checkCommand(action.command());
    }

    public Optional<String> checkPath(String path) {
        if (path == null || path.isBlank()) {
            return Optional.of("File path is empty");
        }
        if (path.length() > maxPathLength) {
            return Optional.of("File path exceeds " + maxPathLength + " characters");
        }
        for (String prefix : forbiddenPrefixes) {
            if (path.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return Optional.of("File path is under protected location " + prefix);
            }
        }
        if (FORBIDDEN_PATH_CHARS.matcher(path).find()) {
            return Optional.of("File path contains forbidden characters");
        }
        if (path.startsWith("~")) {
            return Optional.of("Home-relative paths are not allowed");
        }
        if (!PATH_SHAPE.matcher(path).matches() || path.endsWith(" ")) {
            return Optional.of("File path has an unexpected shape");
        }
        for (String segment : SEPARATOR.split(path)) {
            if (segment.equals("..")) {
                return Optional.of("File path escapes the workspace");
            }
        }
        if (!EXTENSION.matcher(path).find() && !SEPARATOR.matcher(path).find()) {
            return Optional.of("File path has neither an extension nor a directory");
        }
        return Optional.empty();
    }

    public Optional<String> checkCommand(String command) {
        if (command == null || command.isBlank()) {
            return Optional.of("Command is empty");
        }
        if (command.length() > maxCommandLength) {
            return Optional.of("Command exceeds " + maxCommandLength + " characters");
        }
        for (Pattern dangerous : dangerousCommands) {
            if (dangerous.matcher(command).find()) {
                return Optional.of("Command matches blocked pattern " + dangerous.pattern());
            }
        }
        return Optional.empty();
    }

    public boolean isValidPath(String path)       { return checkPath(path).isEmpty(); }
    public boolean isValidCommand(String command) { return checkCommand(command).isEmpty(); }
}
