package com.agentgate.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds path-shaped tokens in prose. Only a shape match: whether the path is
 * acceptable is {@link ActionValidator}'s call.
 */
final class PathTokens {

    private static final Pattern BACKTICK     = Pattern.compile("`([^`\\n]+)`");
    private static final Pattern TOKEN_CHARS  = Pattern.compile("[\\w@+.\\-/\\\\]+");
    // Extension must contain a letter, so "1.2" or "v2.0" are not files.
    private static final Pattern EXTENSION    = Pattern.compile("(?:^|[^.])\\.[A-Za-z0-9]*[A-Za-z][A-Za-z0-9]*$");
    private static final Pattern SEPARATOR    = Pattern.compile("[/\\\\]");
    private static final Pattern ABBREVIATION = Pattern.compile("(?:[A-Za-z]\\.)+[A-Za-z]?");
    private static final Pattern LEADING_PUNCT  = Pattern.compile("^[\"'(\\[<`]+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[,;:!?)\"'`\\]>]+$");

    private PathTokens() {}

    /**
     * Segments separated by {@code /} (or {@code \}) with an optional
     * extension; a bare name needs an extension.
     */
    static boolean isPathShaped(String token) {
        if (token == null || token.isEmpty() || !TOKEN_CHARS.matcher(token).matches()) {
            return false;
        }
        if (ABBREVIATION.matcher(token).matches()) {
            return false;
        }
        if (EXTENSION.matcher(token).find()) {
            return true;
        }
        return SEPARATOR.matcher(token).find() && token.chars().anyMatch(Character::isLetterOrDigit);
    }

    /** First path-shaped token in {@code sentence}; backtick-wrapped tokens win. */
    static Optional<String> firstPath(String sentence) {
        Matcher quoted = BACKTICK.matcher(sentence);
        while (quoted.find()) {
            String candidate = quoted.group(1).strip();
            if (isPathShaped(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String raw : sentence.strip().split("\\s+")) {
            String token = trimPunctuation(raw);
            if (isPathShaped(token)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /** Same path modulo a leading "./". */
    static boolean samePath(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }

    private static String normalize(String path) {
        return path.startsWith("./") ? path.substring(2) : path;
    }

    private static String trimPunctuation(String raw) {
        String token = LEADING_PUNCT.matcher(raw).replaceAll("");
        token = TRAILING_PUNCT.matcher(token).replaceAll("");
        if (token.endsWith(".") && !token.endsWith("..")) {
            token = token.substring(0, token.length() - 1);
        }
        return token;
    }
}
