package com.agentgate.orchestrator.agent;

import com.agentgate.orchestrator.model.ActionType;
import com.agentgate.orchestrator.model.LineRange;
import com.agentgate.orchestrator.model.ParseResult;
import com.agentgate.orchestrator.model.ParsedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form assistant text into typed, confidence-scored actions.
 *
 * Two independent sources of candidates:
 *   1. Trigger phrases in prose ("I'll create src/a.ts", "Let me run `npm test`").
 *      Fenced code is masked out first, so a phrase inside a code sample never fires.
 *   2. Fenced code blocks: shell blocks become one command per line, and a
 *      block with a leading path comment becomes its own file creation.
 *
 * A block that directly follows a create/modify trigger (or names the same
 * path) is that trigger's payload and produces nothing else.
 *
 * Every candidate then goes through {@link ActionValidator} and the confidence
 * threshold. Extraction never throws: a failing stage is logged and skipped.
 *
 * Stateless apart from the threshold, which is volatile so that a settings
 * change is visible to every caller.
 */
public class ActionExtractor {

    private static final Logger log = LoggerFactory.getLogger(ActionExtractor.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;

    static final double SHELL_FENCE_CONFIDENCE = 0.75;
    static final double PATH_HINT_CONFIDENCE   = 0.80;

    /** How far after a trigger its payload block may start. */
    static final int CONTENT_LOOKAHEAD = 500;

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?=\\s|$)|\\n");
    private static final Pattern BACKTICK     = Pattern.compile("`([^`\\n]+)`");
    private static final Pattern LINE_RANGE   = Pattern.compile(
            "\\blines?\\s+(\\d{1,7})(?:\\s*(?:-|to|through)\\s*(\\d{1,7}))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMAND_LEAD    = Pattern.compile(
            "^(?:the\\s+)?(?:command|following)\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern PURPOSE_CLAUSE  = Pattern.compile("\\s+(?:to|for)\\s+");
    private static final Pattern SENTENCE_TAIL   = Pattern.compile("[.!?:;,]*\\s*");
    private static final Pattern TRAILING_PUNCT  = Pattern.compile("[.:;,!?]+$");

    /** Binaries that make an un-quoted sentence remainder look like a command. */
    static final Set<String> KNOWN_BINARIES = Set.of(
            "npm", "npx", "yarn", "pnpm", "node", "bun", "deno", "tsc",
            "git", "mvn", "./mvnw", "gradle", "./gradlew", "java", "javac",
            "python", "python3", "pip", "pip3", "pytest", "poetry",
            "go", "cargo", "rustc", "make", "cmake", "dotnet",
            "ruby", "bundle", "rake", "php", "composer",
            "docker", "docker-compose", "kubectl", "code",
            "ls", "cat", "cd", "mkdir", "touch", "grep", "find", "echo",
            "cp", "mv", "rm", "chmod", "tar", "unzip", "curl", "wget");

    private final ActionValidator validator;
    private volatile double minConfidence;

    public ActionExtractor(ActionValidator validator) {
        this(validator, DEFAULT_MIN_CONFIDENCE);
    }

    public ActionExtractor(ActionValidator validator, double minConfidence) {
        if (!inRange(minConfidence)) {
            throw new IllegalArgumentException("minConfidence must be in [0,1]: " + minConfidence);
        }
        this.validator     = validator;
        this.minConfidence = minConfidence;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    /** Out-of-range values are ignored and the previous threshold is kept. */
    public void setMinConfidence(double value) {
        if (!inRange(value)) {
            log.warn("Ignoring out-of-range minConfidence {} (keeping {})", value, minConfidence);
            return;
        }
        minConfidence = value;
    }

    public ParseResult extract(String text) {
        return extract(text, minConfidence);
    }

    /**
     * @param threshold Actions below this confidence are dropped; clamped to [0,1].
     */
    public ParseResult extract(String text, double threshold) {
        if (text == null || text.isBlank()) {
            return ParseResult.empty();
        }
        double min = Double.isNaN(threshold) ? minConfidence : Math.max(0.0, Math.min(1.0, threshold));

        List<CodeFence> fences = List.of();
        try {
            fences = CodeFence.findAll(text);
        } catch (RuntimeException e) {
            log.warn("Code block scan failed, continuing with prose only: {}", e.toString());
        }

        Set<CodeFence> consumed   = new HashSet<>();
        List<Candidate> candidates = new ArrayList<>();

        try {
            candidates.addAll(fromTriggers(text, fences, consumed));
        } catch (RuntimeException e) {
            log.warn("Trigger phrase scan failed: {}", e.toString());
        }

        List<Candidate> fenceCandidates = new ArrayList<>();
        for (CodeFence fence : fences) {
            if (consumed.contains(fence)) {
                continue;
            }
            try {
                fenceCandidates.addAll(fromFence(fence));
            } catch (RuntimeException e) {
                log.warn("Skipping code block at offset {}: {}", fence.start(), e.toString());
            }
        }

        List<Candidate> merged = deduplicate(candidates, fenceCandidates);
        List<ParsedAction> actions = new ArrayList<>();
        for (Candidate candidate : merged) {
            ParsedAction action = candidate.action();
            Optional<String> rejection = validator.check(action);
            if (rejection.isPresent()) {
                log.debug("Dropping {} candidate: {}", action.type().wireName(), rejection.get());
                continue;
            }
            if (action.confidence() < min) {
                log.debug("Dropping {} below confidence threshold ({} < {})",
                        action.description(), action.confidence(), min);
                continue;
            }
            actions.add(action);
        }

        ParseResult result = ParseResult.of(actions);
        if (result.hasActionableContent()) {
            log.info("{} ({} candidates considered)", result.summary(), merged.size());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Trigger phrases
    // ------------------------------------------------------------------

    private List<Candidate> fromTriggers(String text, List<CodeFence> fences, Set<CodeFence> consumed) {
        String prose = mask(text, fences);
        List<TriggerMatch> triggers = findTriggers(prose);

        List<Candidate> candidates = new ArrayList<>();
        Map<TriggerMatch, String> pathsNeedingContent = new LinkedHashMap<>();
        Map<TriggerMatch, CodeFence> payloads = new LinkedHashMap<>();

        for (int i = 0; i < triggers.size(); i++) {
            TriggerMatch trigger = triggers.get(i);
            int limit = i + 1 < triggers.size() ? triggers.get(i + 1).start() : prose.length();
            String sentence = sentenceAfter(prose, trigger.end(), limit);
            trigger.sentence = sentence;

            if (trigger.phrase().takesContent()) {
                Optional<String> path = PathTokens.firstPath(sentence);
                if (path.isEmpty()) {
                    continue;
                }
                pathsNeedingContent.put(trigger, path.get());
                CodeFence adjacent = adjacentFence(prose, trigger, limit, fences, consumed, path.get());
                if (adjacent != null) {
                    consumed.add(adjacent);
                    payloads.put(trigger, adjacent);
                }
            }
        }

        // Second pass: blocks elsewhere in the response whose comment names the same path.
        pathsNeedingContent.forEach((trigger, path) -> {
            if (payloads.containsKey(trigger)) {
                return;
            }
            for (CodeFence fence : fences) {
                if (!consumed.contains(fence) && PathTokens.samePath(fence.pathHint(), path)) {
                    consumed.add(fence);
                    payloads.put(trigger, fence);
                    return;
                }
            }
        });

        for (TriggerMatch trigger : triggers) {
            ParsedAction action = switch (trigger.phrase().type()) {
                case CREATE_FILE -> {
                    String path = pathsNeedingContent.get(trigger);
                    yield path == null ? null
                            : ParsedAction.createFile(path, contentOf(payloads.get(trigger)), trigger.phrase().confidence());
                }
                case MODIFY_FILE -> {
                    String path = pathsNeedingContent.get(trigger);
                    yield path == null ? null
                            : ParsedAction.modifyFile(path, contentOf(payloads.get(trigger)),
                                    lineRangeIn(trigger.sentence), trigger.phrase().confidence());
                }
                case RUN_COMMAND -> commandIn(trigger.sentence)
                        .map(cmd -> ParsedAction.runCommand(cmd, trigger.phrase().confidence()))
                        .orElse(null);
                case OPEN_FILE -> PathTokens.firstPath(trigger.sentence)
                        .map(p -> ParsedAction.openFile(p, trigger.phrase().confidence()))
                        .orElse(null);
                case ANALYZE_FILE -> PathTokens.firstPath(trigger.sentence)
                        .map(p -> ParsedAction.analyzeFile(p, trigger.phrase().confidence()))
                        .orElse(null);
            };
            if (action != null) {
                candidates.add(new Candidate(trigger.start(), 0, action));
            }
        }
        return candidates;
    }

    private static List<TriggerMatch> findTriggers(String prose) {
        List<TriggerMatch> all = new ArrayList<>();
        for (TriggerPhrase phrase : TriggerPhrase.values()) {
            Matcher m = phrase.pattern().matcher(prose);
            while (m.find()) {
                all.add(new TriggerMatch(m.start(), m.end(), phrase));
            }
        }
        all.sort(Comparator.comparingInt(TriggerMatch::start));

        // Overlapping matches: the earliest one wins.
        List<TriggerMatch> kept = new ArrayList<>();
        int lastEnd = -1;
        for (TriggerMatch match : all) {
            if (match.start() >= lastEnd) {
                kept.add(match);
                lastEnd = match.end();
            }
        }
        return kept;
    }

    /**
     * The first unconsumed block after the trigger, provided nothing but the
     * trigger's own sentence and whitespace separates them, it starts before
     * the next trigger and within {@link #CONTENT_LOOKAHEAD} characters.
     * Shell blocks are commands, never payload, and a block whose comment
     * names some other path belongs to that path instead.
     */
    private static CodeFence adjacentFence(String prose, TriggerMatch trigger, int nextTrigger,
                                           List<CodeFence> fences, Set<CodeFence> consumed, String path) {
        int sentenceEnd = trigger.end() + trigger.sentence.length();
        for (CodeFence fence : fences) {
            if (fence.start() < trigger.end() || consumed.contains(fence)) {
                continue;
            }
            if (fence.start() > nextTrigger || fence.start() - trigger.start() > CONTENT_LOOKAHEAD) {
                return null;
            }
            String gap = prose.substring(Math.min(sentenceEnd, fence.start()), fence.start());
            if (!SENTENCE_TAIL.matcher(gap).matches() || fence.isShell()) {
                return null;
            }
            if (fence.pathHint() == null || PathTokens.samePath(fence.pathHint(), path)) {
                return fence;
            }
            return null;
        }
        return null;
    }

    private static String contentOf(CodeFence fence) {
        return fence == null ? null : fence.content();
    }

    private static LineRange lineRangeIn(String sentence) {
        Matcher m = LINE_RANGE.matcher(sentence);
        if (!m.find()) {
            return null;
        }
        int start = Integer.parseInt(m.group(1));
        int end   = m.group(2) != null ? Integer.parseInt(m.group(2)) : start;
        if (start < 1 || end < start) {
            log.debug("Ignoring malformed line range '{}'", m.group());
            return null;
        }
        return new LineRange(start, end);
    }

    /**
     * Backtick-quoted text wins. Otherwise the remainder of the sentence,
     * but only when it starts with a known binary; a trailing purpose
     * clause ("to install deps", "for the build") outside quotes is dropped.
     * A remainder with an unclosed quote is not a command.
     */
    static Optional<String> commandIn(String sentence) {
        Matcher quoted = BACKTICK.matcher(sentence);
        if (quoted.find()) {
            String command = quoted.group(1).strip();
            return command.isEmpty() ? Optional.empty() : Optional.of(command);
        }

        String remainder = COMMAND_LEAD.matcher(sentence.strip()).replaceFirst("");
        remainder = TRAILING_PUNCT.matcher(remainder).replaceFirst("").strip();
        if (remainder.isEmpty()) {
            return Optional.empty();
        }
        String firstWord = remainder.split("\\s+", 2)[0].toLowerCase();
        if (!KNOWN_BINARIES.contains(firstWord)) {
            return Optional.empty();
        }
        String command = withoutPurposeClause(remainder);
        if (!quotesBalanced(command)) {
            log.debug("Ignoring command with unbalanced quotes: {}", command);
            return Optional.empty();
        }
        return Optional.of(command);
    }

    private static String withoutPurposeClause(String remainder) {
        Matcher clause = PURPOSE_CLAUSE.matcher(remainder);
        while (clause.find()) {
            if (quotesBalanced(remainder.substring(0, clause.start()))) {
                return remainder.substring(0, clause.start()).strip();
            }
        }
        return remainder;
    }

    /** True when every ' and " opened in {@code s} is closed again. */
    static boolean quotesBalanced(String s) {
        char open = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (open == 0 && (c == '\'' || c == '"')) {
                open = c;
            } else if (c == open) {
                open = 0;
            }
        }
        return open == 0;
    }

    private static String sentenceAfter(String prose, int from, int limit) {
        Matcher end = SENTENCE_END.matcher(prose);
        end.region(from, limit);
        int stop = end.find() ? end.start() : limit;
        return prose.substring(from, stop);
    }

    /** Blank out fenced code, keeping offsets and line breaks intact. */
    private static String mask(String text, List<CodeFence> fences) {
        if (fences.isEmpty()) {
            return text;
        }
        char[] chars = text.toCharArray();
        for (CodeFence fence : fences) {
            for (int i = fence.start(); i < fence.end(); i++) {
                if (chars[i] != '\n') {
                    chars[i] = ' ';
                }
            }
        }
        return new String(chars);
    }

    // ------------------------------------------------------------------
    // Code blocks
    // ------------------------------------------------------------------

    private static List<Candidate> fromFence(CodeFence fence) {
        if (fence.pathHint() != null) {
            ParsedAction action = new ParsedAction(ActionType.CREATE_FILE, fence.pathHint(), fence.content(),
                    null, null, PATH_HINT_CONFIDENCE, "Create " + fence.pathHint() + " from code block");
            return List.of(new Candidate(fence.start(), 0, action));
        }
        if (!fence.isShell()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        List<String> commands = fence.commands();
        for (int i = 0; i < commands.size(); i++) {
            String command = commands.get(i);
            ParsedAction action = new ParsedAction(ActionType.RUN_COMMAND, null, null, command,
                    null, SHELL_FENCE_CONFIDENCE, "Execute shell command: " + command);
            candidates.add(new Candidate(fence.start(), i, action));
        }
        return candidates;
    }

    // ------------------------------------------------------------------
    // Merge
    // ------------------------------------------------------------------

    /**
     * Prose actions collapse on {@link ParsedAction#dedupKey()}, and a prose
     * command repeated verbatim in a shell block yields to the block line.
     * Block lines are kept as written, repeats included.
     */
    private static List<Candidate> deduplicate(List<Candidate> fromProse, List<Candidate> fromFences) {
        Set<String> fenceCommands = new HashSet<>();
        for (Candidate c : fromFences) {
            if (c.action().type() == ActionType.RUN_COMMAND) {
                fenceCommands.add(c.action().command());
            }
        }

        List<Candidate> merged = new ArrayList<>(fromFences);
        Set<String> seen = new HashSet<>();
        for (Candidate c : fromProse) {
            ParsedAction action = c.action();
            if (action.type() == ActionType.RUN_COMMAND && fenceCommands.contains(action.command())) {
                continue;
            }
            if (seen.add(action.dedupKey())) {
                merged.add(c);
            }
        }
        merged.sort(Comparator.comparingInt(Candidate::position).thenComparingInt(Candidate::order));
        return merged;
    }

    private static boolean inRange(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }

    // ------------------------------------------------------------------
    // Internal types
    // ------------------------------------------------------------------

    /** A candidate action and where it came from in the source text. */
    private record Candidate(int position, int order, ParsedAction action) {}

    private static final class TriggerMatch {
        private final int           start;
        private final int           end;
        private final TriggerPhrase phrase;
        private String sentence = "";

        TriggerMatch(int start, int end, TriggerPhrase phrase) {
            this.start  = start;
            this.end    = end;
            this.phrase = phrase;
        }

        int           start()  { return start; }
        int           end()    { return end; }
        TriggerPhrase phrase() { return phrase; }
    }
}
