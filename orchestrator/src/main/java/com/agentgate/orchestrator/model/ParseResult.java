package com.agentgate.orchestrator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of one extraction pass over an AI response.
 *
 * @param actions              Surviving actions in source order.
 * @param hasActionableContent True iff {@code actions} is non-empty.
 * @param summary              e.g. "Detected 1 file creation, 2 commands".
 */
public record ParseResult(
        List<ParsedAction> actions,
        boolean            hasActionableContent,
        String             summary) {

    public static final String NO_ACTIONS_SUMMARY = "No actionable content detected";

    public ParseResult {
        actions = List.copyOf(actions);
    }

    public static ParseResult of(List<ParsedAction> actions) {
        return new ParseResult(actions, !actions.isEmpty(), summarize(actions));
    }

    public static ParseResult empty() {
        return of(List.of());
    }

    private static String summarize(List<ParsedAction> actions) {
        if (actions.isEmpty()) {
            return NO_ACTIONS_SUMMARY;
        }
        // LinkedHashMap keeps the order in which each type first appears.
        Map<ActionType, Integer> counts = new LinkedHashMap<>();
        for (ParsedAction action : actions) {
            counts.merge(action.type(), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .map(e -> e.getKey().countLabel(e.getValue()))
                .collect(Collectors.joining(", ", "Detected ", ""));
    }
}
