package com.agentgate.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParseResultTest {

    @Test
    void summary_countsTypesInFirstAppearanceOrder() {
        ParseResult result = ParseResult.of(List.of(
                ParsedAction.runCommand("npm install", 0.85),
                ParsedAction.createFile("src/a.ts", "x", 0.9),
                ParsedAction.runCommand("npm test", 0.85)));

        assertThat(result.hasActionableContent()).isTrue();
        assertThat(result.summary()).isEqualTo("Detected 2 commands, 1 file creation");
    }

    @Test
    void summary_pluralisesAnalysis() {
        ParseResult result = ParseResult.of(List.of(
                ParsedAction.analyzeFile("a.py", 0.8),
                ParsedAction.analyzeFile("b.py", 0.8)));

        assertThat(result.summary()).isEqualTo("Detected 2 file analysis actions");
    }

    @Test
    void empty_hasNoActionableContent() {
        ParseResult result = ParseResult.empty();

        assertThat(result.hasActionableContent()).isFalse();
        assertThat(result.summary()).isEqualTo(ParseResult.NO_ACTIONS_SUMMARY);
    }

    @Test
    void actions_areDefensivelyCopied() {
        ParseResult result = ParseResult.of(List.of(ParsedAction.openFile("a.md", 0.75)));

        assertThatThrownBy(() -> result.actions().add(ParsedAction.openFile("b.md", 0.75)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
