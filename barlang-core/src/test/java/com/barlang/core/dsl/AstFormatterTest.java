package com.barlang.core.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstFormatterTest {

    private final Parser parser = new Parser();

    @Test
    @DisplayName("Formatted rule text parses back to the same tree")
    void ruleTextReparses() {
        List<String> rules = List.of(
            "ENTRY: close > 100",
            "ENTRY: volume > 1.5M\nEXIT: close < open_yesterday",
            "ENTRY: close > 1 OR close > 2 AND close > 3",
            "ENTRY: (close > 1 OR close > 2) AND close > 3",
            "ENTRY: close crosses above SMA(close,20) * (1 + 0.02)",
            "EXIT: RSI(close, 14) > 70 OR close - (open - low) < -3",
            "ENTRY: SMA(close,5) crosses below SMA(close,20)"
        );

        for (String rule : rules) {
            AstNode.Strategy parsed = parser.parse(rule);
            String formatted = AstFormatter.toRuleText(parsed);
            assertEquals(parsed, parser.parse(formatted), () -> "Round trip changed " + rule + " -> " + formatted);
        }
    }

    @Test
    @DisplayName("Rule text uses plain notation")
    void ruleTextShape() {
        AstNode.Strategy strategy = parser.parse("entry: volume > 1M and close crosses above sma(close,20)");

        assertEquals("ENTRY: volume > 1000000 AND close crosses above SMA(close, 20)",
            AstFormatter.toRuleText(strategy));
    }

    @Test
    @DisplayName("Tree lists one node per line")
    void treeShape() {
        AstNode.Strategy strategy = parser.parse("ENTRY: close > SMA(close, 20)");

        String expected = String.join("\n",
            "Strategy",
            "  ENTRY",
            "    Comparison >",
            "      Identifier close",
            "      FunctionCall SMA",
            "        Identifier close",
            "        Number 20",
            "");
        assertEquals(expected, AstFormatter.toTree(strategy));
    }

    @Test
    @DisplayName("Empty strategy formats as empty text")
    void emptyStrategy() {
        assertEquals("", AstFormatter.toRuleText(AstNode.Strategy.empty()));
        assertEquals("Strategy\n", AstFormatter.toTree(AstNode.Strategy.empty()));
    }
}
