package com.barlang.runner;

import com.barlang.core.dsl.AstNode;
import com.barlang.core.dsl.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternRuleTranslatorTest {

    private final RuleTranslator translator = new PatternRuleTranslator();

    private String translateAndParse(String english) {
        String rule = translator.translate(english);
        assertDoesNotThrow(() -> new Parser().parse(rule), () -> "Does not parse: " + rule);
        return rule;
    }

    @Nested
    @DisplayName("Synonyms")
    class SynonymTests {

        @Test
        @DisplayName("Moving average and volume phrases")
        void movingAverageAndVolume() {
            String rule = translateAndParse(
                "Buy when the close price is above the 20-day moving average and volume is above 1 million");

            assertEquals("ENTRY: close > SMA(close,20) AND volume > 1M", rule);
        }

        @Test
        @DisplayName("RSI with an explicit period")
        void rsiWithPeriod() {
            assertEquals("EXIT: RSI(close,14) > 70", translateAndParse("Sell when RSI(14) is above 70"));
            assertEquals("EXIT: RSI(close,9) >= 70",
                translateAndParse("Exit when rsi 9 is greater than or equal to 70"));
        }

        @Test
        @DisplayName("RSI defaults to 14 bars")
        void rsiDefault() {
            assertEquals("ENTRY: RSI(close,14) < 30", translateAndParse("Buy when RSI is below 30"));
        }

        @Test
        @DisplayName("Short forms: ma-N, vol, k")
        void shortForms() {
            assertEquals("ENTRY: close crosses above SMA(close,20)",
                translateAndParse("buy when close crosses over ma20"));
            assertEquals("ENTRY: volume > 500K", translateAndParse("buy if vol > 500k"));
        }
    }

    @Nested
    @DisplayName("Sections")
    class SectionTests {

        @Test
        @DisplayName("Entry and exit sentences")
        void entryAndExit() {
            String rule = translateAndParse(
                "Enter when price crosses above the 50 day moving average. "
                    + "Exit when price crosses below the 50 day moving average.");

            assertEquals("ENTRY: close crosses above SMA(close,50)\nEXIT: close crosses below SMA(close,50)", rule);
        }

        @Test
        @DisplayName("Exit sentence first still yields ENTRY before EXIT")
        void exitFirst() {
            String rule = translateAndParse("Sell when close < 90. Buy when close > 110.");

            assertEquals("ENTRY: close > 110\nEXIT: close < 90", rule);
        }

        @Test
        @DisplayName("Several entry sentences are joined with AND")
        void joinsEntries() {
            String rule = translateAndParse("Buy when close > 100. Go long if volume exceeds 2 million.");

            assertEquals("ENTRY: close > 100 AND volume > 2M", rule);
        }

        @Test
        @DisplayName("Closing a position counts as an exit; close as a field does not")
        void closePositionIsExit() {
            String rule = translateAndParse("Close the position when price is under the 10-day sma");
            AstNode.Strategy strategy = new Parser().parse(rule);

            assertEquals("EXIT: close < SMA(close,10)", rule);
            assertFalse(strategy.hasEntry());
            assertEquals("ENTRY: close > 100", translateAndParse("close > 100"));
        }

        @Test
        @DisplayName("A bare cross gets close as its subject")
        void bareCross() {
            assertEquals("ENTRY: close crosses above SMA(close,20)",
                translateAndParse("Buy when crosses above sma 20"));
        }
    }

    @Test
    @DisplayName("Blank input is rejected")
    void rejectsBlank() {
        assertThrows(IllegalArgumentException.class, () -> translator.translate("   "));
        assertThrows(IllegalArgumentException.class, () -> translator.translate(null));
    }
}
