package com.barlang.core.dsl;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * AST Node types for the rule parser.
 * Uses sealed interfaces for type safety.
 */
public sealed interface AstNode {

    /** Base fields every price series must carry. */
    Set<String> FIELDS = Set.of("open", "high", "low", "close", "volume");

    /**
     * Parsed rule set: ENTRY and EXIT conditions, either may be absent (null).
     */
    record Strategy(AstNode entry, AstNode exit) implements AstNode {

        public static Strategy empty() {
            return new Strategy(null, null);
        }

        public boolean hasEntry() {
            return entry != null;
        }

        public boolean hasExit() {
            return exit != null;
        }
    }

    /**
     * Logical expression: left AND right, left OR right
     */
    record Logical(String operator, AstNode left, AstNode right) implements AstNode {

        public Logical {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        /**
         * Left-fold a list of operands into a chain of binary nodes:
         * chain("AND", [a, b, c]) == ((a AND b) AND c)
         */
        public static AstNode chain(String operator, List<? extends AstNode> operands) {
            if (operands == null || operands.isEmpty()) {
                throw new IllegalArgumentException(operator + " needs at least one operand");
            }
            AstNode node = operands.get(0);
            for (int i = 1; i < operands.size(); i++) {
                node = new Logical(operator, node, operands.get(i));
            }
            return node;
        }
    }

    /**
     * Comparison: left > right, left < right, etc.
     */
    record Comparison(AstNode left, String operator, AstNode right) implements AstNode {}

    /**
     * Cross event: left crosses above right, left crosses below right
     */
    record Cross(AstNode left, CrossDirection direction, AstNode right) implements AstNode {}

    /**
     * Arithmetic expression: left * right, left / right, etc.
     */
    record Binary(AstNode left, String operator, AstNode right) implements AstNode {}

    /**
     * Indicator call: SMA(close, 20), RSI(close, 14)
     */
    record FunctionCall(String name, List<AstNode> arguments) implements AstNode {

        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Field reference: close, volume_yesterday, high_last_week
     */
    record Identifier(String name) implements AstNode {

        public static final String YESTERDAY = "_yesterday";
        public static final String LAST_WEEK = "_last_week";

        /**
         * Field name with any lookback suffix removed.
         */
        public String baseField() {
            if (name.endsWith(YESTERDAY)) {
                return name.substring(0, name.length() - YESTERDAY.length());
            }
            if (name.endsWith(LAST_WEEK)) {
                return name.substring(0, name.length() - LAST_WEEK.length());
            }
            return name;
        }

        /**
         * Bars to shift the field by: 1 for _yesterday, 5 for _last_week.
         */
        public int lookback() {
            if (name.endsWith(YESTERDAY)) return 1;
            if (name.endsWith(LAST_WEEK)) return 5;
            return 0;
        }
    }

    /**
     * Number literal: 14, 1.5, 1K (1000), 2M (2000000)
     */
    record Number(double value) implements AstNode {}

    enum CrossDirection {
        CROSS_ABOVE,
        CROSS_BELOW
    }

    /**
     * True for nodes that produce a boolean series.
     */
    static boolean isCondition(AstNode node) {
        return node instanceof Logical || node instanceof Comparison || node instanceof Cross;
    }

    /**
     * True for nodes that produce a numeric series.
     */
    static boolean isValue(AstNode node) {
        return node instanceof Binary || node instanceof FunctionCall
            || node instanceof Identifier || node instanceof Number;
    }
}
