package com.barlang.core.dsl;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders AST nodes as rule text or as an indented tree.
 *
 * <p>Rule text is fully bracketed where nesting matters, so parsing the output yields
 * the same tree.</p>
 */
public final class AstFormatter {

    private static final String INDENT = "  ";

    private AstFormatter() {}

    /**
     * Format a node as rule text the parser accepts.
     */
    public static String toRuleText(AstNode node) {
        if (node instanceof AstNode.Strategy s) {
            StringBuilder sb = new StringBuilder();
            if (s.hasEntry()) {
                sb.append("ENTRY: ").append(toRuleText(s.entry()));
            }
            if (s.hasExit()) {
                if (sb.length() > 0) sb.append('\n');
                sb.append("EXIT: ").append(toRuleText(s.exit()));
            }
            return sb.toString();
        }
        if (node instanceof AstNode.Logical l) {
            return operand(l.left(), AstNode.Logical.class) + " " + l.operator() + " "
                + operand(l.right(), AstNode.Logical.class);
        }
        if (node instanceof AstNode.Comparison c) {
            return toRuleText(c.left()) + " " + c.operator() + " " + toRuleText(c.right());
        }
        if (node instanceof AstNode.Cross c) {
            String phrase = c.direction() == AstNode.CrossDirection.CROSS_ABOVE ? "crosses above" : "crosses below";
            return toRuleText(c.left()) + " " + phrase + " " + toRuleText(c.right());
        }
        if (node instanceof AstNode.Binary b) {
            return operand(b.left(), AstNode.Binary.class) + " " + b.operator() + " "
                + operand(b.right(), AstNode.Binary.class);
        }
        if (node instanceof AstNode.FunctionCall f) {
            return f.name() + "(" + f.arguments().stream()
                .map(AstFormatter::toRuleText)
                .collect(Collectors.joining(", ")) + ")";
        }
        if (node instanceof AstNode.Identifier id) {
            return id.name();
        }
        if (node instanceof AstNode.Number n) {
            return formatNumber(n.value());
        }
        throw new IllegalArgumentException("Cannot format " + node);
    }

    /**
     * Format a node as an indented tree, one node per line.
     */
    public static String toTree(AstNode node) {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendTree(StringBuilder sb, AstNode node, int depth) {
        String pad = INDENT.repeat(depth);
        if (node instanceof AstNode.Strategy s) {
            sb.append(pad).append("Strategy\n");
            if (s.hasEntry()) {
                sb.append(pad).append(INDENT).append("ENTRY\n");
                appendTree(sb, s.entry(), depth + 2);
            }
            if (s.hasExit()) {
                sb.append(pad).append(INDENT).append("EXIT\n");
                appendTree(sb, s.exit(), depth + 2);
            }
        } else if (node instanceof AstNode.Logical l) {
            sb.append(pad).append("Logical ").append(l.operator()).append('\n');
            appendTree(sb, l.left(), depth + 1);
            appendTree(sb, l.right(), depth + 1);
        } else if (node instanceof AstNode.Comparison c) {
            sb.append(pad).append("Comparison ").append(c.operator()).append('\n');
            appendTree(sb, c.left(), depth + 1);
            appendTree(sb, c.right(), depth + 1);
        } else if (node instanceof AstNode.Cross c) {
            sb.append(pad).append("Cross ").append(c.direction()).append('\n');
            appendTree(sb, c.left(), depth + 1);
            appendTree(sb, c.right(), depth + 1);
        } else if (node instanceof AstNode.Binary b) {
            sb.append(pad).append("Binary ").append(b.operator()).append('\n');
            appendTree(sb, b.left(), depth + 1);
            appendTree(sb, b.right(), depth + 1);
        } else if (node instanceof AstNode.FunctionCall f) {
            sb.append(pad).append("FunctionCall ").append(f.name()).append('\n');
            for (AstNode arg : f.arguments()) {
                appendTree(sb, arg, depth + 1);
            }
        } else if (node instanceof AstNode.Identifier id) {
            sb.append(pad).append("Identifier ").append(id.name()).append('\n');
        } else if (node instanceof AstNode.Number n) {
            sb.append(pad).append("Number ").append(formatNumber(n.value())).append('\n');
        } else {
            throw new IllegalArgumentException("Cannot format " + node);
        }
    }

    private static String operand(AstNode node, Class<? extends AstNode> bracketed) {
        String text = toRuleText(node);
        return bracketed.isInstance(node) ? "(" + text + ")" : text;
    }

    // Plain decimal notation; the lexer has no exponent syntax
    private static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
