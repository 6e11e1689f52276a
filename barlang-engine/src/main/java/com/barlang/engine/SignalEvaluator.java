package com.barlang.engine;

import com.barlang.core.dsl.AstNode;
import com.barlang.core.indicators.RSI;
import com.barlang.core.indicators.SMA;
import com.barlang.core.indicators.SeriesFunctions;
import com.barlang.core.model.PriceSeries;
import com.barlang.core.model.SignalSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Evaluates rule AST nodes against a price series, one whole series at a time.
 *
 * <p>Conditions produce a boolean per bar, values a double per bar, both aligned with
 * the input series. Bars lacking history (shifted fields) carry NaN, and any comparison
 * involving NaN is false.</p>
 *
 * <p>The evaluator holds no state between calls; indicator results are cached only for
 * the duration of one call.</p>
 */
public class SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SignalEvaluator.class);

    /**
     * Evaluate the ENTRY and EXIT sections of a strategy.
     * An absent section yields an all-false series.
     */
    public SignalSeries evaluate(PriceSeries series, AstNode.Strategy strategy) {
        series.requireFields();
        if (strategy == null) {
            throw new EvaluationException("No strategy to evaluate");
        }
        if (!strategy.hasEntry() && !strategy.hasExit()) {
            return SignalSeries.none(series);
        }

        Context ctx = new Context(series);
        boolean[] entry = strategy.hasEntry()
            ? condition(ctx, strategy.entry())
            : new boolean[series.size()];
        boolean[] exit = strategy.hasExit()
            ? condition(ctx, strategy.exit())
            : new boolean[series.size()];

        SignalSeries signals = new SignalSeries(series.dates(), entry, exit);
        log.debug("Evaluated {} bars: {} entry signals, {} exit signals",
            series.size(), signals.entryCount(), signals.exitCount());
        return signals;
    }

    /**
     * Evaluate a single condition node (comparison, cross or logical).
     */
    public boolean[] evaluateCondition(PriceSeries series, AstNode node) {
        series.requireFields();
        return condition(new Context(series), node);
    }

    /**
     * Evaluate a single value node (number, field, function call or arithmetic).
     */
    public double[] evaluateValue(PriceSeries series, AstNode node) {
        series.requireFields();
        return value(new Context(series), node);
    }

    // ========== Conditions ==========

    private boolean[] condition(Context ctx, AstNode node) {
        if (node instanceof AstNode.Logical l) {
            return evaluateLogical(ctx, l);
        }
        if (node instanceof AstNode.Comparison c) {
            return evaluateComparison(ctx, c);
        }
        if (node instanceof AstNode.Cross c) {
            return evaluateCross(ctx, c);
        }
        throw new EvaluationException("Expected a condition, got " + describe(node));
    }

    private boolean[] evaluateLogical(Context ctx, AstNode.Logical node) {
        boolean[] left = condition(ctx, node.left());
        boolean[] right = condition(ctx, node.right());
        boolean[] result = new boolean[ctx.size()];

        switch (node.operator()) {
            case "AND" -> {
                for (int i = 0; i < result.length; i++) result[i] = left[i] && right[i];
            }
            case "OR" -> {
                for (int i = 0; i < result.length; i++) result[i] = left[i] || right[i];
            }
            default -> throw new EvaluationException("Unknown logical operator: " + node.operator());
        }
        return result;
    }

    private boolean[] evaluateComparison(Context ctx, AstNode.Comparison node) {
        double[] left = value(ctx, node.left());
        double[] right = value(ctx, node.right());
        boolean[] result = new boolean[ctx.size()];

        for (int i = 0; i < result.length; i++) {
            double l = left[i];
            double r = right[i];
            // NaN compares false under every operator
            result[i] = switch (node.operator()) {
                case ">" -> l > r;
                case "<" -> l < r;
                case ">=" -> l >= r;
                case "<=" -> l <= r;
                case "==" -> l == r;
                default -> throw new EvaluationException("Unknown operator: " + node.operator());
            };
        }
        return result;
    }

    /**
     * CROSS_ABOVE at bar i: left > right now, and not left > right on bar i - 1.
     * Bar 0 has no previous bar and is never a cross.
     */
    private boolean[] evaluateCross(Context ctx, AstNode.Cross node) {
        if (node.direction() == null) {
            throw new EvaluationException("Cross node has no direction");
        }
        double[] left = value(ctx, node.left());
        double[] right = value(ctx, node.right());
        boolean[] result = new boolean[ctx.size()];

        boolean previous = false;
        for (int i = 0; i < result.length; i++) {
            boolean current = switch (node.direction()) {
                case CROSS_ABOVE -> left[i] > right[i];
                case CROSS_BELOW -> left[i] < right[i];
            };
            result[i] = i > 0 && current && !previous;
            previous = current;
        }
        return result;
    }

    // ========== Values ==========

    private double[] value(Context ctx, AstNode node) {
        if (node instanceof AstNode.Number n) {
            return SeriesFunctions.constant(n.value(), ctx.size());
        }
        if (node instanceof AstNode.Identifier id) {
            return evaluateIdentifier(ctx, id);
        }
        if (node instanceof AstNode.FunctionCall f) {
            return evaluateFunction(ctx, f);
        }
        if (node instanceof AstNode.Binary b) {
            return evaluateBinary(ctx, b);
        }
        throw new EvaluationException("Expected a value, got " + describe(node));
    }

    private double[] evaluateIdentifier(Context ctx, AstNode.Identifier node) {
        if (node.name() == null) {
            throw new EvaluationException("Field reference has no name");
        }
        String field = node.baseField();
        if (!AstNode.FIELDS.contains(field)) {
            throw new EvaluationException("Unknown field: " + node.name());
        }
        int lookback = node.lookback();
        return ctx.cached(node.name(), () -> SeriesFunctions.shift(ctx.series.column(field), lookback));
    }

    private double[] evaluateFunction(Context ctx, AstNode.FunctionCall node) {
        String name = node.name() == null ? "" : node.name().toUpperCase(Locale.ROOT);
        List<AstNode> args = node.arguments();

        if (args.size() != 2) {
            throw new EvaluationException(name + " requires 2 arguments (field, window), got " + args.size());
        }
        if (!(args.get(0) instanceof AstNode.Identifier field)) {
            throw new EvaluationException(name + " first argument must be a field, got " + describe(args.get(0)));
        }
        if (!(args.get(1) instanceof AstNode.Number windowNode)) {
            throw new EvaluationException(name + " second argument must be a number, got " + describe(args.get(1)));
        }
        double windowValue = windowNode.value();
        if (windowValue != Math.rint(windowValue) || windowValue < 1) {
            throw new EvaluationException(name + " window must be a positive integer, got " + windowValue);
        }
        int window = (int) windowValue;

        double[] input = evaluateIdentifier(ctx, field);

        return switch (name) {
            case "SMA" -> ctx.cached("SMA:" + field.name() + ":" + window, () -> SMA.calculate(input, window));
            case "RSI" -> ctx.cached("RSI:" + field.name() + ":" + window, () -> RSI.calculate(input, window));
            default -> throw new EvaluationException("Unknown function: " + node.name());
        };
    }

    private double[] evaluateBinary(Context ctx, AstNode.Binary node) {
        double[] left = value(ctx, node.left());
        double[] right = value(ctx, node.right());
        double[] result = new double[ctx.size()];

        for (int i = 0; i < result.length; i++) {
            double l = left[i];
            double r = right[i];
            result[i] = switch (node.operator()) {
                case "+" -> l + r;
                case "-" -> l - r;
                case "*" -> l * r;
                case "/" -> {
                    if (r == 0) {
                        throw new EvaluationException("Division by zero at bar " + i +
                            " (" + ctx.series.dateAt(i) + ")");
                    }
                    yield l / r;
                }
                default -> throw new EvaluationException("Unknown arithmetic operator: " + node.operator());
            };
        }
        return result;
    }

    private static String describe(AstNode node) {
        return node == null ? "nothing" : node.getClass().getSimpleName() + " node";
    }

    /**
     * Per-call evaluation state: the series and its computed sub-series.
     */
    private static final class Context {
        final PriceSeries series;
        final Map<String, double[]> cache = new HashMap<>();

        Context(PriceSeries series) {
            this.series = series;
        }

        int size() {
            return series.size();
        }

        double[] cached(String key, Supplier<double[]> compute) {
            double[] values = cache.get(key);
            if (values == null) {
                values = compute.get();
                cache.put(key, values);
            }
            return values;
        }
    }

    public static class EvaluationException extends RuntimeException {
        public EvaluationException(String message) {
            super(message);
        }
    }
}
