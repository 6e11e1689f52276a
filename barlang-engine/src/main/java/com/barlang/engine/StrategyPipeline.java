package com.barlang.engine;

import com.barlang.core.dsl.AstNode;
import com.barlang.core.dsl.Parser;
import com.barlang.core.model.BacktestConfig;
import com.barlang.core.model.BacktestResult;
import com.barlang.core.model.PriceSeries;
import com.barlang.core.model.SignalSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule text to backtest result in one call: parse, evaluate signals, simulate.
 * Any stage failure propagates unchanged; there are no partial results.
 */
public class StrategyPipeline {

    private static final Logger log = LoggerFactory.getLogger(StrategyPipeline.class);

    private final SignalEvaluator evaluator;
    private final TradeSimulator simulator;

    public StrategyPipeline() {
        this(BacktestConfig.defaults());
    }

    public StrategyPipeline(BacktestConfig config) {
        this.evaluator = new SignalEvaluator();
        this.simulator = new TradeSimulator(config);
    }

    public PipelineResult run(String ruleText, PriceSeries series) {
        AstNode.Strategy strategy = new Parser().parse(ruleText);
        log.debug("Parsed rule: {}", strategy);
        return run(strategy, series);
    }

    public PipelineResult run(AstNode.Strategy strategy, PriceSeries series) {
        SignalSeries signals = evaluator.evaluate(series, strategy);
        BacktestResult backtest = simulator.run(series, signals);
        return new PipelineResult(strategy, signals, backtest);
    }

    /**
     * Everything produced by one pipeline run.
     */
    public record PipelineResult(AstNode.Strategy strategy, SignalSeries signals, BacktestResult backtest) {}
}
