package com.barlang.engine;

import com.barlang.core.model.BacktestConfig;
import com.barlang.core.model.BacktestResult;
import com.barlang.core.model.DataException;
import com.barlang.core.model.PerformanceMetrics;
import com.barlang.core.model.PriceSeries;
import com.barlang.core.model.SignalSeries;
import com.barlang.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Long-only trade simulator with next-bar execution.
 *
 * <p>Signals observed on bar i-1 are acted on at the open of bar i. Per bar, an exit is
 * processed before an entry, so one bar can close a position and open the next. A
 * position still open after the last bar is closed at that bar's close. Capital is fully
 * reinvested: each closed trade compounds capital by its return.</p>
 *
 * <p>All run state lives in a per-call {@link Run}, so one simulator can be shared.</p>
 */
public class TradeSimulator {

    private static final Logger log = LoggerFactory.getLogger(TradeSimulator.class);

    private final BacktestConfig config;

    public TradeSimulator() {
        this(BacktestConfig.defaults());
    }

    public TradeSimulator(BacktestConfig config) {
        this.config = config;
    }

    /**
     * Replay signals over the price series.
     *
     * @throws DataException if the series lacks a required field, the signals are not aligned with it,
     *                       or a price the run fills or marks at is missing
     */
    public BacktestResult run(PriceSeries series, SignalSeries signals) {
        series.requireFields();
        checkAlignment(series, signals);

        Run run = new Run(config.initialCapital());
        int n = series.size();

        for (int i = 0; i < n; i++) {
            LocalDate date = series.dateAt(i);

            // Signals from the previous bar; nothing is known before bar 0
            boolean entrySignal = i > 0 && signals.entryAt(i - 1);
            boolean exitSignal = i > 0 && signals.exitAt(i - 1);

            if (run.position != null && exitSignal) {
                run.close(date, price(series, i, PriceSeries.OPEN));
            }

            if (run.position == null && entrySignal) {
                run.open(date, price(series, i, PriceSeries.OPEN));
            }

            if (run.position != null) {
                run.markToMarket(price(series, i, PriceSeries.CLOSE));
            } else {
                run.equityCurve.add(run.capital);
            }
        }

        // Force-close at the final bar's close
        if (run.position != null) {
            run.close(series.dateAt(n - 1), price(series, n - 1, PriceSeries.CLOSE));
        }

        PerformanceMetrics metrics = PerformanceMetrics.calculate(
            run.trades, run.equityCurve, config.initialCapital(), run.capital);
        BacktestResult result = new BacktestResult(config, run.trades, metrics, run.equityCurve);

        log.debug("Simulated {} bars: {}", n, result.getSummary());
        return result;
    }

    private static double price(PriceSeries series, int index, String field) {
        double value = PriceSeries.OPEN.equals(field) ? series.openAt(index) : series.closeAt(index);
        if (!Double.isFinite(value)) {
            throw new DataException("Missing " + field + " price on " + series.dateAt(index) +
                " (bar " + index + ")");
        }
        return value;
    }

    private static void checkAlignment(PriceSeries series, SignalSeries signals) {
        if (signals == null) {
            throw new DataException("No signal series supplied");
        }
        if (signals.size() != series.size()) {
            throw new DataException("Signal series has " + signals.size() +
                " bars but price series has " + series.size());
        }
        if (!signals.dates().equals(series.dates())) {
            for (int i = 0; i < series.size(); i++) {
                if (!signals.dates().get(i).equals(series.dateAt(i))) {
                    throw new DataException("Signal date " + signals.dates().get(i) +
                        " does not match price date " + series.dateAt(i) + " at index " + i);
                }
            }
        }
    }

    /**
     * Mutable state of one simulation: Flat when position is null, Long otherwise.
     */
    private static final class Run {
        double capital;
        Trade position;
        final List<Trade> trades = new ArrayList<>();
        final List<Double> equityCurve = new ArrayList<>();

        Run(double initialCapital) {
            this.capital = initialCapital;
            equityCurve.add(initialCapital);
        }

        void open(LocalDate date, double price) {
            position = Trade.open(date, price);
        }

        void close(LocalDate date, double price) {
            Trade closed = position.close(date, price);
            capital *= 1 + closed.returnPct() / 100;
            trades.add(closed);
            position = null;
        }

        void markToMarket(double close) {
            double unrealizedReturn = (close - position.entryPrice()) / position.entryPrice() * 100;
            equityCurve.add(capital * (1 + unrealizedReturn / 100));
        }
    }
}
