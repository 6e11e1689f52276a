package com.barlang.runner;

import com.barlang.core.model.Candle;
import com.barlang.core.model.PriceSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic random-walk price series on weekdays, for demos without a data file.
 * The same seed always yields the same series.
 */
public class SampleDataGenerator {

    static final LocalDate DEFAULT_START = LocalDate.of(2023, 1, 2);
    private static final double START_PRICE = 100.0;
    private static final double DAILY_VOLATILITY = 0.02;

    private final long seed;
    private final LocalDate start;

    public SampleDataGenerator(long seed) {
        this(seed, DEFAULT_START);
    }

    public SampleDataGenerator(long seed, LocalDate start) {
        this.seed = seed;
        this.start = start;
    }

    public PriceSeries generate(int bars) {
        if (bars < 0) {
            throw new IllegalArgumentException("Bar count must not be negative: " + bars);
        }
        Random random = new Random(seed);
        List<Candle> candles = new ArrayList<>(bars);

        LocalDate date = start;
        double previousClose = START_PRICE;
        for (int i = 0; i < bars; i++) {
            date = nextWeekday(date, i == 0);

            double open = previousClose * (1 + random.nextGaussian() * DAILY_VOLATILITY / 4);
            double close = open * (1 + random.nextGaussian() * DAILY_VOLATILITY);
            double high = Math.max(open, close) * (1 + random.nextDouble() * DAILY_VOLATILITY / 2);
            double low = Math.min(open, close) * (1 - random.nextDouble() * DAILY_VOLATILITY / 2);
            double volume = 500_000 + random.nextInt(1_500_000);

            candles.add(new Candle(date, round(open), round(high), round(low), round(close), volume));
            previousClose = close;
        }
        return PriceSeries.ofCandles(candles);
    }

    private static LocalDate nextWeekday(LocalDate date, boolean first) {
        LocalDate next = first ? date : date.plusDays(1);
        while (next.getDayOfWeek() == DayOfWeek.SATURDAY || next.getDayOfWeek() == DayOfWeek.SUNDAY) {
            next = next.plusDays(1);
        }
        return next;
    }

    private static double round(double price) {
        return Math.round(price * 100) / 100.0;
    }
}
