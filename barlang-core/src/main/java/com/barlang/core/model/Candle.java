package com.barlang.core.model;

import java.time.LocalDate;

/**
 * OHLCV candle for one daily bar.
 */
public record Candle(
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    double volume
) {}
