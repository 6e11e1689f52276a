package com.barlang.core.model;

import java.time.LocalDate;

/**
 * Represents a completed or open long trade.
 * Exit fields, pnl and returnPct stay null until the trade is closed.
 */
public record Trade(
    LocalDate entryDate,
    double entryPrice,
    LocalDate exitDate,
    Double exitPrice,
    Double pnl,
    Double returnPct    // pnl / entryPrice * 100
) {
    /**
     * Create a new open trade
     */
    public static Trade open(LocalDate date, double price) {
        return new Trade(date, price, null, null, null, null);
    }

    /**
     * Close this trade at the given date and price
     */
    public Trade close(LocalDate date, double price) {
        if (!isOpen()) {
            throw new IllegalStateException("Trade entered on " + entryDate + " is already closed");
        }
        double pnl = price - entryPrice;
        double returnPct = pnl / entryPrice * 100;
        return new Trade(entryDate, entryPrice, date, price, pnl, returnPct);
    }

    public boolean isOpen() {
        return exitDate == null;
    }

    public boolean isWinner() {
        return pnl != null && pnl > 0;
    }
}
