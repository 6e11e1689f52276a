package com.barlang.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TradeTest {

    private static final LocalDate ENTRY = LocalDate.of(2024, 5, 1);
    private static final LocalDate EXIT = LocalDate.of(2024, 5, 10);

    @Test
    @DisplayName("Open trade has no exit fields")
    void openTrade() {
        Trade trade = Trade.open(ENTRY, 100);

        assertTrue(trade.isOpen());
        assertNull(trade.exitPrice());
        assertNull(trade.pnl());
        assertFalse(trade.isWinner());
    }

    @Test
    @DisplayName("Closing realizes pnl and percentage return")
    void closeTrade() {
        Trade closed = Trade.open(ENTRY, 100).close(EXIT, 110);

        assertFalse(closed.isOpen());
        assertEquals(EXIT, closed.exitDate());
        assertEquals(10.0, closed.pnl(), 1e-9);
        assertEquals(10.0, closed.returnPct(), 1e-9);
        assertTrue(closed.isWinner());
    }

    @Test
    @DisplayName("A losing trade is not a winner")
    void losingTrade() {
        Trade closed = Trade.open(ENTRY, 200).close(EXIT, 150);

        assertEquals(-25.0, closed.returnPct(), 1e-9);
        assertFalse(closed.isWinner());
    }

    @Test
    @DisplayName("A trade closes only once")
    void closesOnce() {
        Trade closed = Trade.open(ENTRY, 100).close(EXIT, 110);

        assertThrows(IllegalStateException.class, () -> closed.close(EXIT, 120));
    }
}
