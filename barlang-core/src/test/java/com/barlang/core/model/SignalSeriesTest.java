package com.barlang.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalSeriesTest {

    private static final List<LocalDate> DATES = List.of(
        LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 5));

    @Test
    @DisplayName("Counts signals")
    void counts() {
        SignalSeries signals = new SignalSeries(DATES,
            new boolean[]{true, false, true}, new boolean[]{false, true, false});

        assertEquals(3, signals.size());
        assertEquals(2, signals.entryCount());
        assertEquals(1, signals.exitCount());
        assertTrue(signals.exitAt(1));
    }

    @Test
    @DisplayName("Rejects arrays that do not match the dates")
    void rejectsLengthMismatch() {
        assertThrows(DataException.class,
            () -> new SignalSeries(DATES, new boolean[2], new boolean[3]));
    }

    @Test
    @DisplayName("Equality compares array contents")
    void equalityByContent() {
        SignalSeries a = new SignalSeries(DATES, new boolean[]{true, false, false}, new boolean[3]);
        SignalSeries b = new SignalSeries(DATES, new boolean[]{true, false, false}, new boolean[3]);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    @DisplayName("Accessors return copies")
    void defensiveCopies() {
        boolean[] entry = {false, false, false};
        SignalSeries signals = new SignalSeries(DATES, entry, new boolean[3]);

        entry[0] = true;
        signals.entry()[1] = true;

        assertEquals(0, signals.entryCount());
    }
}
