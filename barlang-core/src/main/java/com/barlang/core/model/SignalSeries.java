package com.barlang.core.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Entry and exit signals, one value per bar of the price series they were evaluated on.
 * Arrays are copied in and out, so an instance never changes after construction.
 */
public record SignalSeries(List<LocalDate> dates, boolean[] entry, boolean[] exit) {

    public SignalSeries {
        dates = List.copyOf(dates);
        if (entry.length != dates.size() || exit.length != dates.size()) {
            throw new DataException("Signal series length mismatch: " + dates.size() + " dates, " +
                entry.length + " entry values, " + exit.length + " exit values");
        }
        entry = entry.clone();
        exit = exit.clone();
    }

    /**
     * All-false signals aligned with a price series.
     */
    public static SignalSeries none(PriceSeries series) {
        return new SignalSeries(series.dates(), new boolean[series.size()], new boolean[series.size()]);
    }

    @Override
    public boolean[] entry() {
        return entry.clone();
    }

    @Override
    public boolean[] exit() {
        return exit.clone();
    }

    public int size() {
        return dates.size();
    }

    public boolean entryAt(int index) {
        return entry[index];
    }

    public boolean exitAt(int index) {
        return exit[index];
    }

    public int entryCount() {
        return count(entry);
    }

    public int exitCount() {
        return count(exit);
    }

    private static int count(boolean[] values) {
        int n = 0;
        for (boolean v : values) {
            if (v) n++;
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalSeries other)) return false;
        return dates.equals(other.dates)
            && Arrays.equals(entry, other.entry)
            && Arrays.equals(exit, other.exit);
    }

    @Override
    public int hashCode() {
        int result = dates.hashCode();
        result = 31 * result + Arrays.hashCode(entry);
        result = 31 * result + Arrays.hashCode(exit);
        return result;
    }

    @Override
    public String toString() {
        return "SignalSeries[" + dates.size() + " bars, " + entryCount() + " entry, " + exitCount() + " exit]";
    }
}
