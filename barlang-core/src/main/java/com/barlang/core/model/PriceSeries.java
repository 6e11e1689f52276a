package com.barlang.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Daily OHLCV time series in columnar form.
 *
 * <p>Dates are strictly ascending with no duplicates and every column has one value
 * per date. A series built from explicit columns may lack some of the OHLCV fields;
 * consumers call {@link #requireFields()} to reject such a series.</p>
 *
 * <p>Instances are immutable: column accessors hand out copies, so a series can be
 * shared between evaluations.</p>
 */
public final class PriceSeries {

    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";
    public static final String VOLUME = "volume";

    public static final List<String> REQUIRED_FIELDS = List.of(OPEN, HIGH, LOW, CLOSE, VOLUME);

    private final List<LocalDate> dates;
    private final Map<String, double[]> columns;

    private PriceSeries(List<LocalDate> dates, Map<String, double[]> columns) {
        this.dates = List.copyOf(dates);
        this.columns = columns;
        validate();
    }

    /**
     * Build a complete series from candles (assumed in ascending date order).
     */
    public static PriceSeries ofCandles(List<Candle> candles) {
        int n = candles.size();
        List<LocalDate> dates = new ArrayList<>(n);
        double[] open = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] volume = new double[n];

        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            dates.add(c.date());
            open[i] = c.open();
            high[i] = c.high();
            low[i] = c.low();
            close[i] = c.close();
            volume[i] = c.volume();
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(OPEN, open);
        columns.put(HIGH, high);
        columns.put(LOW, low);
        columns.put(CLOSE, close);
        columns.put(VOLUME, volume);
        return new PriceSeries(dates, columns);
    }

    /**
     * Build a series from named columns. Column names are matched case-insensitively;
     * any subset of fields is accepted here.
     */
    public static PriceSeries ofColumns(List<LocalDate> dates, Map<String, double[]> columns) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            String name = e.getKey().toLowerCase(Locale.ROOT);
            if (copy.containsKey(name)) {
                throw new DataException("Duplicate column: " + e.getKey());
            }
            copy.put(name, e.getValue().clone());
        }
        return new PriceSeries(dates, copy);
    }

    private void validate() {
        for (int i = 0; i < dates.size(); i++) {
            if (i > 0) {
                int cmp = dates.get(i).compareTo(dates.get(i - 1));
                if (cmp == 0) {
                    throw new DataException("Duplicate date " + dates.get(i) + " at index " + i);
                }
                if (cmp < 0) {
                    throw new DataException("Dates not in ascending order: " + dates.get(i - 1) +
                        " followed by " + dates.get(i) + " at index " + i);
                }
            }
        }
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (e.getValue().length != dates.size()) {
                throw new DataException("Column '" + e.getKey() + "' has " + e.getValue().length +
                    " values for " + dates.size() + " dates");
            }
        }
    }

    /**
     * Reject a series lacking any of open, high, low, close, volume.
     */
    public void requireFields() {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!columns.containsKey(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw DataException.missingFields(missing);
        }
    }

    public int size() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public LocalDate dateAt(int index) {
        return dates.get(index);
    }

    public boolean hasField(String field) {
        return columns.containsKey(field);
    }

    /**
     * Copy of a column's values.
     */
    public double[] column(String field) {
        double[] values = columns.get(field);
        if (values == null) {
            throw DataException.missingFields(List.of(field));
        }
        return values.clone();
    }

    public double valueAt(String field, int index) {
        double[] values = columns.get(field);
        if (values == null) {
            throw DataException.missingFields(List.of(field));
        }
        return values[index];
    }

    public double openAt(int index) {
        return valueAt(OPEN, index);
    }

    public double closeAt(int index) {
        return valueAt(CLOSE, index);
    }

    @Override
    public String toString() {
        if (dates.isEmpty()) {
            return "PriceSeries[empty, fields=" + columns.keySet() + "]";
        }
        return "PriceSeries[" + dates.size() + " bars, " + dates.get(0) + " to " +
            dates.get(dates.size() - 1) + ", fields=" + columns.keySet() + "]";
    }
}
