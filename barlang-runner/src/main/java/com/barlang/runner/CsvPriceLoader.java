package com.barlang.runner;

import com.barlang.core.model.DataException;
import com.barlang.core.model.PriceSeries;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a daily price series from a CSV file with a header row.
 *
 * <p>Columns are matched by name, case-insensitively and in any order. Only the
 * OHLCV columns present in the header end up in the series; the engine decides
 * whether a missing one is fatal. Empty cells load as NaN.</p>
 */
public class CsvPriceLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvPriceLoader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setTrim(true)
        .build();

    private final String dateColumn;

    public CsvPriceLoader() {
        this("date");
    }

    public CsvPriceLoader(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public PriceSeries load(Path path) throws IOException {
        log.info("Loading prices from: {}", path);
        try (Reader reader = Files.newBufferedReader(path)) {
            PriceSeries series = load(reader, path.toString());
            log.info("Loaded {} bars from {}", series.size(), path);
            return series;
        }
    }

    /**
     * @param source name used in error messages
     * @throws DataException if the date column is absent or a cell cannot be parsed
     */
    public PriceSeries load(Reader reader, String source) throws IOException {
        try (CSVParser parser = new CSVParser(reader, FORMAT)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null || !header.containsKey(dateColumn)) {
                throw new DataException(source + ": no '" + dateColumn + "' column in header");
            }

            List<String> fields = new ArrayList<>();
            for (String field : PriceSeries.REQUIRED_FIELDS) {
                if (header.containsKey(field)) {
                    fields.add(field);
                }
            }

            List<Row> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(parseRow(record, fields, source));
            }
            rows.sort(Comparator.comparing(Row::date));

            List<LocalDate> dates = new ArrayList<>(rows.size());
            Map<String, double[]> columns = new LinkedHashMap<>();
            for (String field : fields) {
                columns.put(field, new double[rows.size()]);
            }
            for (int i = 0; i < rows.size(); i++) {
                Row row = rows.get(i);
                dates.add(row.date());
                for (int f = 0; f < fields.size(); f++) {
                    columns.get(fields.get(f))[i] = row.values()[f];
                }
            }

            if (fields.size() < PriceSeries.REQUIRED_FIELDS.size()) {
                log.warn("{}: header has only {}", source, fields);
            }
            return PriceSeries.ofColumns(dates, columns);
        }
    }

    private Row parseRow(CSVRecord record, List<String> fields, String source) {
        long line = record.getParser().getCurrentLineNumber();
        LocalDate date = parseDate(record.get(dateColumn), source, line);

        double[] values = new double[fields.size()];
        for (int f = 0; f < fields.size(); f++) {
            String field = fields.get(f);
            String text = record.isSet(field) ? record.get(field) : "";
            values[f] = parseNumber(text, field, source, line);
        }
        return new Row(date, values);
    }

    private static LocalDate parseDate(String text, String source, long line) {
        try {
            // Accept timestamps by keeping the date part
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new DataException(source + " line " + line + ": invalid date '" + text + "'", e);
        }
    }

    private static double parseNumber(String text, String field, String source, long line) {
        if (text.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new DataException(source + " line " + line + ": invalid " + field + " '" + text + "'", e);
        }
    }

    private record Row(LocalDate date, double[] values) {}
}
