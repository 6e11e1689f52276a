package com.barlang.runner;

import com.barlang.core.model.DataException;
import com.barlang.core.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvPriceLoaderTest {

    private final CsvPriceLoader loader = new CsvPriceLoader();

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(CsvPriceLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    @DisplayName("Loads all columns and sorts rows by date")
    void loadsAndSorts() throws Exception {
        PriceSeries series = loader.load(resource("prices.csv"));

        assertEquals(8, series.size());
        assertDoesNotThrow(series::requireFields);
        assertEquals(LocalDate.of(2024, 1, 2), series.dateAt(0));
        assertEquals(LocalDate.of(2024, 1, 4), series.dateAt(2));
        assertEquals(LocalDate.of(2024, 1, 5), series.dateAt(3));
        assertEquals(102.5, series.closeAt(2));
        assertEquals(1_500_000.0, series.valueAt(PriceSeries.VOLUME, 3));
    }

    @Test
    @DisplayName("Absent columns stay absent")
    void keepsOnlyPresentColumns() throws Exception {
        PriceSeries series = loader.load(resource("prices_no_volume.csv"));

        assertEquals(2, series.size());
        assertFalse(series.hasField("volume"));
        assertEquals(100.0, series.openAt(0));
        DataException e = assertThrows(DataException.class, series::requireFields);
        assertEquals(List.of("volume"), e.getMissingFields());
    }

    @Test
    @DisplayName("Malformed numbers are reported with field and line")
    void rejectsBadNumber() {
        DataException e = assertThrows(DataException.class, () -> loader.load(resource("prices_bad_number.csv")));

        assertTrue(e.getMessage().contains("close"));
        assertTrue(e.getMessage().contains("'n/a'"));
        assertTrue(e.getMessage().contains("line"));
    }

    @Test
    @DisplayName("Missing date column is rejected")
    void rejectsMissingDateColumn() {
        String csv = "open,high,low,close,volume\n1,2,0.5,1.5,100\n";

        assertThrows(DataException.class, () -> loader.load(new StringReader(csv), "inline"));
    }

    @Test
    @DisplayName("Duplicate dates are rejected")
    void rejectsDuplicateDates() {
        String csv = "date,open,high,low,close,volume\n"
            + "2024-01-02,1,2,0.5,1.5,100\n"
            + "2024-01-02,1,2,0.5,1.5,100\n";

        assertThrows(DataException.class, () -> loader.load(new StringReader(csv), "inline"));
    }

    @Test
    @DisplayName("Empty cells load as missing values; timestamps keep their date")
    void emptyCellsAndTimestamps() throws IOException {
        String csv = "timestamp,open,high,low,close,volume\n"
            + "2024-03-01 00:00:00,1,2,0.5,,100\n";

        PriceSeries series = new CsvPriceLoader("timestamp").load(new StringReader(csv), "inline");

        assertEquals(LocalDate.of(2024, 3, 1), series.dateAt(0));
        assertTrue(Double.isNaN(series.closeAt(0)));
    }

    @Test
    @DisplayName("Rejects invalid dates")
    void rejectsBadDate(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad-date.csv");
        Files.writeString(file, "date,open,high,low,close,volume\n01/02/2024,1,2,0.5,1.5,100\n");

        DataException e = assertThrows(DataException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("invalid date"));
    }
}
