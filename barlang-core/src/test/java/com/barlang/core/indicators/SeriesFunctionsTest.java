package com.barlang.core.indicators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SeriesFunctionsTest {

    @Test
    @DisplayName("Shift moves values forward and pads with NaN")
    void shift() {
        double[] shifted = SeriesFunctions.shift(new double[]{1, 2, 3, 4}, 1);

        assertTrue(Double.isNaN(shifted[0]));
        assertArrayEquals(new double[]{1, 2, 3}, Arrays.copyOfRange(shifted, 1, 4));
    }

    @Test
    @DisplayName("Shift longer than the series is all NaN")
    void shiftPastEnd() {
        double[] shifted = SeriesFunctions.shift(new double[]{1, 2, 3}, 5);

        assertEquals(3, shifted.length);
        for (double v : shifted) {
            assertTrue(Double.isNaN(v));
        }
    }

    @Test
    @DisplayName("Shift by zero copies the input")
    void shiftZero() {
        double[] values = {1, 2};
        double[] shifted = SeriesFunctions.shift(values, 0);

        assertArrayEquals(values, shifted);
        assertNotSame(values, shifted);
    }

    @Test
    @DisplayName("Negative shift would look ahead and is rejected")
    void rejectsNegativeShift() {
        assertThrows(IllegalArgumentException.class, () -> SeriesFunctions.shift(new double[]{1}, -1));
    }

    @Test
    @DisplayName("Constant broadcasts a scalar")
    void constant() {
        assertArrayEquals(new double[]{7, 7, 7}, SeriesFunctions.constant(7, 3));
    }
}
