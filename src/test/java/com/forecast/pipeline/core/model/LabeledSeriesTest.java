package com.forecast.pipeline.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabeledSeriesTest {

    private static final List<LocalDate> DATES = List.of(
            LocalDate.of(2015, 4, 21), LocalDate.of(2015, 4, 22));

    @Test
    @DisplayName("Map should keep name and index")
    void testMapKeepsShape() {
        LabeledSeries series = LabeledSeries.of("ewmac8", DATES, 1.0, -2.0);

        LabeledSeries doubled = series.map(v -> v * 2);

        assertEquals("ewmac8", doubled.getName());
        assertEquals(DATES, doubled.getIndex());
        assertArrayEquals(new double[]{2.0, -4.0}, doubled.toArray());
        assertTrue(series.hasSameShapeAs(doubled));
    }

    @Test
    @DisplayName("Should reject index and values of different length")
    void testLengthMismatch() {
        assertThrows(IllegalArgumentException.class, () -> LabeledSeries.of("x", DATES, 1.0));
    }

    @Test
    @DisplayName("Should not share the values array")
    void testImmutability() {
        double[] values = {1.0, 2.0};
        LabeledSeries series = LabeledSeries.of("x", DATES, values);
        values[0] = 99.0;
        series.toArray()[1] = 99.0;

        assertEquals(1.0, series.get(0));
        assertEquals(2.0, series.get(1));
    }

    @Test
    @DisplayName("Shape differs on name, length or labels")
    void testShapeComparison() {
        LabeledSeries series = LabeledSeries.of("x", DATES, 1.0, 2.0);

        assertFalse(series.hasSameShapeAs(LabeledSeries.of("y", DATES, 1.0, 2.0)));
        assertFalse(series.hasSameShapeAs(LabeledSeries.of("x", DATES.subList(0, 1), 1.0)));
        assertFalse(series.hasSameShapeAs(LabeledSeries.of("x",
                List.of(LocalDate.of(2015, 4, 21), LocalDate.of(2015, 4, 23)), 1.0, 2.0)));
        assertFalse(series.hasSameShapeAs(null));
    }

    @Test
    @DisplayName("Empty series maps to an empty series")
    void testEmpty() {
        LabeledSeries empty = LabeledSeries.empty("x");

        assertEquals(0, empty.map(v -> v + 1).size());
        assertTrue(empty.hasSameShapeAs(empty.map(v -> v + 1)));
    }

    @Test
    @DisplayName("Equality covers values")
    void testEquality() {
        assertEquals(LabeledSeries.of("x", DATES, 1.0, 2.0), LabeledSeries.of("x", DATES, 1.0, 2.0));
        assertNotEquals(LabeledSeries.of("x", DATES, 1.0, 2.0), LabeledSeries.of("x", DATES, 1.0, 3.0));
    }
}
