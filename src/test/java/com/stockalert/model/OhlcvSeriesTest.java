package com.stockalert.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OhlcvSeriesTest {

    private static BarDaily bar(String date, double close) {
        return new BarDaily("AAA", LocalDate.parse(date), close, close, close, close, 100.0);
    }

    @Test
    void fromUnsorted_shouldSortAscendingAndKeepLastDuplicate() {
        OhlcvSeries series = OhlcvSeries.fromUnsorted("AAA", List.of(
                bar("2024-03-05", 3.0),
                bar("2024-03-01", 1.0),
                bar("2024-03-04", 2.0),
                bar("2024-03-01", 1.5)
        ));

        assertEquals(3, series.size());
        assertEquals(LocalDate.parse("2024-03-01"), series.dateAt(0));
        assertEquals(1.5, series.get(0).close, 1e-12);
        assertEquals(LocalDate.parse("2024-03-05"), series.latest().tradeDate);
    }

    @Test
    void constructor_shouldRejectNonIncreasingDates() {
        assertThrows(IllegalArgumentException.class, () -> new OhlcvSeries("AAA", List.of(
                bar("2024-03-02", 1.0),
                bar("2024-03-02", 2.0)
        )));
    }

    @Test
    void indexOnOrBefore_shouldFindLatestNotAfterDate() {
        OhlcvSeries series = OhlcvSeries.fromUnsorted("AAA", List.of(
                bar("2024-03-01", 1.0),
                bar("2024-03-04", 2.0),
                bar("2024-03-05", 3.0)
        ));

        assertEquals(1, series.indexOnOrBefore(LocalDate.parse("2024-03-04")));
        assertEquals(0, series.indexOnOrBefore(LocalDate.parse("2024-03-03")));
        assertEquals(2, series.indexOnOrBefore(LocalDate.parse("2025-01-01")));
        assertEquals(-1, series.indexOnOrBefore(LocalDate.parse("2024-02-29")));
        assertEquals(-1, OhlcvSeries.empty("AAA").indexOnOrBefore(LocalDate.parse("2024-02-29")));
    }

    @Test
    void emptySeriesShouldReportEmpty() {
        OhlcvSeries series = OhlcvSeries.fromUnsorted("AAA", null);
        assertTrue(series.isEmpty());
        assertEquals(0, series.closes().length);
    }
}
