package com.stockalert.data;

import com.stockalert.data.http.FakeHttpClientEx;
import com.stockalert.data.http.HttpStatusException;
import com.stockalert.model.ConditionsIndexSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NfciClientTest {

    private static final String CHICAGO = "https://chicagofed.test/nfci.csv";
    private static final String FRED_NFCI = "https://fred.test/graph.csv?id=NFCI";
    private static final String FRED_ANFCI = "https://fred.test/graph.csv?id=ANFCI";

    private final FakeHttpClientEx http = new FakeHttpClientEx();
    private final NfciClient client = new NfciClient(http, CHICAGO, FRED_NFCI, FRED_ANFCI, 30);

    @Test
    void parseFredCsv_shouldDropMissingMarkers() {
        TreeMap<LocalDate, Double> values = NfciClient.parseFredCsv(
                "observation_date,NFCI\n2024-01-05,-0.50\n2024-01-12,.\n2024-01-19,-0.48\n");

        assertEquals(2, values.size());
        assertEquals(-0.48, values.get(LocalDate.of(2024, 1, 19)), 1e-12);
    }

    @Test
    void fetchSeries_shouldReturnSortedIndex() throws Exception {
        http.on("id=NFCI", "DATE,NFCI\r\n2024-01-19,-0.48\r\n2024-01-05,-0.50\r\n");

        ConditionsIndexSeries series = client.fetchSeries();

        assertEquals(LocalDate.of(2024, 1, 5), series.firstDate());
        assertEquals(LocalDate.of(2024, 1, 19), series.lastDate());
        assertEquals(-0.50, series.valueOn(LocalDate.of(2024, 1, 5)), 1e-12);
        assertTrue(Double.isNaN(series.valueOn(LocalDate.of(2024, 1, 12))));
    }

    @Test
    void fetchSeries_shouldFailWhenNoNumericRows() {
        http.on("id=NFCI", "DATE,NFCI\n2024-01-05,.\n");

        IllegalStateException e = assertThrows(IllegalStateException.class, client::fetchSeries);
        assertEquals("NFCI series empty", e.getMessage());
    }

    @Test
    void fetchLatest_shouldPreferChicagoFedFile() throws Exception {
        http.on("chicagofed", "Friday_of_Week,NFCI,ANFCI\n1/5/2024,-0.50,-0.40\n1/12/2024,-0.49,-0.41\n");

        NfciSnapshot latest = client.fetchLatest();

        assertEquals("1/12/2024", latest.date);
        assertEquals(-0.49, latest.nfci, 1e-12);
        assertEquals(-0.41, latest.anfci, 1e-12);
        assertEquals(0, http.count("fred.test"));
    }

    @Test
    void fetchLatest_shouldFallBackToFredSeries() throws Exception {
        http.on("chicagofed", new HttpStatusException(500, CHICAGO));
        http.on("id=ANFCI", "DATE,ANFCI\n2024-01-05,-0.40\n");
        http.on("id=NFCI", "DATE,NFCI\n2024-01-05,-0.50\n2024-01-12,-0.49\n");

        NfciSnapshot latest = client.fetchLatest();

        assertEquals("2024-01-12", latest.date);
        assertEquals(-0.49, latest.nfci, 1e-12);
        assertTrue(Double.isNaN(latest.anfci));
    }
}
