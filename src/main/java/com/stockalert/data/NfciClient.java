package com.stockalert.data;

import com.stockalert.config.Config;
import com.stockalert.data.http.HttpClientEx;
import com.stockalert.model.ConditionsIndexSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chicago Fed National Financial Conditions Index. The weekly series comes from the FRED
 * graph CSV; the latest reading prefers the Chicago Fed file and falls back to FRED.
 */
public final class NfciClient {
    private static final Logger LOG = LogManager.getLogger(NfciClient.class);

    private final HttpClientEx http;
    private final String csvUrl;
    private final String fredNfciUrl;
    private final String fredAnfciUrl;
    private final int timeoutSeconds;

    public NfciClient(HttpClientEx http, String csvUrl, String fredNfciUrl, String fredAnfciUrl, int timeoutSeconds) {
        this.http = http;
        this.csvUrl = csvUrl;
        this.fredNfciUrl = fredNfciUrl;
        this.fredAnfciUrl = fredAnfciUrl;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public NfciClient(Config config, HttpClientEx http) {
        this(
                http,
                config.getString("nfci.csv_url"),
                config.getString("nfci.fred_nfci_url"),
                config.getString("nfci.fred_anfci_url"),
                config.getInt("nfci.request_timeout_seconds")
        );
    }

    public ConditionsIndexSeries fetchSeries() throws IOException, InterruptedException {
        TreeMap<LocalDate, Double> values = fetchFredSeries(fredNfciUrl);
        if (values.isEmpty()) {
            throw new IllegalStateException("NFCI series empty");
        }
        return new ConditionsIndexSeries(values);
    }

    public NfciSnapshot fetchLatest() throws IOException, InterruptedException {
        try {
            return fetchChicagoFed();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Chicago Fed NFCI csv failed, falling back to FRED. err=" + e.getMessage());
            return fetchFred();
        }
    }

    NfciSnapshot fetchChicagoFed() throws IOException, InterruptedException {
        List<String[]> rows = dataRows(http.getText(csvUrl, timeoutSeconds));
        if (rows.isEmpty()) {
            throw new IllegalStateException("NFCI CSV empty");
        }
        String[] latest = rows.get(rows.size() - 1);
        if (latest.length < 2) {
            throw new IllegalStateException("NFCI CSV row has no value");
        }
        double nfci = parseValue(latest[1]);
        if (Double.isNaN(nfci)) {
            throw new IllegalStateException("NFCI CSV latest value not numeric: " + latest[1]);
        }
        double anfci = latest.length >= 3 ? parseValue(latest[2]) : Double.NaN;
        return new NfciSnapshot(latest[0].trim(), nfci, anfci);
    }

    NfciSnapshot fetchFred() throws IOException, InterruptedException {
        TreeMap<LocalDate, Double> nfci = fetchFredSeries(fredNfciUrl);
        TreeMap<LocalDate, Double> anfci = fetchFredSeries(fredAnfciUrl);
        if (nfci.isEmpty()) {
            throw new IllegalStateException("FRED NFCI data empty");
        }
        Map.Entry<LocalDate, Double> latest = nfci.lastEntry();
        Double adjusted = anfci.get(latest.getKey());
        return new NfciSnapshot(
                latest.getKey().toString(),
                latest.getValue(),
                adjusted == null ? Double.NaN : adjusted
        );
    }

    private TreeMap<LocalDate, Double> fetchFredSeries(String url) throws IOException, InterruptedException {
        String body = http.getText(url, timeoutSeconds);
        TreeMap<LocalDate, Double> out = parseFredCsv(body);
        LOG.info("NFCI fetched url=" + url + " points=" + out.size());
        return out;
    }

    /**
     * {@code DATE,VALUE} rows; FRED marks missing weeks with {@code "."}, which are dropped.
     */
    static TreeMap<LocalDate, Double> parseFredCsv(String body) {
        List<String[]> rows = dataRows(body);
        if (rows.isEmpty()) {
            throw new IllegalStateException("FRED CSV empty");
        }
        TreeMap<LocalDate, Double> out = new TreeMap<>();
        for (String[] row : rows) {
            if (row.length < 2) {
                continue;
            }
            LocalDate date = parseDate(row[0]);
            double value = parseValue(row[1]);
            if (date == null || Double.isNaN(value)) {
                continue;
            }
            out.put(date, value);
        }
        return out;
    }

    private static List<String[]> dataRows(String body) {
        List<String[]> rows = new ArrayList<>();
        if (body == null) {
            return rows;
        }
        String[] lines = body.split("\\r?\\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            rows.add(line.split(",", -1));
        }
        return rows;
    }

    private static LocalDate parseDate(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.length() > 10) {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static double parseValue(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        try {
            double v = Double.parseDouble(raw.trim());
            return Double.isFinite(v) ? v : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
