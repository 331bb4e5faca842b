package com.stockalert.data.provider;

import com.stockalert.data.http.HttpClientEx;
import com.stockalert.model.BarDaily;
import com.stockalert.model.OhlcvSeries;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alpha Vantage daily-adjusted series keyed by date under {@code "Time Series (Daily)"}.
 * Throttling notices arrive as HTTP 200 with a {@code Note} or {@code Information} field.
 */
public final class AlphaVantageProvider implements DailySeriesProvider {
    public static final String API_KEY_ENV = "ALPHA_VANTAGE_API_KEY";
    static final String SERIES_KEY = "Time Series (Daily)";

    private final String baseUrl;
    private final String function;
    private final String outputSize;
    private final String apiKey;

    public AlphaVantageProvider(String baseUrl, String function, String outputSize, String apiKey) {
        this.baseUrl = baseUrl;
        this.function = function;
        this.outputSize = outputSize;
        this.apiKey = apiKey;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ALPHA_VANTAGE;
    }

    @Override
    public String requestUrl(String symbol) throws ProviderException {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new ProviderException(kind(), API_KEY_ENV + " not set");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", function);
        params.put("symbol", symbol);
        params.put("outputsize", outputSize);
        params.put("apikey", apiKey.trim());
        return HttpClientEx.withQuery(baseUrl, params);
    }

    @Override
    public void validate(String symbol, JSONObject payload) throws ProviderException {
        if (payload.has("Note")) {
            throw new ProviderException(kind(), "rate limited for " + symbol + ": " + payload.optString("Note"));
        }
        if (payload.has("Information")) {
            throw new ProviderException(kind(), "rate limited for " + symbol + ": " + payload.optString("Information"));
        }
        if (payload.has("Error Message")) {
            throw new ProviderException(kind(), "error response for " + symbol + ": " + PayloadValues.snippet(payload));
        }
    }

    @Override
    public OhlcvSeries parse(String symbol, JSONObject payload) throws ProviderException {
        JSONObject series = payload.optJSONObject(SERIES_KEY);
        if (series == null) {
            throw new ProviderException(kind(), "Unexpected Alpha Vantage response for " + symbol);
        }
        List<BarDaily> rows = new ArrayList<>(series.length());
        for (String dateKey : series.keySet()) {
            LocalDate date = PayloadValues.date(dateKey);
            JSONObject row = series.optJSONObject(dateKey);
            if (date == null || row == null) {
                continue;
            }
            double volume = PayloadValues.number(row, "6. volume");
            if (Double.isNaN(volume)) {
                volume = PayloadValues.number(row, "5. volume");
            }
            rows.add(new BarDaily(
                    symbol,
                    date,
                    PayloadValues.number(row, "1. open"),
                    PayloadValues.number(row, "2. high"),
                    PayloadValues.number(row, "3. low"),
                    PayloadValues.number(row, "4. close"),
                    volume
            ));
        }
        return OhlcvSeries.fromUnsorted(symbol, rows);
    }
}
