package com.stockalert.data.provider;

import com.stockalert.data.http.HttpClientEx;
import com.stockalert.model.BarDaily;
import com.stockalert.model.OhlcvSeries;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Twelve Data {@code time_series}: {@code {"meta":{..},"values":[{"datetime":..,"open":..}],"status":"ok"}}.
 */
public final class TwelveDataProvider implements DailySeriesProvider {
    public static final String API_KEY_ENV = "TWELVE_DATA_API_KEY";

    private final String baseUrl;
    private final String interval;
    private final String outputSize;
    private final String apiKey;

    public TwelveDataProvider(String baseUrl, String interval, String outputSize, String apiKey) {
        this.baseUrl = baseUrl;
        this.interval = interval;
        this.outputSize = outputSize;
        this.apiKey = apiKey;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.TWELVE_DATA;
    }

    @Override
    public String requestUrl(String symbol) throws ProviderException {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new ProviderException(kind(), API_KEY_ENV + " not set");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", interval);
        params.put("outputsize", outputSize);
        params.put("apikey", apiKey.trim());
        return HttpClientEx.withQuery(baseUrl, params);
    }

    @Override
    public void validate(String symbol, JSONObject payload) throws ProviderException {
        if ("error".equalsIgnoreCase(payload.optString("status", ""))) {
            throw new ProviderException(kind(), "error response for " + symbol + ": "
                    + payload.optString("message", PayloadValues.snippet(payload)));
        }
        int code = payload.optInt("code", 0);
        if (code >= 400) {
            throw new ProviderException(kind(), "code=" + code + " for " + symbol + ": "
                    + payload.optString("message", PayloadValues.snippet(payload)));
        }
    }

    @Override
    public OhlcvSeries parse(String symbol, JSONObject payload) throws ProviderException {
        JSONArray values = payload.optJSONArray("values");
        if (values == null) {
            throw new ProviderException(kind(), "Unexpected Twelve Data response for " + symbol);
        }
        List<BarDaily> rows = new ArrayList<>(values.length());
        for (int i = 0; i < values.length(); i++) {
            JSONObject row = values.optJSONObject(i);
            if (row == null) {
                continue;
            }
            LocalDate date = PayloadValues.date(row.optString("datetime", null));
            if (date == null) {
                continue;
            }
            rows.add(new BarDaily(
                    symbol,
                    date,
                    PayloadValues.number(row, "open"),
                    PayloadValues.number(row, "high"),
                    PayloadValues.number(row, "low"),
                    PayloadValues.number(row, "close"),
                    PayloadValues.number(row, "volume")
            ));
        }
        return OhlcvSeries.fromUnsorted(symbol, rows);
    }
}
