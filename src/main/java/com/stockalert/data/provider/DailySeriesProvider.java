package com.stockalert.data.provider;

import com.stockalert.model.OhlcvSeries;
import org.json.JSONObject;

/**
 * One daily-bar HTTP source: how to ask for a symbol, how to recognise an error payload, and
 * how to turn a good payload into bars.
 */
public interface DailySeriesProvider {

    ProviderKind kind();

    /**
     * Full request URL including the API key.
     */
    String requestUrl(String symbol) throws ProviderException;

    /**
     * Raises when the payload carries this provider's error or rate-limit marker.
     */
    void validate(String symbol, JSONObject payload) throws ProviderException;

    OhlcvSeries parse(String symbol, JSONObject payload) throws ProviderException;
}
