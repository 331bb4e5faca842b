package com.stockalert.data.provider;

import com.stockalert.config.Config;
import com.stockalert.data.cache.FileCache;
import com.stockalert.data.http.HttpClientEx;
import com.stockalert.model.OhlcvSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

/**
 * Daily bars for a symbol from an ordered list of providers. Each provider gets
 * {@link RetryPolicy#maxAttempts()} tries; the first non-empty parsed series wins.
 */
public final class MarketDataFetcher {
    private static final Logger LOG = LogManager.getLogger(MarketDataFetcher.class);

    private final List<DailySeriesProvider> providers;
    private final HttpClientEx http;
    private final FileCache cache;
    private final RetryPolicy retryPolicy;
    private final RequestThrottle throttle;
    private final TimeSource time;
    private final DoubleSupplier jitter;
    private final int timeoutSeconds;

    public MarketDataFetcher(
            List<DailySeriesProvider> providers,
            HttpClientEx http,
            FileCache cache,
            RetryPolicy retryPolicy,
            RequestThrottle throttle,
            TimeSource time,
            DoubleSupplier jitter,
            int timeoutSeconds
    ) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("at least one provider is required");
        }
        this.providers = List.copyOf(providers);
        this.http = http;
        this.cache = cache;
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
        this.time = time;
        this.jitter = jitter;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public static MarketDataFetcher fromConfig(Config config) throws IOException {
        return fromConfig(config, System::getenv, new HttpClientEx());
    }

    public static MarketDataFetcher fromConfig(Config config, Function<String, String> env, HttpClientEx http)
            throws IOException {
        List<DailySeriesProvider> providers = new ArrayList<>();
        providers.add(ProviderKind.fromId(config.getString("data.provider_primary")).create(config, env));
        String fallback = config.getString("data.provider_fallback");
        if (!fallback.isEmpty()) {
            providers.add(ProviderKind.fromId(fallback).create(config, env));
        }

        FileCache cache = null;
        if (config.getBoolean("data.cache.enabled", true)) {
            cache = new FileCache(config.getPath("data.cache.dir"), config.getLong("data.cache.ttl_seconds", 43200L));
        }
        RetryPolicy retry = new RetryPolicy(
                config.getInt("data.retry.max_attempts"),
                config.getDouble("data.retry.base_delay_seconds"),
                config.getDouble("data.retry.max_delay_seconds")
        );
        double minInterval = config.getDouble("data.rate_limit.min_interval_seconds");
        RequestThrottle throttle = new RequestThrottle(
                config.getBoolean("data.rate_limit.enabled", true),
                Duration.ofMillis(Math.round(minInterval * 1000.0)),
                TimeSource.SYSTEM
        );
        return new MarketDataFetcher(
                providers,
                http,
                cache,
                retry,
                throttle,
                TimeSource.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble(0.0, RetryPolicy.MAX_JITTER_SECONDS),
                config.getInt("data.request_timeout_seconds")
        );
    }

    public OhlcvSeries fetchDaily(String symbol) throws DataUnavailableException {
        ProviderException lastError = null;
        for (DailySeriesProvider provider : providers) {
            try {
                JSONObject payload = fetchWithRetry(provider, symbol);
                OhlcvSeries series = provider.parse(symbol, payload);
                if (series.isEmpty()) {
                    throw new ProviderException(provider.kind(), "no rows for " + symbol);
                }
                return series;
            } catch (ProviderException e) {
                LOG.warn("provider failed provider=" + provider.kind().id() + " symbol=" + symbol + " err=" + e.getMessage());
                lastError = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DataUnavailableException(symbol, "fetch interrupted for " + symbol, e);
            }
        }
        String message = lastError == null ? "no data provider available" : lastError.getMessage();
        throw new DataUnavailableException(symbol, message, lastError);
    }

    JSONObject fetchWithRetry(DailySeriesProvider provider, String symbol)
            throws ProviderException, InterruptedException {
        String url = provider.requestUrl(symbol);
        ProviderException lastError = null;
        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            try {
                return loadPayload(provider, symbol, url, attempt + 1);
            } catch (ProviderException e) {
                lastError = e;
                if (attempt + 1 >= retryPolicy.maxAttempts()) {
                    break;
                }
                Duration delay = retryPolicy.backoffDelay(attempt, jitter.getAsDouble(), throttle);
                LOG.info("retry provider=" + provider.kind().id() + " symbol=" + symbol
                        + " attempt=" + (attempt + 1) + " delay_ms=" + delay.toMillis() + " err=" + e.getMessage());
                time.sleep(delay);
            }
        }
        throw lastError;
    }

    private JSONObject loadPayload(DailySeriesProvider provider, String symbol, String url, int attempt)
            throws ProviderException, InterruptedException {
        String key = provider.kind().id() + ":" + symbol;
        if (cache != null) {
            JSONObject cached = cache.get(key);
            if (cached != null) {
                LOG.info("FETCH provider=" + provider.kind().id() + " symbol=" + symbol + " source=cache attempt=" + attempt);
                return cached;
            }
        }

        throttle.acquire();
        LOG.info("FETCH provider=" + provider.kind().id() + " symbol=" + symbol + " source=network attempt=" + attempt);
        JSONObject payload;
        try {
            payload = new JSONObject(http.getText(url, timeoutSeconds));
        } catch (IOException e) {
            throw new ProviderException(provider.kind(), "request failed for " + symbol + ": " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new ProviderException(provider.kind(), "invalid JSON for " + symbol + ": " + e.getMessage(), e);
        }
        provider.validate(symbol, payload);

        if (cache != null) {
            try {
                cache.put(key, payload);
            } catch (IOException e) {
                LOG.warn("cache write failed key=" + key + " err=" + e.getMessage());
            }
        }
        return payload;
    }
}
