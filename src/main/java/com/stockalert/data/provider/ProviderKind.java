package com.stockalert.data.provider;

import com.stockalert.config.Config;

import java.util.Locale;
import java.util.function.Function;

/**
 * Supported daily-bar sources, addressed in config by their lower-case id.
 */
public enum ProviderKind {
    TWELVE_DATA("twelvedata"),
    ALPHA_VANTAGE("alphavantage");

    private final String id;

    ProviderKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public DailySeriesProvider create(Config config, Function<String, String> env) {
        switch (this) {
            case TWELVE_DATA:
                return new TwelveDataProvider(
                        config.getString("data.twelvedata.base_url"),
                        config.getString("data.twelvedata.interval"),
                        config.getString("data.twelvedata.outputsize"),
                        env.apply(TwelveDataProvider.API_KEY_ENV)
                );
            case ALPHA_VANTAGE:
                return new AlphaVantageProvider(
                        config.getString("data.alphavantage.base_url"),
                        config.getString("data.alphavantage.function"),
                        config.getString("data.alphavantage.outputsize"),
                        env.apply(AlphaVantageProvider.API_KEY_ENV)
                );
            default:
                throw new IllegalStateException("unhandled provider " + this);
        }
    }

    public static ProviderKind fromId(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.id.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported provider: " + raw);
    }
}
