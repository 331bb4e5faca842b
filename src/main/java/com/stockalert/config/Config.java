package com.stockalert.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered properties: built-in defaults, then classpath {@code config.properties}, then a
 * {@code config.properties} in the working directory (or an explicit file).
 */
public final class Config {
    public static final String FILE_NAME = "config.properties";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, workingDir.resolve(FILE_NAME));
    }

    public static Config load(Path workingDir, Path overrideFile) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath " + FILE_NAME + ": " + e.getMessage());
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            try (InputStream in = Files.newInputStream(overrideFile)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read " + overrideFile + ": " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Defaults plus the given values as overrides; nested maps flatten into dotted keys.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> values) {
        Config config = new Config(workingDir);
        flattenInto(config, "", values);
        return config;
    }

    /**
     * Directory that relative paths such as {@code rules.path} resolve against.
     */
    public Path workingDir() {
        return workingDir;
    }

    /**
     * Trimmed value of {@code key}; blank values fall back to the built-in default, then to {@code ""}.
     */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    /**
     * Accepts {@code true}, {@code 1}, {@code yes} and {@code on} in any case; anything else is false.
     */
    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "on".equalsIgnoreCase(value);
    }

    /**
     * Like {@link #getBoolean(String)}, but a missing or blank value yields {@code fallback}.
     */
    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    /**
     * Unparseable values fall back to the built-in default, then to 0.
     */
    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Unparseable values fall back to the built-in default, then to 0.0.
     */
    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Resolved against {@link #workingDir()}; a blank value yields the working directory itself.
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    /**
     * Comma or semicolon separated values, trimmed, blanks dropped.
     */
    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException when the key has no value and no default
     */
    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Where the effective value of {@code key} came from: override, resource or default.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(String.valueOf(item));
            }
            putValue(config, prefix, String.join(",", parts));
            return;
        }
        putValue(config, prefix, String.valueOf(value));
    }

    private static void putValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        config.overrideProps.setProperty(key.trim(), value == null ? "" : value);
        config.props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("app.timezone", "UTC");
        defaults.put("app.log_level", "INFO");
        defaults.put("symbols", "");
        defaults.put("benchmark.symbol", "QQQ");
        defaults.put("rules.path", "rules.json");

        defaults.put("data.provider_primary", "twelvedata");
        defaults.put("data.provider_fallback", "alphavantage");
        defaults.put("data.request_timeout_seconds", "30");
        defaults.put("data.twelvedata.base_url", "https://api.twelvedata.com/time_series");
        defaults.put("data.twelvedata.interval", "1day");
        defaults.put("data.twelvedata.outputsize", "300");
        defaults.put("data.alphavantage.base_url", "https://www.alphavantage.co/query");
        defaults.put("data.alphavantage.function", "TIME_SERIES_DAILY_ADJUSTED");
        defaults.put("data.alphavantage.outputsize", "full");
        defaults.put("data.cache.enabled", "true");
        defaults.put("data.cache.ttl_seconds", "43200");
        defaults.put("data.cache.dir", ".cache");
        defaults.put("data.retry.max_attempts", "3");
        defaults.put("data.retry.base_delay_seconds", "2.0");
        defaults.put("data.retry.max_delay_seconds", "30.0");
        defaults.put("data.rate_limit.enabled", "true");
        defaults.put("data.rate_limit.min_interval_seconds", "8.0");

        defaults.put("filters.drawdown_20d_max", "0.15");
        defaults.put("filters.high_52w_max_multiple", "1.05");
        defaults.put("filters.sma50_tolerance", "0.0");
        defaults.put("filters.tolerance", "0.005");

        defaults.put("triggers.pullback_25.enabled", "true");
        defaults.put("triggers.pullback_50.enabled", "true");
        defaults.put("triggers.breakout_20d.enabled", "true");
        defaults.put("triggers.breakout_volume_mult", "1.5");

        defaults.put("nfci.csv_url", "https://www.chicagofed.org/-/media/publications/nfci/nfci-data-series-csv.csv");
        defaults.put("nfci.fred_nfci_url", "https://fred.stlouisfed.org/graph/fredgraph.csv?id=NFCI");
        defaults.put("nfci.fred_anfci_url", "https://fred.stlouisfed.org/graph/fredgraph.csv?id=ANFCI");
        defaults.put("nfci.request_timeout_seconds", "30");

        defaults.put("notifications.slack_enabled", "false");
        defaults.put("notifications.pushover_enabled", "false");
        defaults.put("notifications.email_enabled", "true");
        defaults.put("notifications.request_timeout_seconds", "20");

        defaults.put("regime_log.enabled", "true");
        defaults.put("regime_log.path", "outputs/regime_log.xlsx");
        defaults.put("regime_log.sheet", "regime");
        return Collections.unmodifiableMap(defaults);
    }
}
