package com.stockalert.data.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * One JSON file per key holding {@code {"ts": epochSeconds, "value": payload}}. Entries older
 * than the TTL read as misses; nothing is ever swept.
 */
public class FileCache {
    private static final Logger LOG = LogManager.getLogger(FileCache.class);

    private final Path root;
    private final long ttlSeconds;
    private final Clock clock;

    public FileCache(Path root, long ttlSeconds) throws IOException {
        this(root, ttlSeconds, Clock.systemUTC());
    }

    public FileCache(Path root, long ttlSeconds, Clock clock) throws IOException {
        this.root = root;
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
        Files.createDirectories(root);
    }

    Path pathFor(String key) {
        String safe = key.replace("/", "_").replace(":", "_");
        return root.resolve(safe + ".json");
    }

    /**
     * Cached payload, or {@code null} when absent, unreadable or expired.
     */
    public JSONObject get(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            return null;
        }
        try {
            JSONObject entry = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
            double ts = entry.optDouble("ts", 0.0);
            double age = nowSeconds() - ts;
            if (age > ttlSeconds) {
                return null;
            }
            return entry.optJSONObject("value");
        } catch (IOException | JSONException e) {
            LOG.warn("cache entry unreadable, treating as miss key=" + key + " err=" + e.getMessage());
            return null;
        }
    }

    public void put(String key, JSONObject value) throws IOException {
        JSONObject entry = new JSONObject();
        entry.put("ts", nowSeconds());
        entry.put("value", value);
        Files.writeString(pathFor(key), entry.toString(), StandardCharsets.UTF_8);
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }
}
