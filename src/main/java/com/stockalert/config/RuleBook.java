package com.stockalert.config;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named rules with free-form parameters, read from {@code {"rules":[{"rule_id":..,"params":{..}}]}}.
 */
public final class RuleBook {
    public static final String BUNDLED_RESOURCE = "rules.json";

    private final Map<String, JSONObject> rules;

    public RuleBook(List<JSONObject> rules) {
        Map<String, JSONObject> byId = new LinkedHashMap<>();
        if (rules != null) {
            for (JSONObject rule : rules) {
                String id = rule == null ? "" : rule.optString("rule_id", "").trim();
                if (!id.isEmpty()) {
                    byId.put(id, rule);
                }
            }
        }
        this.rules = byId;
    }

    public static RuleBook load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new IOException("rules file not found: " + path);
        }
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * The file when it exists, else the {@code rules.json} bundled on the classpath.
     */
    public static RuleBook loadOrBundled(Path path) throws IOException {
        if (path != null && Files.exists(path)) {
            return load(path);
        }
        try (InputStream in = RuleBook.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IOException("rules file not found: " + path + " and no bundled " + BUNDLED_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static RuleBook parse(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json == null ? "{}" : json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("rules file is not a JSON object: " + e.getMessage(), e);
        }
        JSONArray array = root.optJSONArray("rules");
        List<JSONObject> out = new ArrayList<>();
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                JSONObject rule = array.optJSONObject(i);
                if (rule != null) {
                    out.add(rule);
                }
            }
        }
        return new RuleBook(out);
    }

    public static RuleBook empty() {
        return new RuleBook(List.of());
    }

    public boolean has(String ruleId) {
        return rules.containsKey(ruleId);
    }

    public JSONObject rule(String ruleId) {
        JSONObject rule = rules.get(ruleId);
        if (rule == null) {
            throw new IllegalArgumentException("rule not found: " + ruleId);
        }
        return rule;
    }

    public JSONObject params(String ruleId) {
        JSONObject params = rule(ruleId).optJSONObject("params");
        return params == null ? new JSONObject() : params;
    }

    public int intParam(String ruleId, String name, int fallback) {
        return params(ruleId).optInt(name, fallback);
    }

    public double doubleParam(String ruleId, String name, double fallback) {
        return params(ruleId).optDouble(name, fallback);
    }
}
