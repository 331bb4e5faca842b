package com.stockalert.data.provider;

import org.json.JSONObject;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

final class PayloadValues {

    private PayloadValues() {
    }

    /**
     * Numeric coercion: anything that is not a finite number becomes {@code NaN}.
     */
    static double number(JSONObject row, String key) {
        if (row == null || !row.has(key) || row.isNull(key)) {
            return Double.NaN;
        }
        Object raw = row.opt(key);
        if (raw instanceof Number) {
            double v = ((Number) raw).doubleValue();
            return Double.isFinite(v) ? v : Double.NaN;
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return Double.NaN;
        }
        try {
            double v = Double.parseDouble(text);
            return Double.isFinite(v) ? v : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * Leading {@code yyyy-MM-dd} of a date or datetime string, or {@code null}.
     */
    static LocalDate date(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.length() > 10) {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String snippet(JSONObject payload) {
        String text = payload == null ? "" : payload.toString();
        return text.length() > 200 ? text.substring(0, 200) : text;
    }
}
