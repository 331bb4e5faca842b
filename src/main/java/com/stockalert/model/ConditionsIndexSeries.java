package com.stockalert.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Dated observations of a financial-conditions index (weekly NFCI in production).
 */
public final class ConditionsIndexSeries {
    private final NavigableMap<LocalDate, Double> values;

    public ConditionsIndexSeries(Map<LocalDate, Double> values) {
        TreeMap<LocalDate, Double> copy = new TreeMap<>();
        if (values != null) {
            for (Map.Entry<LocalDate, Double> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        this.values = Collections.unmodifiableNavigableMap(copy);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public LocalDate firstDate() {
        return values.isEmpty() ? null : values.firstKey();
    }

    public LocalDate lastDate() {
        return values.isEmpty() ? null : values.lastKey();
    }

    /**
     * Value observed exactly on {@code date}, or {@code NaN}.
     */
    public double valueOn(LocalDate date) {
        Double v = values.get(date);
        return v == null ? Double.NaN : v;
    }
}
