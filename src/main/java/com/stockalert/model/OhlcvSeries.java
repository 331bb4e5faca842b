package com.stockalert.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily bars ordered by strictly increasing trade date.
 */
public final class OhlcvSeries {
    private final String symbol;
    private final List<BarDaily> bars;

    public OhlcvSeries(String symbol, List<BarDaily> bars) {
        this.symbol = symbol == null ? "" : symbol;
        List<BarDaily> copy = bars == null ? List.of() : new ArrayList<>(bars);
        for (int i = 1; i < copy.size(); i++) {
            LocalDate prev = copy.get(i - 1).tradeDate;
            LocalDate cur = copy.get(i).tradeDate;
            if (prev == null || cur == null || !cur.isAfter(prev)) {
                throw new IllegalArgumentException("bar dates must be strictly increasing: symbol="
                        + this.symbol + " index=" + i + " prev=" + prev + " cur=" + cur);
            }
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    /**
     * Sorts parsed rows by date. A later row with the same date replaces the earlier one.
     */
    public static OhlcvSeries fromUnsorted(String symbol, List<BarDaily> rows) {
        if (rows == null || rows.isEmpty()) {
            return new OhlcvSeries(symbol, List.of());
        }
        Map<LocalDate, BarDaily> byDate = new LinkedHashMap<>();
        for (BarDaily row : rows) {
            if (row == null || row.tradeDate == null) {
                continue;
            }
            byDate.put(row.tradeDate, row);
        }
        List<BarDaily> sorted = new ArrayList<>(byDate.values());
        sorted.sort(Comparator.comparing(b -> b.tradeDate));
        return new OhlcvSeries(symbol, sorted);
    }

    public static OhlcvSeries empty(String symbol) {
        return new OhlcvSeries(symbol, List.of());
    }

    public String symbol() {
        return symbol;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public BarDaily get(int index) {
        return bars.get(index);
    }

    public BarDaily latest() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public int lastIndex() {
        return bars.size() - 1;
    }

    public LocalDate dateAt(int index) {
        return bars.get(index).tradeDate;
    }

    /**
     * Index of the latest bar dated on or before {@code date}, or -1.
     */
    public int indexOnOrBefore(LocalDate date) {
        int lo = 0;
        int hi = bars.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (!bars.get(mid).tradeDate.isAfter(date)) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    public double[] closes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).close;
        }
        return out;
    }

    public double[] highs() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).high;
        }
        return out;
    }

    public double[] volumes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).volume;
        }
        return out;
    }
}
