package com.stockalert.output;

import com.stockalert.model.Signal;
import com.stockalert.regime.RegimeScoreResult;
import com.stockalert.strategy.TriggerKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Plain-text daily alert: title plus line body shared by every notification channel.
 */
public final class AlertReportBuilder {
    static final int TOP_REJECTED_LIMIT = 5;

    private AlertReportBuilder() {
    }

    public static String title(LocalDate runDate, RegimeScoreResult regime) {
        return "Stock Alerts " + runDate + " UTC | Regime " + regime.state.name();
    }

    public static String errorTitle(LocalDate runDate) {
        return "Stock Alerts " + runDate + " UTC | Regime ERROR";
    }

    public static List<String> configSummary(
            double sma50Tolerance,
            double drawdown20dMax,
            int ddWindow,
            double ddMax,
            boolean pullback25Enabled,
            boolean pullback50Enabled,
            boolean breakoutEnabled,
            double breakoutVolumeMult
    ) {
        List<String> lines = new ArrayList<>();
        lines.add("Legend: eligible_symbols=symbols passing all filters, triggered_symbols=symbols with a signal");
        lines.add(String.format(Locale.ROOT, "Filter: close>=SMA50*(1-%.2f)", sma50Tolerance));
        lines.add("Filter: SMA50>=SMA200*0.98");
        lines.add(String.format(Locale.ROOT, "Filter: dd_peak_N<=dd_max (N=%d, dd_max=%s)", ddWindow, ddMax));
        lines.add(String.format(Locale.ROOT, "Filter: drawdown_20d_max=%.2f", drawdown20dMax));
        lines.add("Trigger: PULLBACK_25=" + pullback25Enabled
                + " (low<=SMA25*(1+tol), close>=SMA25, volume<=vol_ma20)");
        lines.add("Trigger: PULLBACK_50=" + pullback50Enabled
                + " (low<=SMA50*(1+tol), close>=SMA50, volume<=vol_ma20, drawdown_20d<=max)");
        lines.add(String.format(
                Locale.ROOT,
                "Trigger: BREAKOUT_20D=%s (close>high_20d, close<=high_20d*1.05, volume>=vol_ma20*%.2f)",
                breakoutEnabled,
                breakoutVolumeMult
        ));
        return lines;
    }

    /**
     * Summary, signal groups (only when entries are allowed) and the per-run symbol lists.
     */
    public static List<String> body(
            RegimeScoreResult regime,
            List<Signal> signals,
            List<String> eligibleSymbols,
            Map<String, Integer> rejectedReasons,
            List<String> skippedSymbols
    ) {
        List<String> lines = new ArrayList<>();
        lines.add("RegimeScore: " + regime.toJson());

        TreeSet<String> triggered = new TreeSet<>();
        if (!regime.allowNewEntries) {
            lines.add(String.format(Locale.ROOT, "New entries stopped. max_exposure=%.2f", regime.maxExposure()));
        } else if (signals.isEmpty()) {
            lines.add("No signals.");
        } else {
            for (Map.Entry<TriggerKind, List<Signal>> group : groupByTrigger(signals).entrySet()) {
                lines.add("[" + group.getKey().code() + "]");
                for (Signal signal : group.getValue()) {
                    lines.add(String.format(
                            Locale.ROOT,
                            "- %s close=%.2f date=%s",
                            signal.symbol,
                            signal.close,
                            signal.date
                    ));
                    triggered.add(signal.symbol);
                }
            }
        }

        if (!eligibleSymbols.isEmpty()) {
            lines.add("eligible_symbols: " + String.join(", ", eligibleSymbols));
        }
        lines.add("triggered_symbols: " + (triggered.isEmpty() ? "[]" : String.join(", ", triggered)));
        String topRejected = topRejected(rejectedReasons);
        if (!topRejected.isEmpty()) {
            lines.add("top_rejected_reasons: " + topRejected);
        }
        if (!skippedSymbols.isEmpty()) {
            lines.add("Skipped symbols: " + String.join(", ", skippedSymbols));
        }
        return lines;
    }

    /**
     * Highest counts first; equal counts keep first-seen order.
     */
    static String topRejected(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < entries.size() && i < TOP_REJECTED_LIMIT; i++) {
            parts.add(entries.get(i).getKey() + ":" + entries.get(i).getValue());
        }
        return String.join(", ", parts);
    }

    private static Map<TriggerKind, List<Signal>> groupByTrigger(List<Signal> signals) {
        Map<TriggerKind, List<Signal>> grouped = new LinkedHashMap<>();
        for (Signal signal : signals) {
            grouped.computeIfAbsent(signal.trigger, k -> new ArrayList<>()).add(signal);
        }
        return grouped;
    }
}
