package com.stockalert.strategy;

import com.stockalert.indicator.DrawdownCalculator;
import com.stockalert.indicator.IndicatorSet;
import com.stockalert.model.BarDaily;
import com.stockalert.model.OhlcvSeries;
import com.stockalert.model.TriggerResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Entry conditions evaluated against the latest bar. The evaluators are independent of each
 * other; a result that was evaluated carries the trigger code as its reason.
 */
public final class TriggerEngine {
    private static final Logger LOG = LogManager.getLogger(TriggerEngine.class);

    public static final String DD_RULE_ID = "FILTER_DD_002";
    static final double BREAKOUT_MAX_EXTENSION = 1.05;

    /**
     * Fires when the low touches {@code sma25*(1+tol)} and the close holds the average on no
     * more than the 20-day average volume.
     */
    public TriggerResult pullback25Bounce(OhlcvSeries series, IndicatorSet indicators, double tol) {
        if (series == null || series.isEmpty()) {
            return TriggerResult.notFired(TriggerResult.NO_DATA);
        }
        int idx = series.lastIndex();
        BarDaily latest = series.get(idx);
        double sma25 = indicators.sma25(idx);
        double volMa20 = indicators.volMa20(idx);
        if (Double.isNaN(sma25) || Double.isNaN(volMa20)) {
            return TriggerResult.notFired(TriggerResult.INSUFFICIENT_HISTORY);
        }
        boolean fired = latest.low <= sma25 * (1.0 + tol)
                && latest.close >= sma25
                && latest.volume <= volMa20;
        return new TriggerResult(fired, TriggerKind.PULLBACK_25_BOUNCE.code());
    }

    /**
     * Same shape as {@link #pullback25Bounce} against the 50-day average, and only while the
     * 20-day drawdown is within {@code drawdown20dMax}.
     */
    public TriggerResult pullback50Bounce(OhlcvSeries series, IndicatorSet indicators, double tol, double drawdown20dMax) {
        if (series == null || series.isEmpty()) {
            return TriggerResult.notFired(TriggerResult.NO_DATA);
        }
        int idx = series.lastIndex();
        BarDaily latest = series.get(idx);
        double sma50 = indicators.sma50(idx);
        double volMa20 = indicators.volMa20(idx);
        double drawdown20d = indicators.drawdown20d(idx);
        if (Double.isNaN(sma50) || Double.isNaN(volMa20) || Double.isNaN(drawdown20d)) {
            return TriggerResult.notFired(TriggerResult.INSUFFICIENT_HISTORY);
        }
        boolean fired = latest.low <= sma50 * (1.0 + tol)
                && latest.close >= sma50
                && latest.volume <= volMa20
                && drawdown20d <= drawdown20dMax;
        return new TriggerResult(fired, TriggerKind.PULLBACK_50_BOUNCE.code());
    }

    /**
     * The windowed drawdown guard runs before the breakout condition and always wins.
     */
    public TriggerResult breakout20d(
            OhlcvSeries series,
            IndicatorSet indicators,
            double volumeMult,
            int ddWindow,
            double ddMax
    ) {
        if (series == null || series.isEmpty()) {
            return TriggerResult.notFired(TriggerResult.NO_DATA);
        }
        String symbol = series.symbol();
        int idx = series.lastIndex();
        BarDaily latest = series.get(idx);
        double high20d = indicators.high20d(idx);
        double volMa20 = indicators.volMa20(idx);
        double ddValue = DrawdownCalculator.peakDrawdown(series.closes(), ddWindow)[idx];
        LOG.info(String.format(
                Locale.US,
                "DD_METRIC symbol=%s dd_metric=peak_N dd_window=%d dd_value=%s",
                symbol,
                ddWindow,
                Double.isNaN(ddValue) ? "nan" : String.format(Locale.US, "%.6f", ddValue)
        ));
        if (Double.isNaN(high20d) || Double.isNaN(volMa20)) {
            return TriggerResult.notFired(TriggerResult.INSUFFICIENT_HISTORY);
        }
        if (!Double.isNaN(ddValue) && ddValue > ddMax) {
            LOG.info(String.format(
                    Locale.US,
                    "EXCLUDE symbol=%s exclude_reason_rule_id=%s dd_metric=peak_N dd_window=%d dd_value=%.6f dd_max=%.6f",
                    symbol,
                    DD_RULE_ID,
                    ddWindow,
                    ddValue,
                    ddMax
            ));
            return TriggerResult.notFired(TriggerResult.DRAWDOWN_TOO_LARGE);
        }
        boolean fired = latest.close > high20d
                && latest.close <= high20d * BREAKOUT_MAX_EXTENSION
                && latest.volume >= volMa20 * volumeMult;
        return new TriggerResult(fired, TriggerKind.BREAKOUT_20D.code());
    }
}
