package com.stockalert.strategy;

import com.stockalert.config.Config;
import com.stockalert.indicator.IndicatorSet;
import com.stockalert.model.BarDaily;
import com.stockalert.model.EligibilityResult;
import com.stockalert.model.OhlcvSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether the latest bar of a series may be evaluated by the triggers.
 */
public final class EligibilityFilter {
    static final double SMA50_VS_SMA200_FLOOR = 0.98;

    private final double drawdownMax;
    private final double high52wMaxMultiple;
    private final double sma50Tolerance;

    /**
     * Reads {@code filters.drawdown_20d_max}, {@code filters.high_52w_max_multiple} and
     * {@code filters.sma50_tolerance}.
     */
    public EligibilityFilter(Config config) {
        this(
                config.getDouble("filters.drawdown_20d_max"),
                config.getDouble("filters.high_52w_max_multiple"),
                config.getDouble("filters.sma50_tolerance", 0.0)
        );
    }

    public EligibilityFilter(double drawdownMax, double high52wMaxMultiple, double sma50Tolerance) {
        this.drawdownMax = drawdownMax;
        this.high52wMaxMultiple = high52wMaxMultiple;
        this.sma50Tolerance = sma50Tolerance;
    }

    public EligibilityResult check(OhlcvSeries series, IndicatorSet indicators) {
        return check(series, indicators, drawdownMax, high52wMaxMultiple, sma50Tolerance);
    }

    /**
     * Fails closed on missing data. Otherwise every rule is tested so that all violations are
     * reported, in rule order.
     */
    public static EligibilityResult check(
            OhlcvSeries series,
            IndicatorSet indicators,
            double drawdownMax,
            double high52wMaxMultiple,
            double sma50Tolerance
    ) {
        if (series == null || series.isEmpty()) {
            return EligibilityResult.rejected(EligibilityResult.NO_DATA);
        }
        int idx = series.lastIndex();
        BarDaily latest = series.get(idx);
        double close = latest.close;
        double sma50 = indicators.sma50(idx);
        double sma200 = indicators.sma200(idx);
        double high52w = indicators.high52w(idx);
        double drawdown20d = indicators.drawdown20d(idx);

        if (Double.isNaN(sma50) || Double.isNaN(sma200) || Double.isNaN(high52w)) {
            return EligibilityResult.rejected(EligibilityResult.INSUFFICIENT_HISTORY);
        }

        List<String> reasons = new ArrayList<>();
        if (close < sma50 * (1.0 - sma50Tolerance)) {
            reasons.add(EligibilityResult.CLOSE_BELOW_SMA50);
        }
        if (sma50 < sma200 * SMA50_VS_SMA200_FLOOR) {
            reasons.add(EligibilityResult.SMA50_BELOW_SMA200);
        }
        if (close > high52w * high52wMaxMultiple) {
            reasons.add(EligibilityResult.TOO_EXTENDED_52W);
        }
        if (drawdown20d > drawdownMax) {
            reasons.add(EligibilityResult.DRAWDOWN_TOO_LARGE);
        }
        return new EligibilityResult(reasons.isEmpty(), reasons);
    }

    public double drawdownMax() {
        return drawdownMax;
    }

    public double sma50Tolerance() {
        return sma50Tolerance;
    }
}
