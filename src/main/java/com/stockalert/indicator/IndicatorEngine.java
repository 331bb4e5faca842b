package com.stockalert.indicator;

import com.stockalert.model.OhlcvSeries;

/**
 * Derives the per-bar indicator columns used by the filters and triggers.
 *
 * Every column is aligned with the input series; bars without enough history hold {@code NaN}.
 */
public final class IndicatorEngine {
    public static final int SMA_SHORT = 25;
    public static final int SMA_MID = 50;
    public static final int SMA_LONG = 200;
    public static final int VOLUME_WINDOW = 20;
    public static final int HIGH_WINDOW = 20;
    public static final int HIGH_52W_WINDOW = 252;

    /**
     * Computes all columns in one pass over the series. Never fails; an empty series yields
     * empty columns.
     *
     * <p>{@code high20d} is the prior 20-bar high (current bar excluded), {@code high52w} the
     * inclusive 252-bar high and {@code drawdown20d} the distance of the close below the inclusive
     * 20-bar high.
     */
    public IndicatorSet compute(OhlcvSeries series) {
        double[] closes = series.closes();
        double[] highs = series.highs();
        double[] volumes = series.volumes();

        double[] sma25 = Rolling.mean(closes, SMA_SHORT);
        double[] sma50 = Rolling.mean(closes, SMA_MID);
        double[] sma200 = Rolling.mean(closes, SMA_LONG);
        double[] volMa20 = Rolling.mean(volumes, VOLUME_WINDOW);

        double[] high20Inclusive = Rolling.max(highs, HIGH_WINDOW);
        double[] high20d = Rolling.shift(high20Inclusive, 1);
        double[] high52w = Rolling.max(highs, HIGH_52W_WINDOW);

        double[] drawdown20d = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            double h = high20Inclusive[i];
            drawdown20d[i] = (h - closes[i]) / h;
        }

        return new IndicatorSet(sma25, sma50, sma200, volMa20, high20d, high52w, drawdown20d);
    }
}
