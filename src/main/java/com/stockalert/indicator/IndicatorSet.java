package com.stockalert.indicator;

/**
 * Rolling indicators aligned bar-for-bar with the series they were computed from.
 */
public final class IndicatorSet {
    private final double[] sma25;
    private final double[] sma50;
    private final double[] sma200;
    private final double[] volMa20;
    private final double[] high20d;
    private final double[] high52w;
    private final double[] drawdown20d;

    IndicatorSet(
            double[] sma25,
            double[] sma50,
            double[] sma200,
            double[] volMa20,
            double[] high20d,
            double[] high52w,
            double[] drawdown20d
    ) {
        this.sma25 = sma25;
        this.sma50 = sma50;
        this.sma200 = sma200;
        this.volMa20 = volMa20;
        this.high20d = high20d;
        this.high52w = high52w;
        this.drawdown20d = drawdown20d;
    }

    public int size() {
        return sma25.length;
    }

    public double sma25(int index) {
        return sma25[index];
    }

    public double sma50(int index) {
        return sma50[index];
    }

    public double sma200(int index) {
        return sma200[index];
    }

    public double volMa20(int index) {
        return volMa20[index];
    }

    /** Highest high of the 20 bars before {@code index}. */
    public double high20d(int index) {
        return high20d[index];
    }

    /** Highest high of the 252 bars ending at {@code index}. */
    public double high52w(int index) {
        return high52w[index];
    }

    public double drawdown20d(int index) {
        return drawdown20d[index];
    }
}
