package com.stockalert.indicator;

/**
 * Drawdown of each close from the highest close of the preceding {@code window} bars.
 */
public final class DrawdownCalculator {

    private DrawdownCalculator() {
    }

    /**
     * {@code 1 - close[t] / max(close[t-window .. t-1])}. The peak never includes bar t. The
     * result is {@code NaN} when the close or the peak is unknown, or the peak is zero.
     */
    public static double[] peakDrawdown(double[] closes, int window) {
        double[] peak = Rolling.shift(Rolling.max(closes, window), 1);
        double[] out = Rolling.nanFilled(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            double p = peak[i];
            if (!Double.isFinite(close) || !Double.isFinite(p) || p == 0.0) {
                continue;
            }
            out[i] = 1.0 - close / p;
        }
        return out;
    }
}
