package com.stockalert.indicator;

import java.util.Arrays;

/**
 * Trailing-window statistics over aligned series. A window that is incomplete or that
 * contains an unknown ({@code NaN}) value yields {@code NaN}.
 */
public final class Rolling {

    private Rolling() {
    }

    public static double[] mean(double[] values, int window) {
        double[] out = nanFilled(values.length);
        if (window <= 0) {
            return out;
        }
        for (int i = window - 1; i < values.length; i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (complete) {
                out[i] = sum / window;
            }
        }
        return out;
    }

    public static double[] max(double[] values, int window) {
        double[] out = nanFilled(values.length);
        if (window <= 0) {
            return out;
        }
        for (int i = window - 1; i < values.length; i++) {
            double best = Double.NEGATIVE_INFINITY;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    complete = false;
                    break;
                }
                best = Math.max(best, values[j]);
            }
            if (complete) {
                out[i] = best;
            }
        }
        return out;
    }

    /**
     * Moves every value {@code periods} positions later; the first slots become {@code NaN}.
     */
    public static double[] shift(double[] values, int periods) {
        double[] out = nanFilled(values.length);
        for (int i = periods; i < values.length; i++) {
            out[i] = values[i - periods];
        }
        return out;
    }

    /**
     * {@code values[i] - values[i - periods]}.
     */
    public static double[] diff(double[] values, int periods) {
        double[] lagged = shift(values, periods);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - lagged[i];
        }
        return out;
    }

    static double[] nanFilled(int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
