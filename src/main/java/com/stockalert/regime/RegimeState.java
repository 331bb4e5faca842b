package com.stockalert.regime;

import com.stockalert.strategy.TriggerKind;

public enum RegimeState {
    RISK_ON_STRONG(80.0, ExposureLevel.FULL, true),
    RISK_ON(60.0, ExposureLevel.HIGH, true),
    NEUTRAL(40.0, ExposureLevel.MODERATE, false),
    RISK_OFF(20.0, ExposureLevel.LOW, false),
    RISK_OFF_STRONG(Double.NEGATIVE_INFINITY, ExposureLevel.MINIMAL, false);

    private final double minScore;
    private final ExposureLevel exposure;
    private final boolean allowsNewEntries;

    RegimeState(double minScore, ExposureLevel exposure, boolean allowsNewEntries) {
        this.minScore = minScore;
        this.exposure = exposure;
        this.allowsNewEntries = allowsNewEntries;
    }

    public ExposureLevel exposure() {
        return exposure;
    }

    public boolean allowsNewEntries() {
        return allowsNewEntries;
    }

    public boolean isRiskOn() {
        return this == RISK_ON_STRONG || this == RISK_ON;
    }

    public static RegimeState fromScore(double score) {
        for (RegimeState state : values()) {
            if (score >= state.minScore) {
                return state;
            }
        }
        return RISK_OFF_STRONG;
    }

    /**
     * Breakouts are regime independent; every other trigger needs a risk-on regime.
     */
    public static boolean regimeAllows(RegimeState state, TriggerKind trigger) {
        if (state != null && state.isRiskOn()) {
            return true;
        }
        return trigger == TriggerKind.BREAKOUT_20D;
    }
}
