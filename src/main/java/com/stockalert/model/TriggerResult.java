package com.stockalert.model;

/**
 * Result of one trigger evaluation. {@code reason} is the trigger code once indicators were available.
 */
public final class TriggerResult {
    public static final String NO_DATA = "no_data";
    public static final String INSUFFICIENT_HISTORY = "insufficient_history";
    public static final String DRAWDOWN_TOO_LARGE = "drawdown_too_large";

    public final boolean fired;
    public final String reason;

    public TriggerResult(boolean fired, String reason) {
        this.fired = fired;
        this.reason = reason == null ? "" : reason;
    }

    public static TriggerResult notFired(String reason) {
        return new TriggerResult(false, reason);
    }

    @Override
    public String toString() {
        return "TriggerResult{fired=" + fired + ", reason=" + reason + "}";
    }
}
