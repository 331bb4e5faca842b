package com.stockalert.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of the eligibility filter: eligible, or the list of reasons it was rejected.
 */
public final class EligibilityResult {
    public static final String NO_DATA = "no_data";
    public static final String INSUFFICIENT_HISTORY = "insufficient_history";
    public static final String CLOSE_BELOW_SMA50 = "close_below_sma50";
    public static final String SMA50_BELOW_SMA200 = "sma50_below_sma200";
    public static final String TOO_EXTENDED_52W = "too_extended_52w";
    public static final String DRAWDOWN_TOO_LARGE = "drawdown_too_large";

    public final boolean eligible;
    public final List<String> reasons;

    public EligibilityResult(boolean eligible, List<String> reasons) {
        this.eligible = eligible;
        this.reasons = reasons == null ? List.of() : Collections.unmodifiableList(reasons);
    }

    public static EligibilityResult rejected(String reason) {
        return new EligibilityResult(false, List.of(reason));
    }
}
