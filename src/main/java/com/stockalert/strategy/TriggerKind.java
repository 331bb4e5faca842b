package com.stockalert.strategy;

import java.util.Locale;

/**
 * Entry trigger codes as they appear in signals, report groups and the regime log.
 */
public enum TriggerKind {
    PULLBACK_25_BOUNCE,
    PULLBACK_50_BOUNCE,
    BREAKOUT_20D;

    public String code() {
        return name();
    }

    /**
     * Case-insensitive, surrounding whitespace ignored.
     */
    public static TriggerKind fromCode(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("trigger code is blank");
        }
        return TriggerKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
