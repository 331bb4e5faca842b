package com.stockalert.runner;

import com.stockalert.model.Signal;
import com.stockalert.regime.RegimeScoreResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * What one daily run produced. {@code regime} is {@code null} when the regime step failed, in
 * which case {@code regimeError} holds the reason and the symbol lists are empty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class DailyRunOutcome {
    public final LocalDate asOf;
    public final RegimeScoreResult regime;
    public final String regimeError;
    public final List<Signal> signals;
    public final List<String> eligibleSymbols;
    public final List<String> skippedSymbols;
    public final Map<String, Integer> rejectedReasons;
    public final String title;
    public final List<String> lines;
    public final List<String> deliveredChannels;

    public boolean regimeFailed() {
        return regime == null;
    }
}
