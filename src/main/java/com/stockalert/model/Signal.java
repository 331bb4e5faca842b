package com.stockalert.model;

import com.stockalert.strategy.TriggerKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A fired trigger for one symbol at its latest bar.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Signal {
    public final String symbol;
    public final TriggerKind trigger;
    public final double close;
    public final LocalDate date;
}
