package com.stockalert.data;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Latest published NFCI reading. {@code anfci} is {@code NaN} when the source has no adjusted
 * value for that week.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class NfciSnapshot {
    public final String date;
    public final double nfci;
    public final double anfci;
}
