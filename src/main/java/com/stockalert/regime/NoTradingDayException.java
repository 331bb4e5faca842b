package com.stockalert.regime;

/**
 * No benchmark bar exists on or before the requested date.
 */
public class NoTradingDayException extends RegimeException {
    public NoTradingDayException(String message) {
        super(message);
    }
}
