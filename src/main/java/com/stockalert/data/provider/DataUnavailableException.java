package com.stockalert.data.provider;

/**
 * Every configured provider failed for a symbol. The cause is the last provider's error.
 */
public class DataUnavailableException extends Exception {
    private final String symbol;

    public DataUnavailableException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
