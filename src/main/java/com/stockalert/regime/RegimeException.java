package com.stockalert.regime;

/**
 * The regime step cannot produce a classification for the requested date.
 */
public class RegimeException extends Exception {
    public RegimeException(String message) {
        super(message);
    }
}
