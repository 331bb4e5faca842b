package com.stockalert.regime;

/**
 * The conditions index could not be lined up with the benchmark calendar.
 */
public class AlignmentException extends RegimeException {
    public AlignmentException(String message) {
        super(message);
    }
}
