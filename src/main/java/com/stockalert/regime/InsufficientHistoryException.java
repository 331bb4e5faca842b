package com.stockalert.regime;

import java.util.List;

/**
 * A regime input is still unknown at the evaluation date; {@link #missing()} names which.
 */
public class InsufficientHistoryException extends RegimeException {
    private final List<String> missing;

    public InsufficientHistoryException(String message, List<String> missing) {
        super(message + " missing=" + missing);
        this.missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
