package com.gridcalc.app.exceptions;

/**
 * Thrown when a structural edit can't be applied to the sheet as it is:
 * deleting the last row, growing past the configured limits,
 * sorting by a column outside the selected range, and so on.
 */
public class InvalidOperationException extends RuntimeException {
    public InvalidOperationException(String message) {
        super(message);
    }
}
