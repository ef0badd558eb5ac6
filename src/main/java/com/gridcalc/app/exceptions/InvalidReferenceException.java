package com.gridcalc.app.exceptions;

/**
 * Thrown when text that should be a cell address ("B12") or a column
 * label ("AA") is malformed, e.g. "12B", "B", "B0" or "B1x".
 * Formula evaluation recovers from it by falling back to A1;
 * at the HTTP boundary it becomes a 400.
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
