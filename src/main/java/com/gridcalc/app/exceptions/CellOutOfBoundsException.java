package com.gridcalc.app.exceptions;

/**
 * Thrown when a request addresses a cell outside the sheet's
 * current rows x columns, e.g. "Cell K30 is outside the 20x10 grid".
 */
public class CellOutOfBoundsException extends RuntimeException {
    public CellOutOfBoundsException(String message) {
        super(message);
    }
}
