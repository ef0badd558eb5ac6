package com.gridcalc.app.exceptions;

/**
 * Thrown when a sheet ID is unknown to the in-memory store,
 * either never created or from a previous run of the service.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
