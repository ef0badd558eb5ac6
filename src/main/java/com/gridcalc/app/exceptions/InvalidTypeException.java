package com.gridcalc.app.exceptions;

/**
 * Thrown when a request names a type the service doesn't know,
 * e.g. validation "currency" or transform "REVERSE".
 */
public class InvalidTypeException extends RuntimeException {
    public InvalidTypeException(String message) {
        super(message);
    }
}
