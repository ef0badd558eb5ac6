package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gridcalc.app.exceptions.InvalidTypeException;

/**
 * Per-cell content constraint: ANY, NUMBER or DATE.
 * A violation only raises a flag; the evaluated value is unaffected.
 */
public enum ValidationType {
    ANY,
    NUMBER,
    DATE;

    /**
     * Case-insensitive, so "number", "Date", "ANY" all work.
     */
    @JsonCreator
    public static ValidationType fromValue(String value) {
        if (value == null) {
            throw new InvalidTypeException("Validation type is required");
        }
        try {
            return ValidationType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidTypeException("Unknown validation type: " + value);
        }
    }
}
