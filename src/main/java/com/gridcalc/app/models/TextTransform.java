package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gridcalc.app.exceptions.InvalidTypeException;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Data-cleanup operations applied to literal cells of a range.
 */
public enum TextTransform {
    TRIM(String::trim),
    UPPER(s -> s.toUpperCase(Locale.ROOT)),
    LOWER(s -> s.toLowerCase(Locale.ROOT));

    private final UnaryOperator<String> operation;

    TextTransform(UnaryOperator<String> operation) {
        this.operation = operation;
    }

    public String apply(String value) {
        return operation.apply(value);
    }

    @JsonCreator
    public static TextTransform fromValue(String value) {
        try {
            return TextTransform.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidTypeException("Unknown transform: " + value);
        }
    }
}
