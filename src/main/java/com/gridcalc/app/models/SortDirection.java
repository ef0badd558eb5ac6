package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gridcalc.app.exceptions.InvalidTypeException;

public enum SortDirection {
    ASC,
    DESC;

    @JsonCreator
    public static SortDirection fromValue(String value) {
        try {
            return SortDirection.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidTypeException("Unknown sort direction: " + value);
        }
    }
}
