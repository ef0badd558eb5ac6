package com.gridcalc.app.models;

import java.util.List;

/**
 * What GET /sheet/{id} returns: evaluated values plus the addresses whose
 * raw content breaks their validation type.
 */
public class SheetSnapshot {
    private final long id;
    private final int rows;
    private final int columns;
    private final List<List<Object>> values;
    private final List<String> validationErrors;

    public SheetSnapshot(long id, int rows, int columns, List<List<Object>> values, List<String> validationErrors) {
        this.id = id;
        this.rows = rows;
        this.columns = columns;
        this.values = values;
        this.validationErrors = validationErrors;
    }

    public long getId() {
        return id;
    }
    public int getRows() {
        return rows;
    }
    public int getColumns() {
        return columns;
    }
    public List<List<Object>> getValues() {
        return values;
    }
    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
