package com.gridcalc.app.models;

/**
 * Body of POST /sheet. Both sizes are optional and fall back
 * to grid.initial-rows / grid.initial-columns.
 */
public class CreateSheetRequest {
    private Integer rows;
    private Integer columns;

    // Default constructor needed for JSON (de)serialization
    public CreateSheetRequest() {
    }

    public CreateSheetRequest(Integer rows, Integer columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public Integer getRows() {
        return rows;
    }
    public Integer getColumns() {
        return columns;
    }
    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setColumns(Integer columns) {
        this.columns = columns;
    }
}
