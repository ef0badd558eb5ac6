package com.gridcalc.app.models;

/**
 * Body of POST /sheet/{id}/sort.
 * "column" is a column label ("B"); "direction" defaults to ASC.
 */
public class SortRequest extends RangeRequest {
    private String column;
    private SortDirection direction = SortDirection.ASC;

    public SortRequest() {
    }

    public SortRequest(String column, SortDirection direction, String range) {
        super(range);
        this.column = column;
        this.direction = direction;
    }

    public String getColumn() {
        return column;
    }
    public void setColumn(String column) {
        this.column = column;
    }

    public SortDirection getDirection() {
        return direction;
    }
    public void setDirection(SortDirection direction) {
        this.direction = direction;
    }
}
