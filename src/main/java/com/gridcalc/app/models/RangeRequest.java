package com.gridcalc.app.models;

/**
 * Optional "range" ("A1:C9") selecting part of the sheet.
 * Null means the whole sheet.
 */
public class RangeRequest {
    private String range;

    public RangeRequest() {
    }

    public RangeRequest(String range) {
        this.range = range;
    }

    public String getRange() {
        return range;
    }
    public void setRange(String range) {
        this.range = range;
    }
}
