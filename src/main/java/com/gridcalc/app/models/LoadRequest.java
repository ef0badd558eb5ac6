package com.gridcalc.app.models;

import java.util.List;

/**
 * Body of PUT /sheet/{id}/cells: the whole grid as raw strings, row-major.
 */
public class LoadRequest {
    private List<List<String>> cells;

    public LoadRequest() {
    }

    public LoadRequest(List<List<String>> cells) {
        this.cells = cells;
    }

    public List<List<String>> getCells() {
        return cells;
    }
    public void setCells(List<List<String>> cells) {
        this.cells = cells;
    }
}
