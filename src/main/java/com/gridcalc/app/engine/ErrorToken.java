package com.gridcalc.app.engine;

/**
 * Reserved evaluated values. They are ordinary strings in the grid,
 * so a failing cell never aborts a recalculation pass.
 */
public final class ErrorToken {

    public static final String ERROR = "#ERROR!";
    public static final String CIRCULAR = "#CIRCULAR!";

    private ErrorToken() {
    }
}
