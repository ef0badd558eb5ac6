package com.gridcalc.app.models;

/**
 * Read access to evaluated values by (row, column). Implemented by the
 * published snapshot and by the engine's in-progress buffer, so aggregate
 * functions and substitution see whatever has been computed so far.
 */
public interface CellValues {

    int getRowCount();

    int getColumnCount();

    /**
     * Caller must stay within bounds; see {@link #contains(int, int)}.
     */
    Object valueAt(int row, int column);

    default boolean contains(int row, int column) {
        return row >= 0 && column >= 0 && row < getRowCount() && column < getColumnCount();
    }
}
