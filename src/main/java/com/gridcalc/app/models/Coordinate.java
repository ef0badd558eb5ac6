package com.gridcalc.app.models;

import java.util.Objects;

/**
 * Zero-based (row, column) position of a cell.
 * Value-equal, so it doubles as the cell key in dependency maps.
 */
public final class Coordinate {
    private final int row;
    private final int column;

    public Coordinate(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative coordinate: " + row + "," + column);
        }
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }

    public boolean isWithin(int rows, int columns) {
        return row < rows && column < columns;
    }

    /**
     * Row-major flat index inside a grid that is {@code columns} wide.
     */
    public int flatIndex(int columns) {
        return row * columns + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate)) {
            return false;
        }
        Coordinate other = (Coordinate) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
