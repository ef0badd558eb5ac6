package com.gridcalc.app.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw cell contents of a sheet, rows x columns, always rectangular.
 * Only the owning Sheet mutates it; the recalculation engine reads it.
 */
public class Grid {

    private final List<List<CellContent>> rows = new ArrayList<>();
    private int columnCount;

    public Grid(int rowCount, int columnCount) {
        if (rowCount < 1 || columnCount < 1) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + rowCount + "x" + columnCount);
        }
        this.columnCount = columnCount;
        for (int r = 0; r < rowCount; r++) {
            rows.add(emptyRow(columnCount));
        }
    }

    /**
     * Builds a grid from raw strings. Ragged input is padded with empty
     * cells up to the widest row.
     */
    public static Grid fromRaw(List<List<String>> raw) {
        int width = 1;
        for (List<String> row : raw) {
            width = Math.max(width, row == null ? 0 : row.size());
        }
        Grid grid = new Grid(Math.max(1, raw.size()), width);
        for (int r = 0; r < raw.size(); r++) {
            List<String> row = raw.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size(); c++) {
                grid.set(r, c, CellContent.of(row.get(c)));
            }
        }
        return grid;
    }

    private static List<CellContent> emptyRow(int width) {
        return new ArrayList<>(Collections.nCopies(width, CellContent.EMPTY));
    }

    public int getRowCount() {
        return rows.size();
    }
    public int getColumnCount() {
        return columnCount;
    }

    public CellContent get(int row, int column) {
        return rows.get(row).get(column);
    }
    public CellContent get(Coordinate coordinate) {
        return get(coordinate.getRow(), coordinate.getColumn());
    }

    public void set(int row, int column, CellContent content) {
        rows.get(row).set(column, content == null ? CellContent.EMPTY : content);
    }

    public boolean contains(Coordinate coordinate) {
        return coordinate.isWithin(rows.size(), columnCount);
    }

    // ------------------------
    // Edge-only resizing
    // ------------------------

    public void appendRow() {
        rows.add(emptyRow(columnCount));
    }

    public void removeLastRow() {
        if (rows.size() == 1) {
            throw new IllegalStateException("Cannot remove the only row");
        }
        rows.remove(rows.size() - 1);
    }

    public void appendColumn() {
        for (List<CellContent> row : rows) {
            row.add(CellContent.EMPTY);
        }
        columnCount++;
    }

    public void removeLastColumn() {
        if (columnCount == 1) {
            throw new IllegalStateException("Cannot remove the only column");
        }
        for (List<CellContent> row : rows) {
            row.remove(columnCount - 1);
        }
        columnCount--;
    }

    // ------------------------
    // Whole-row removal
    // ------------------------

    /**
     * Keeps only the given rows, in the given order. Used when
     * dropping duplicates; at least one row must survive.
     */
    public void retainRows(List<Integer> rowOrder) {
        if (rowOrder.isEmpty()) {
            throw new IllegalArgumentException("At least one row must remain");
        }
        List<List<CellContent>> reordered = new ArrayList<>(rowOrder.size());
        for (int index : rowOrder) {
            reordered.add(new ArrayList<>(rows.get(index)));
        }
        rows.clear();
        rows.addAll(reordered);
    }

    /**
     * Raw strings, row-major, as the hosting application would persist them.
     */
    public List<List<String>> toRaw() {
        List<List<String>> raw = new ArrayList<>(rows.size());
        for (List<CellContent> row : rows) {
            List<String> values = new ArrayList<>(columnCount);
            for (CellContent cell : row) {
                values.add(cell.getRaw());
            }
            raw.add(values);
        }
        return raw;
    }
}
