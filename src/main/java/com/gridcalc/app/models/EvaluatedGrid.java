package com.gridcalc.app.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable result of one recalculation pass. Each value is either a
 * String (literal, text result or error token) or a Double.
 */
public final class EvaluatedGrid implements CellValues {

    private final int rowCount;
    private final int columnCount;
    private final Object[] values;

    /**
     * @param values row-major, length rows * columns; copied
     */
    public EvaluatedGrid(int rowCount, int columnCount, Object[] values) {
        if (values.length != rowCount * columnCount) {
            throw new IllegalArgumentException("Expected " + rowCount * columnCount + " values, got " + values.length);
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.values = Arrays.copyOf(values, values.length);
    }

    /**
     * An all-empty snapshot, used before the first pass completes.
     */
    public static EvaluatedGrid empty(int rowCount, int columnCount) {
        Object[] blank = new Object[rowCount * columnCount];
        Arrays.fill(blank, "");
        return new EvaluatedGrid(rowCount, columnCount, blank);
    }

    @Override
    public int getRowCount() {
        return rowCount;
    }

    @Override
    public int getColumnCount() {
        return columnCount;
    }

    @Override
    public Object valueAt(int row, int column) {
        return values[row * columnCount + column];
    }

    public Object valueAt(Coordinate coordinate) {
        return valueAt(coordinate.getRow(), coordinate.getColumn());
    }

    /**
     * Row-major nested lists, the shape serialized to clients.
     */
    public List<List<Object>> toRows() {
        List<List<Object>> result = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            result.add(Collections.unmodifiableList(
                    Arrays.asList(Arrays.copyOfRange(values, r * columnCount, (r + 1) * columnCount))));
        }
        return Collections.unmodifiableList(result);
    }
}
