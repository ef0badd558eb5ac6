package com.gridcalc.app.engine;

import com.gridcalc.app.models.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expands "A1" or "A1:C3" into the coordinates it covers, row-major,
 * clipped to the grid. Corners are normalized per axis, so "C3:A1"
 * covers the same cells as "A1:C3".
 */
public final class RangeResolver {

    private RangeResolver() {
    }

    /**
     * Coordinates of the token that lie inside a rows x columns grid.
     * Blank tokens, tokens with more than one ':' and ranges with a corner
     * that names no cell (row 0) give an empty list.
     */
    public static List<Coordinate> resolve(String token, int rows, int columns) {
        if (token == null || token.trim().isEmpty()) {
            return Collections.emptyList();
        }
        String[] parts = token.split(":", -1);
        if (parts.length == 1) {
            Coordinate single = ReferenceCodec.resolveAddress(parts[0]);
            return single != null && single.isWithin(rows, columns)
                    ? Collections.singletonList(single)
                    : Collections.emptyList();
        }
        if (parts.length != 2) {
            return Collections.emptyList();
        }
        Coordinate start = ReferenceCodec.resolveAddress(parts[0]);
        Coordinate end = ReferenceCodec.resolveAddress(parts[1]);
        if (start == null || end == null) {
            return Collections.emptyList();
        }

        int top = Math.min(start.getRow(), end.getRow());
        int bottom = Math.min(Math.max(start.getRow(), end.getRow()), rows - 1);
        int left = Math.min(start.getColumn(), end.getColumn());
        int right = Math.min(Math.max(start.getColumn(), end.getColumn()), columns - 1);

        List<Coordinate> cells = new ArrayList<>();
        for (int r = top; r <= bottom; r++) {
            for (int c = left; c <= right; c++) {
                cells.add(new Coordinate(r, c));
            }
        }
        return cells;
    }
}
