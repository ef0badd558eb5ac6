package com.gridcalc.app.engine;

import com.gridcalc.app.models.Coordinate;
import com.gridcalc.app.models.EvaluatedGrid;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Output of one pass: the value snapshot and the direct dependency set
 * of every formula cell, as extracted at the start of the pass.
 */
public class RecalculationResult {
    private final EvaluatedGrid values;
    private final Map<Coordinate, Set<Coordinate>> dependencies;
    private final int circularCells;

    public RecalculationResult(EvaluatedGrid values, Map<Coordinate, Set<Coordinate>> dependencies, int circularCells) {
        this.values = values;
        this.dependencies = Collections.unmodifiableMap(dependencies);
        this.circularCells = circularCells;
    }

    public EvaluatedGrid getValues() {
        return values;
    }

    public Map<Coordinate, Set<Coordinate>> getDependencies() {
        return dependencies;
    }

    public int getCircularCells() {
        return circularCells;
    }
}
