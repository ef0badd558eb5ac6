package com.gridcalc.app.models;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - The raw Grid (source of truth) and a per-cell ValidationType
 * - The EvaluatedGrid published by the last recalculation pass
 * - Forward/reverse dependency graphs of that pass, keyed by "A1" addresses
 * - Addresses whose content currently fails validation
 * - A read/write lock: a pass runs under the write lock, readers never see half of one
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private Grid grid;
    private final List<List<ValidationType>> validations = new ArrayList<>();

    // Replaced wholesale at the end of every pass
    private volatile EvaluatedGrid evaluated;
    private volatile Map<String, Set<String>> forwardGraph = Collections.emptyMap();
    private volatile Map<String, Set<String>> reverseGraph = Collections.emptyMap();
    private volatile Set<String> validationErrors = Collections.emptySet();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rows, int columns) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.grid = new Grid(rows, columns);
        for (int r = 0; r < rows; r++) {
            validations.add(anyRow(columns));
        }
        this.evaluated = EvaluatedGrid.empty(rows, columns);
    }

    private static List<ValidationType> anyRow(int columns) {
        return new ArrayList<>(Collections.nCopies(columns, ValidationType.ANY));
    }

    public long getId() {
        return id;
    }

    public Grid getGrid() {
        return grid;
    }

    /**
     * Swaps in a freshly loaded grid. Validation types are kept where the
     * new grid overlaps the old one and default to ANY elsewhere.
     */
    public void replaceGrid(Grid newGrid) {
        List<List<ValidationType>> resized = new ArrayList<>();
        for (int r = 0; r < newGrid.getRowCount(); r++) {
            List<ValidationType> row = anyRow(newGrid.getColumnCount());
            for (int c = 0; c < newGrid.getColumnCount(); c++) {
                if (r < grid.getRowCount() && c < grid.getColumnCount()) {
                    row.set(c, validations.get(r).get(c));
                }
            }
            resized.add(row);
        }
        validations.clear();
        validations.addAll(resized);
        this.grid = newGrid;
    }

    // ------------------------
    // Validation types
    // ------------------------

    public ValidationType getValidation(int row, int column) {
        return validations.get(row).get(column);
    }

    public void setValidation(int row, int column, ValidationType type) {
        validations.get(row).set(column, type);
    }

    // ------------------------
    // Edge resizing, keeping validations in step with the grid
    // ------------------------

    public void appendRow() {
        grid.appendRow();
        validations.add(anyRow(grid.getColumnCount()));
    }

    public void removeLastRow() {
        grid.removeLastRow();
        validations.remove(validations.size() - 1);
    }

    public void appendColumn() {
        grid.appendColumn();
        for (List<ValidationType> row : validations) {
            row.add(ValidationType.ANY);
        }
    }

    public void removeLastColumn() {
        grid.removeLastColumn();
        for (List<ValidationType> row : validations) {
            row.remove(row.size() - 1);
        }
    }

    /**
     * Reorders (or drops) whole rows; validation types travel with their row.
     */
    public void retainRows(List<Integer> rowOrder) {
        grid.retainRows(rowOrder);
        List<List<ValidationType>> reordered = new ArrayList<>(rowOrder.size());
        for (int index : rowOrder) {
            reordered.add(new ArrayList<>(validations.get(index)));
        }
        validations.clear();
        validations.addAll(reordered);
    }

    // ------------------------
    // Results of the last pass
    // ------------------------

    public EvaluatedGrid getEvaluated() {
        return evaluated;
    }

    /**
     * Publishes one pass: values, both dependency directions and validation flags.
     */
    public void publish(EvaluatedGrid values,
                        Map<String, Set<String>> forward,
                        Map<String, Set<String>> reverse,
                        Set<String> invalidCells) {
        this.forwardGraph = Collections.unmodifiableMap(forward);
        this.reverseGraph = Collections.unmodifiableMap(reverse);
        this.validationErrors = Collections.unmodifiableSet(invalidCells);
        this.evaluated = values;
    }

    // Basic getters for the adjacency maps
    public Map<String, Set<String>> getForwardGraph() {
        return forwardGraph;
    }
    public Map<String, Set<String>> getReverseGraph() {
        return reverseGraph;
    }

    public Set<String> getValidationErrors() {
        return validationErrors;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
