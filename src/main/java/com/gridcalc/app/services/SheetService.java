package com.gridcalc.app.services;

import com.gridcalc.app.config.GridProperties;
import com.gridcalc.app.engine.NumericCoercion;
import com.gridcalc.app.engine.RecalculationEngine;
import com.gridcalc.app.engine.RecalculationResult;
import com.gridcalc.app.engine.ReferenceCodec;
import com.gridcalc.app.exceptions.CellOutOfBoundsException;
import com.gridcalc.app.exceptions.InvalidOperationException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns the raw grids and drives recalculation.
 * Every edit (single cell, load, resize, transform, sort, replace, dedupe)
 * runs under the sheet's write lock and ends with one full recalculation
 * pass, whose result is published as the sheet's new snapshot.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; persistence belongs to the client
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final GridProperties properties;
    private final RecalculationEngine engine;
    private final List<DateTimeFormatter> dateFormats = new ArrayList<>();

    public SheetService(GridProperties properties) {
        this.properties = properties;
        this.engine = new RecalculationEngine(properties.getMaxExpressionDepth());
        for (String pattern : properties.getDateFormats()) {
            // 'u' instead of 'y' so STRICT resolution works without an era field
            dateFormats.add(DateTimeFormatter.ofPattern(pattern.trim().replace('y', 'u'))
                    .withResolverStyle(ResolverStyle.STRICT));
        }
    }

    /**
     * Creates an empty sheet; null sizes fall back to the configured defaults.
     */
    public long createSheet(Integer rows, Integer columns) {
        int rowCount = rows == null ? properties.getInitialRows() : rows;
        int columnCount = columns == null ? properties.getInitialColumns() : columns;
        checkSize(rowCount, columnCount);

        Sheet sheet = new Sheet(rowCount, columnCount);
        recalculate(sheet);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} ({}x{})", sheet.getId(), rowCount, columnCount);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Evaluated values of the last pass, plus validation flags.
     */
    public SheetSnapshot getSnapshot(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return snapshotOf(sheet);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellView getCell(long sheetId, String address) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return viewOf(sheet, locate(sheet, address));
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Sets one cell's raw content (literal or "=formula") and recalculates.
     */
    public CellView setCellValue(long sheetId, String address, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            Coordinate at = locate(sheet, address);
            sheet.getGrid().set(at.getRow(), at.getColumn(), CellContent.of(rawValue));
            recalculate(sheet);
            return viewOf(sheet, at);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public CellView setValidation(long sheetId, String address, ValidationType type) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            Coordinate at = locate(sheet, address);
            sheet.setValidation(at.getRow(), at.getColumn(), type);
            recalculate(sheet);
            return viewOf(sheet, at);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Replaces the whole grid, e.g. when a client loads a saved sheet.
     * Ragged rows are padded with empty cells.
     */
    public SheetSnapshot loadCells(long sheetId, List<List<String>> cells) {
        if (cells == null || cells.isEmpty()) {
            throw new InvalidOperationException("At least one row of cells is required");
        }
        Grid grid = Grid.fromRaw(cells);
        checkSize(grid.getRowCount(), grid.getColumnCount());
        return edit(sheetId, sheet -> {
            sheet.replaceGrid(grid);
            log.info("Loaded {}x{} grid into sheet {}", grid.getRowCount(), grid.getColumnCount(), sheet.getId());
        });
    }

    // ----------------------------------------------------------------
    // Edge resizing
    // ----------------------------------------------------------------

    public SheetSnapshot appendRow(long sheetId) {
        return edit(sheetId, sheet -> {
            if (sheet.getGrid().getRowCount() >= properties.getMaxRows()) {
                throw new InvalidOperationException("Sheet already has the maximum of " + properties.getMaxRows() + " rows");
            }
            sheet.appendRow();
        });
    }

    public SheetSnapshot removeLastRow(long sheetId) {
        return edit(sheetId, sheet -> {
            if (sheet.getGrid().getRowCount() == 1) {
                throw new InvalidOperationException("Cannot delete the last remaining row");
            }
            sheet.removeLastRow();
        });
    }

    public SheetSnapshot appendColumn(long sheetId) {
        return edit(sheetId, sheet -> {
            if (sheet.getGrid().getColumnCount() >= properties.getMaxColumns()) {
                throw new InvalidOperationException("Sheet already has the maximum of " + properties.getMaxColumns() + " columns");
            }
            sheet.appendColumn();
        });
    }

    public SheetSnapshot removeLastColumn(long sheetId) {
        return edit(sheetId, sheet -> {
            if (sheet.getGrid().getColumnCount() == 1) {
                throw new InvalidOperationException("Cannot delete the last remaining column");
            }
            sheet.removeLastColumn();
        });
    }

    // ----------------------------------------------------------------
    // Range operations
    // ----------------------------------------------------------------

    /**
     * Applies TRIM/UPPER/LOWER to the literal cells of a range (whole sheet when null).
     * Formulas are left alone so their references stay intact.
     */
    public SheetSnapshot transform(long sheetId, TextTransform operation, String range) {
        if (operation == null) {
            throw new InvalidOperationException("Transform operation is required");
        }
        return edit(sheetId, sheet -> {
            Grid grid = sheet.getGrid();
            Selection selection = select(sheet, range);
            for (int r = selection.top; r <= selection.bottom; r++) {
                for (int c = selection.left; c <= selection.right; c++) {
                    CellContent content = grid.get(r, c);
                    if (content.isEmpty() || content.isFormula()) {
                        continue;
                    }
                    grid.set(r, c, CellContent.of(operation.apply(content.getRaw())));
                }
            }
        });
    }

    /**
     * Sorts the rows of a range (whole sheet when null) by one column's
     * evaluated values. Numbers come before text, blanks always last.
     * Only the range's columns move; formulas are not rewritten.
     */
    public SheetSnapshot sort(long sheetId, String columnLabel, SortDirection direction, String range) {
        int sortColumn = ReferenceCodec.columnIndexOf(columnLabel);
        SortDirection order = direction == null ? SortDirection.ASC : direction;
        return edit(sheetId, sheet -> {
            Selection selection = select(sheet, range);
            if (sortColumn < selection.left || sortColumn > selection.right) {
                throw new InvalidOperationException("Sort column " + columnLabel + " is outside the selected range");
            }
            EvaluatedGrid values = sheet.getEvaluated();
            List<Integer> rowOrder = new ArrayList<>();
            for (int r = selection.top; r <= selection.bottom; r++) {
                rowOrder.add(r);
            }
            rowOrder.sort(new RowComparator(values, sortColumn, order));
            moveRowSlices(sheet, selection, rowOrder);
        });
    }

    /**
     * Drops rows that repeat an earlier row. Without a range whole rows are
     * compared; with one, only the range's slice of each row in it is.
     * Duplicate rows are removed entirely.
     */
    public SheetSnapshot removeDuplicates(long sheetId, String range) {
        return edit(sheetId, sheet -> {
            Grid grid = sheet.getGrid();
            Selection selection = select(sheet, range);
            Set<List<String>> seen = new HashSet<>();
            List<Integer> keep = new ArrayList<>();
            for (int r = 0; r < grid.getRowCount(); r++) {
                if (r < selection.top || r > selection.bottom) {
                    keep.add(r);
                    continue;
                }
                List<String> key = new ArrayList<>();
                for (int c = selection.left; c <= selection.right; c++) {
                    key.add(grid.get(r, c).getRaw());
                }
                if (seen.add(key)) {
                    keep.add(r);
                }
            }
            if (keep.size() < grid.getRowCount()) {
                log.info("Removing {} duplicate row(s) from sheet {}", grid.getRowCount() - keep.size(), sheet.getId());
                sheet.retainRows(keep);
            }
        });
    }

    /**
     * Addresses, row-major, whose raw content contains {@code text} literally.
     */
    public List<String> find(long sheetId, String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidOperationException("Search text must not be empty");
        }
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            Grid grid = sheet.getGrid();
            List<String> matches = new ArrayList<>();
            for (int r = 0; r < grid.getRowCount(); r++) {
                for (int c = 0; c < grid.getColumnCount(); c++) {
                    if (grid.get(r, c).getRaw().contains(text)) {
                        matches.add(ReferenceCodec.labelOf(r, c));
                    }
                }
            }
            return matches;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Replaces every literal occurrence of {@code find}, formulas included.
     *
     * @return number of cells changed
     */
    public int replaceAll(long sheetId, String find, String replacement) {
        if (find == null || find.isEmpty()) {
            throw new InvalidOperationException("Search text must not be empty");
        }
        String with = replacement == null ? "" : replacement;
        int[] changed = new int[1];
        edit(sheetId, sheet -> {
            Grid grid = sheet.getGrid();
            for (int r = 0; r < grid.getRowCount(); r++) {
                for (int c = 0; c < grid.getColumnCount(); c++) {
                    String raw = grid.get(r, c).getRaw();
                    if (raw.contains(find)) {
                        grid.set(r, c, CellContent.of(raw.replace(find, with)));
                        changed[0]++;
                    }
                }
            }
        });
        return changed[0];
    }

    // ----------------------------------------------------------------
    // Dependency graphs of the last pass
    // ----------------------------------------------------------------

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return sheet.getForwardGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return sheet.getReverseGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Runs one edit under the write lock, then one full recalculation pass.
     */
    private SheetSnapshot edit(long sheetId, Consumer<Sheet> change) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            change.accept(sheet);
            recalculate(sheet);
            return snapshotOf(sheet);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * One full pass: evaluate, rebuild both dependency directions,
     * re-check validations, publish everything at once.
     */
    private void recalculate(Sheet sheet) {
        long start = System.nanoTime();
        Grid grid = sheet.getGrid();
        RecalculationResult result = engine.recalculate(grid);

        Map<String, Set<String>> forward = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new TreeMap<>(ADDRESS_ORDER);
        for (Map.Entry<Coordinate, Set<Coordinate>> entry : result.getDependencies().entrySet()) {
            String source = ReferenceCodec.labelOf(entry.getKey());
            Set<String> targets = new LinkedHashSet<>();
            for (Coordinate target : entry.getValue()) {
                String targetLabel = ReferenceCodec.labelOf(target);
                targets.add(targetLabel);
                reverse.computeIfAbsent(targetLabel, k -> new TreeSet<>(ADDRESS_ORDER)).add(source);
            }
            forward.put(source, targets);
        }

        Set<String> invalid = new LinkedHashSet<>();
        for (int r = 0; r < grid.getRowCount(); r++) {
            for (int c = 0; c < grid.getColumnCount(); c++) {
                if (!isValid(grid.get(r, c), sheet.getValidation(r, c))) {
                    invalid.add(ReferenceCodec.labelOf(r, c));
                }
            }
        }

        sheet.publish(result.getValues(), forward, reverse, invalid);
        if (log.isDebugEnabled()) {
            log.debug("Recalculated sheet {} ({}x{}, {} formulas, {} circular) in {} us",
                    sheet.getId(), grid.getRowCount(), grid.getColumnCount(), forward.size(),
                    result.getCircularCells(), (System.nanoTime() - start) / 1000);
        }
    }

    private boolean isValid(CellContent content, ValidationType type) {
        if (type == ValidationType.ANY || content.isEmpty() || content.isFormula()) {
            return true;
        }
        if (type == ValidationType.NUMBER) {
            return content.getKind() == CellContent.Kind.NUMBER;
        }
        String text = content.getRaw().trim();
        for (DateTimeFormatter format : dateFormats) {
            if (isDate(text, format)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDate(String text, DateTimeFormatter format) {
        try {
            LocalDate.parse(text, format);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Strict address lookup for API input: malformed is a 400, outside the grid a 404.
     */
    private Coordinate locate(Sheet sheet, String address) {
        Coordinate at = ReferenceCodec.parseAddress(address);
        Grid grid = sheet.getGrid();
        if (!grid.contains(at)) {
            throw new CellOutOfBoundsException("Cell " + address.trim().toUpperCase(Locale.ROOT) + " is outside the "
                    + grid.getRowCount() + "x" + grid.getColumnCount() + " grid");
        }
        return at;
    }

    private Selection select(Sheet sheet, String range) {
        Grid grid = sheet.getGrid();
        if (range == null || range.trim().isEmpty()) {
            return new Selection(0, 0, grid.getRowCount() - 1, grid.getColumnCount() - 1);
        }
        String[] corners = range.split(":", -1);
        if (corners.length > 2) {
            throw new InvalidOperationException("Malformed range: " + range);
        }
        Coordinate first = locate(sheet, corners[0]);
        Coordinate second = corners.length == 2 ? locate(sheet, corners[1]) : first;
        return new Selection(
                Math.min(first.getRow(), second.getRow()),
                Math.min(first.getColumn(), second.getColumn()),
                Math.max(first.getRow(), second.getRow()),
                Math.max(first.getColumn(), second.getColumn()));
    }

    /**
     * Rewrites rows top..bottom of the selection's columns in the given order,
     * moving validation types along with the content.
     */
    private void moveRowSlices(Sheet sheet, Selection selection, List<Integer> rowOrder) {
        Grid grid = sheet.getGrid();
        int width = selection.right - selection.left + 1;
        CellContent[][] contents = new CellContent[rowOrder.size()][width];
        ValidationType[][] validations = new ValidationType[rowOrder.size()][width];
        for (int i = 0; i < rowOrder.size(); i++) {
            for (int c = 0; c < width; c++) {
                contents[i][c] = grid.get(rowOrder.get(i), selection.left + c);
                validations[i][c] = sheet.getValidation(rowOrder.get(i), selection.left + c);
            }
        }
        for (int i = 0; i < rowOrder.size(); i++) {
            for (int c = 0; c < width; c++) {
                grid.set(selection.top + i, selection.left + c, contents[i][c]);
                sheet.setValidation(selection.top + i, selection.left + c, validations[i][c]);
            }
        }
    }

    private SheetSnapshot snapshotOf(Sheet sheet) {
        EvaluatedGrid values = sheet.getEvaluated();
        return new SheetSnapshot(sheet.getId(), values.getRowCount(), values.getColumnCount(),
                values.toRows(), new ArrayList<>(sheet.getValidationErrors()));
    }

    private CellView viewOf(Sheet sheet, Coordinate at) {
        String label = ReferenceCodec.labelOf(at);
        return new CellView(label,
                sheet.getGrid().get(at).getRaw(),
                sheet.getEvaluated().valueAt(at),
                sheet.getValidation(at.getRow(), at.getColumn()),
                sheet.getValidationErrors().contains(label));
    }

    private void checkSize(int rows, int columns) {
        if (rows < 1 || columns < 1) {
            throw new InvalidOperationException("A sheet needs at least one row and one column");
        }
        if (rows > properties.getMaxRows() || columns > properties.getMaxColumns()) {
            throw new InvalidOperationException("Sheet size " + rows + "x" + columns + " exceeds the limit of "
                    + properties.getMaxRows() + "x" + properties.getMaxColumns());
        }
    }

    // Row-major order for "A1" labels: A2 < B1 < A10
    private static final Comparator<String> ADDRESS_ORDER = Comparator
            .comparingInt((String label) -> ReferenceCodec.parseAddress(label).getRow())
            .thenComparingInt(label -> ReferenceCodec.parseAddress(label).getColumn());

    /**
     * Inclusive rectangle of cells selected by a range request.
     */
    private static final class Selection {
        final int top;
        final int left;
        final int bottom;
        final int right;

        Selection(int top, int left, int bottom, int right) {
            this.top = top;
            this.left = left;
            this.bottom = bottom;
            this.right = right;
        }
    }

    /**
     * Orders row indexes by the evaluated value in one column.
     */
    private static final class RowComparator implements Comparator<Integer> {
        private final EvaluatedGrid values;
        private final int column;
        private final SortDirection direction;

        RowComparator(EvaluatedGrid values, int column, SortDirection direction) {
            this.values = values;
            this.column = column;
            this.direction = direction;
        }

        @Override
        public int compare(Integer rowA, Integer rowB) {
            Object a = values.valueAt(rowA, column);
            Object b = values.valueAt(rowB, column);
            boolean blankA = a == null || "".equals(a);
            boolean blankB = b == null || "".equals(b);
            if (blankA || blankB) {
                // Blanks sink to the bottom whatever the direction
                return Boolean.compare(blankA, blankB);
            }
            int result = compareValues(a, b);
            return direction == SortDirection.DESC ? -result : result;
        }

        private static int compareValues(Object a, Object b) {
            Double numberA = NumericCoercion.toNumber(a);
            Double numberB = NumericCoercion.toNumber(b);
            if (numberA != null && numberB != null) {
                return Double.compare(numberA, numberB);
            }
            if (numberA != null) {
                return -1;
            }
            if (numberB != null) {
                return 1;
            }
            String textA = String.valueOf(a);
            String textB = String.valueOf(b);
            int result = String.CASE_INSENSITIVE_ORDER.compare(textA, textB);
            return result != 0 ? result : textA.compareTo(textB);
        }
    }
}
