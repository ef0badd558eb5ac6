package com.gridcalc.app.engine;

import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.CellValues;
import com.gridcalc.app.models.Coordinate;
import com.gridcalc.app.models.EvaluatedGrid;
import com.gridcalc.app.models.Grid;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes every cell of a grid in one pass.
 *
 * <p>Cells live in a flat arena indexed by {@code row * columns + column}. Each
 * index is UNVISITED, IN_PROGRESS or DONE for the duration of the pass. Formula
 * cells are resolved depth-first with an explicit stack of frames, so a long
 * reference chain costs heap, not Java stack.
 *
 * <p>Reaching a dependency that is still IN_PROGRESS means it is on the current
 * path: every frame from that dependency to the top of the stack is part of the
 * cycle and resolves to {@link ErrorToken#CIRCULAR}. A cell whose dependency
 * resolved to {@link ErrorToken#CIRCULAR} does so too. Every other formula cell
 * is evaluated exactly once, after all of its dependencies are DONE, so the
 * result does not depend on the order cells are visited in.
 *
 * <p>Stateless between passes; one instance may serve every sheet.
 */
public class RecalculationEngine {

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private final ExpressionEvaluator evaluator;

    public RecalculationEngine(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public RecalculationEngine(int maxExpressionDepth) {
        this(new ExpressionEvaluator(new ExpressionParser(maxExpressionDepth)));
    }

    /**
     * Evaluates the whole grid. The grid is only read.
     */
    public RecalculationResult recalculate(Grid grid) {
        Pass pass = new Pass(grid);
        for (int index = 0; index < pass.size; index++) {
            if (pass.state[index] != DONE) {
                pass.resolve(index);
            }
        }
        return new RecalculationResult(
                new EvaluatedGrid(pass.rows, pass.columns, pass.values),
                pass.dependencies,
                pass.circularCount);
    }

    /**
     * Mutable state of a single pass; also the view formulas read from.
     */
    private final class Pass implements CellValues {
        final Grid grid;
        final int rows;
        final int columns;
        final int size;
        final byte[] state;
        final Object[] values;
        final int[][] dependencyIndexes;
        final Map<Coordinate, Set<Coordinate>> dependencies = new LinkedHashMap<>();
        int circularCount;

        Pass(Grid grid) {
            this.grid = grid;
            this.rows = grid.getRowCount();
            this.columns = grid.getColumnCount();
            this.size = rows * columns;
            this.state = new byte[size];
            this.values = new Object[size];
            this.dependencyIndexes = new int[size][];

            // Dependency sets are rebuilt from the raw text on every pass
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < columns; c++) {
                    CellContent content = grid.get(r, c);
                    if (!content.isFormula()) {
                        continue;
                    }
                    Set<Coordinate> deps = DependencyExtractor.extractDependencies(content.getRaw(), rows, columns);
                    Coordinate at = new Coordinate(r, c);
                    dependencies.put(at, deps);
                    int[] indexes = new int[deps.size()];
                    int i = 0;
                    for (Coordinate dep : deps) {
                        indexes[i++] = dep.flatIndex(columns);
                    }
                    dependencyIndexes[at.flatIndex(columns)] = indexes;
                }
            }
        }

        void resolve(int root) {
            Deque<Frame> stack = new ArrayDeque<>();
            open(root, stack);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next < top.dependencies.length) {
                    int dep = top.dependencies[top.next++];
                    if (state[dep] == IN_PROGRESS) {
                        markCycle(stack, dep);
                    } else if (state[dep] == DONE) {
                        if (ErrorToken.CIRCULAR.equals(values[dep])) {
                            top.circular = true;
                        }
                    } else {
                        open(dep, stack);
                    }
                    continue;
                }

                // All dependencies settled
                stack.pop();
                if (top.circular) {
                    values[top.index] = ErrorToken.CIRCULAR;
                    circularCount++;
                    if (!stack.isEmpty()) {
                        stack.peek().circular = true;
                    }
                } else {
                    Coordinate at = new Coordinate(top.index / columns, top.index % columns);
                    values[top.index] = evaluator.evaluate(grid.get(at).getRaw(), at, this);
                }
                state[top.index] = DONE;
            }
        }

        /**
         * Literals settle immediately; formulas get a frame.
         */
        private void open(int index, Deque<Frame> stack) {
            CellContent content = grid.get(index / columns, index % columns);
            if (!content.isFormula()) {
                values[index] = content.getRaw();
                state[index] = DONE;
                return;
            }
            state[index] = IN_PROGRESS;
            stack.push(new Frame(index, dependencyIndexes[index]));
        }

        /**
         * Flags every frame from the top of the stack down to the one for {@code target}.
         */
        private void markCycle(Deque<Frame> stack, int target) {
            for (Frame frame : stack) {
                frame.circular = true;
                if (frame.index == target) {
                    return;
                }
            }
        }

        @Override
        public int getRowCount() {
            return rows;
        }

        @Override
        public int getColumnCount() {
            return columns;
        }

        @Override
        public Object valueAt(int row, int column) {
            Object value = values[row * columns + column];
            return value == null ? "" : value;
        }
    }

    private static final class Frame {
        final int index;
        final int[] dependencies;
        int next;
        boolean circular;

        Frame(int index, int[] dependencies) {
            this.index = index;
            this.dependencies = dependencies;
        }
    }
}
