package com.gridcalc.app.engine;

import com.gridcalc.app.models.Coordinate;
import com.gridcalc.app.models.EvaluatedGrid;
import com.gridcalc.app.models.Grid;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecalculationEngineTest {

    private final RecalculationEngine engine = new RecalculationEngine(64);

    private EvaluatedGrid recalc(List<List<String>> raw) {
        return engine.recalculate(Grid.fromRaw(raw)).getValues();
    }

    private static List<List<String>> rows(String[]... rows) {
        List<List<String>> result = new ArrayList<>();
        for (String[] row : rows) {
            result.add(Arrays.asList(row));
        }
        return result;
    }

    private static List<List<String>> column(String... cells) {
        List<List<String>> result = new ArrayList<>();
        for (String cell : cells) {
            result.add(Collections.singletonList(cell));
        }
        return result;
    }

    @Test
    void testSimpleReference() {
        EvaluatedGrid values = recalc(rows(new String[]{"5", "=A1+3"}));
        assertEquals(8.0, values.valueAt(0, 1));
        assertEquals("5", values.valueAt(0, 0));
    }

    @Test
    void testTwoCellCycle() {
        EvaluatedGrid values = recalc(rows(new String[]{"=B1", "=A1"}));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 0));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 1));
    }

    @Test
    void testSelfReference() {
        EvaluatedGrid values = recalc(rows(new String[]{"=A1+1", "2"}));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 0));
        assertEquals("2", values.valueAt(0, 1));
    }

    /**
     * A1 -> B1 -> C1 -> A1 is a cycle; D1 reads the cycle; E1/F1 are unrelated.
     */
    @Test
    void testCycleMembersAndDependentsAreCircular() {
        RecalculationResult result = engine.recalculate(Grid.fromRaw(
                rows(new String[]{"=B1", "=C1", "=A1", "=A1+1", "7", "=E1"})));
        EvaluatedGrid values = result.getValues();
        for (int c = 0; c < 4; c++) {
            assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, c), "column " + c);
        }
        assertEquals("7", values.valueAt(0, 4));
        assertEquals(7.0, values.valueAt(0, 5));
        assertEquals(4, result.getCircularCells());
    }

    /**
     * The dependent is visited first; it still sees the cycle,
     * whichever cell the pass happens to start from.
     */
    @Test
    void testDependentVisitedBeforeCycle() {
        EvaluatedGrid values = recalc(rows(new String[]{"=B1*2", "=C1", "=B1"}));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 0));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 1));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(0, 2));
    }

    @Test
    void testDependenciesResolveBeforeDependents() {
        EvaluatedGrid values = recalc(rows(new String[]{"=B1+1", "=C1*2", "3"}));
        assertEquals(7.0, values.valueAt(0, 0));
        assertEquals(6.0, values.valueAt(0, 1));
    }

    @Test
    void testAggregatesOverRange() {
        EvaluatedGrid values = recalc(column("1", "2", "abc", "=SUM(A1:A3)", "=COUNT(A1:A3)", "=AVERAGE(A1:A3)"));
        assertEquals(3.0, values.valueAt(3, 0));
        assertEquals(2.0, values.valueAt(4, 0));
        assertEquals(1.5, values.valueAt(5, 0));
    }

    /**
     * A3 sits inside SUM's range without being one of its corners.
     */
    @Test
    void testRangeInteriorFormulaIsEvaluatedFirst() {
        EvaluatedGrid values = recalc(column("=SUM(A2:A4)", "1", "=A2*10", "2"));
        assertEquals(13.0, values.valueAt(0, 0));
    }

    @Test
    void testRangeIncludingItselfIsCircular() {
        EvaluatedGrid values = recalc(column("1", "2", "=SUM(A1:A3)"));
        assertEquals(ErrorToken.CIRCULAR, values.valueAt(2, 0));
    }

    @Test
    void testTextPassThroughSubstitution() {
        EvaluatedGrid values = recalc(rows(new String[]{"hello", "=A1"}));
        assertEquals("hello", values.valueAt(0, 1));
    }

    @Test
    void testEvaluatorFailureIsContained() {
        EvaluatedGrid values = recalc(rows(new String[]{"=UNDEFINED_FUNC(1)", "4", "=B1*2"}));
        assertEquals(ErrorToken.ERROR, values.valueAt(0, 0));
        assertEquals(8.0, values.valueAt(0, 2));
    }

    @Test
    void testErrorFlowsIntoArithmeticDependents() {
        EvaluatedGrid values = recalc(rows(new String[]{"=1/0", "=A1+1", "=A1"}));
        assertEquals(ErrorToken.ERROR, values.valueAt(0, 1));
        assertEquals(ErrorToken.ERROR, values.valueAt(0, 2));
    }

    @Test
    void testEmptyRangeSumsToZero() {
        EvaluatedGrid values = recalc(rows(new String[]{"=SUM(Z99:Z99)", ""}, new String[]{"", ""}));
        assertEquals(0.0, values.valueAt(0, 0));
        assertEquals("", values.valueAt(1, 1));
    }

    /**
     * A well-formed address outside the grid reads as nothing, never as A1.
     */
    @Test
    void testUnaddressableReferencesReadAsZero() {
        assertEquals(0.0, recalc(rows(new String[]{"=A0"})).valueAt(0, 0));
        assertEquals(1.0, recalc(rows(new String[]{"5", "=A0+1"})).valueAt(0, 1));
        assertEquals(1.0, recalc(rows(new String[]{"5", "=A99999999999+1"})).valueAt(0, 1));
        assertEquals(1.0, recalc(rows(new String[]{"5", "=AAAAAAA1+1"})).valueAt(0, 1));

        RecalculationResult result = engine.recalculate(Grid.fromRaw(rows(new String[]{"=A0+AAAAAAA1"})));
        assertTrue(result.getDependencies().get(new Coordinate(0, 0)).isEmpty());
        assertEquals(0, result.getCircularCells());
    }

    @Test
    void testLiteralsAreNotReinterpreted() {
        EvaluatedGrid values = recalc(rows(new String[]{" 42 ", "1e3", "TRUE"}));
        assertEquals(" 42 ", values.valueAt(0, 0));
        assertEquals("1e3", values.valueAt(0, 1));
        assertEquals("TRUE", values.valueAt(0, 2));
    }

    @Test
    void testRecalculationIsDeterministic() {
        List<List<String>> raw = rows(
                new String[]{"1", "=A1*2", "=B1+A2", "=C2"},
                new String[]{"=SUM(A1:B1)", "=D1", "x", "=D2"});
        Grid grid = Grid.fromRaw(raw);
        assertEquals(engine.recalculate(grid).getValues().toRows(), engine.recalculate(grid).getValues().toRows());
        // The raw grid is only read
        assertEquals(raw, grid.toRaw());
    }

    /**
     * A1 = A2+1, A2 = A3+1, ... : resolving A1 walks the whole chain first.
     */
    @Test
    void testLongChainDoesNotOverflowTheStack() {
        int length = 5000;
        String[] cells = new String[length];
        for (int r = 0; r < length - 1; r++) {
            cells[r] = "=A" + (r + 2) + "+1";
        }
        cells[length - 1] = "1";
        EvaluatedGrid values = recalc(column(cells));
        assertEquals((double) length, values.valueAt(0, 0));
    }

    @Test
    void testDependencyMapCoversFormulaCellsOnly() {
        RecalculationResult result = engine.recalculate(Grid.fromRaw(rows(new String[]{"1", "=A1+Z9", "=SUM(A1:B1)"})));
        assertEquals(2, result.getDependencies().size());
        assertEquals(Collections.singleton(new Coordinate(0, 0)), result.getDependencies().get(new Coordinate(0, 1)));
        assertEquals(2, result.getDependencies().get(new Coordinate(0, 2)).size());
        assertNull(result.getDependencies().get(new Coordinate(0, 0)));
    }
}
