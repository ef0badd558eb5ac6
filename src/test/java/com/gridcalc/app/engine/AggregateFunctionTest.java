package com.gridcalc.app.engine;

import com.gridcalc.app.models.EvaluatedGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFunctionTest {

    private EvaluatedGrid values;

    /**
     * A1=1       B1=""
     * A2=2       B2="12abc"
     * A3="abc"   B3=#ERROR!
     * A4=2.5     B4="-4"
     */
    @BeforeEach
    void setUp() {
        values = new EvaluatedGrid(4, 2, new Object[]{
                "1", "",
                "2", "12abc",
                "abc", ErrorToken.ERROR,
                2.5, "-4"
        });
    }

    @Test
    void testSkipsNonNumericCells() {
        assertEquals(3.0, AggregateFunction.SUM.apply("A1:A3", values));
        assertEquals(2.0, AggregateFunction.COUNT.apply("A1:A3", values));
        assertEquals(1.5, AggregateFunction.AVERAGE.apply("A1:A3", values));
    }

    @Test
    void testNumericPrefixAndDoubles() {
        assertEquals(12.0, AggregateFunction.MAX.apply("A1:B4", values));
        assertEquals(-4.0, AggregateFunction.MIN.apply("A1:B4", values));
        assertEquals(5.0, AggregateFunction.COUNT.apply("A1:B4", values));
        assertEquals(13.5, AggregateFunction.SUM.apply("B4:A1", values));
    }

    /**
     * No numeric cells: every aggregate is a plain 0, never NaN or infinity.
     */
    @Test
    void testVacuousRanges() {
        for (AggregateFunction function : AggregateFunction.values()) {
            assertEquals(0.0, function.apply("A3", values), function.name());
            assertEquals(0.0, function.apply("B1", values), function.name());
            assertEquals(0.0, function.apply("Z99:Z99", values), function.name());
            assertEquals(0.0, function.apply("A1:B2:C3", values), function.name());
        }
    }

    @Test
    void testSingleAddressArgument() {
        assertEquals(2.0, AggregateFunction.SUM.apply("A2", values));
    }

    @Test
    void testApplyToArguments() {
        assertEquals(3.0, AggregateFunction.SUM.applyToArguments(1.0, "x", 2.0));
        assertEquals(2.0, AggregateFunction.COUNT.applyToArguments(1.0, "x", "7 apples"));
        assertEquals(0.0, AggregateFunction.MAX.applyToArguments());
    }

    @Test
    void testFromName() {
        assertEquals(AggregateFunction.AVERAGE, AggregateFunction.fromName("average"));
        assertEquals(AggregateFunction.SUM, AggregateFunction.fromName(" Sum "));
        assertNull(AggregateFunction.fromName("MEDIAN"));
        assertNull(AggregateFunction.fromName(null));
    }
}
