package com.gridcalc.app.engine;

import com.gridcalc.app.models.Coordinate;
import com.gridcalc.app.models.EvaluatedGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(new ExpressionParser(64));
    private final Coordinate at = new Coordinate(3, 0);
    private EvaluatedGrid values;

    /**
     * A1=5     B1="hello"       C1=""
     * A2=1     B2=2             C2="abc"
     * A3=-3    B3=say "hi"      C3=#ERROR!
     */
    @BeforeEach
    void setUp() {
        values = new EvaluatedGrid(3, 3, new Object[]{
                "5", "hello", "",
                "1", 2.0, "abc",
                "-3", "say \"hi\"", ErrorToken.ERROR
        });
    }

    private Object eval(String formula) {
        return evaluator.evaluate(formula, at, values);
    }

    @Test
    void testLiteralPassesThrough() {
        assertEquals("plain", eval("plain"));
        assertEquals(" 42 ", eval(" 42 "));
        assertEquals("", eval(""));
    }

    @Test
    void testArithmeticWithReferences() {
        assertEquals(8.0, eval("=A1+3"));
        assertEquals(5.0, eval("= A1 "));
        assertEquals(9.0, eval("=A3^2"));
        assertEquals(-8.0, eval("=A3-A1"));
    }

    @Test
    void testEmptyAndOutOfBoundsReadAsZero() {
        assertEquals(1.0, eval("=C1+1"));
        assertEquals(1.0, eval("=Z99+1"));
        assertEquals(1.0, eval("=A0+1"));
        assertEquals(1.0, eval("=A99999999999+1"));
        assertEquals(1.0, eval("=AAAAAAA1+1"));
        assertEquals(0.0, eval("=SUM(A0:C3)"));
    }

    @Test
    void testTextSubstitution() {
        assertEquals("hello", eval("=B1"));
        assertEquals("say \"hi\"", eval("=B3"));
        assertEquals("5 apples", eval("=A1 & \" apples\""));
        assertEquals(ErrorToken.ERROR, eval("=C3"));
    }

    @Test
    void testWholeFormulaAggregates() {
        assertEquals(3.0, eval("=SUM(A2:C2)"));
        assertEquals(3.0, eval("=sum(A2:C2)"));
        assertEquals(2.0, eval("=COUNT(A2:C2)"));
        assertEquals(1.5, eval("=AVERAGE(A2:C2)"));
        assertEquals(5.0, eval("=MAX(C3:A1)"));
        assertEquals(-3.0, eval("=MIN(A1:A3)"));
        assertEquals(0.0, eval("=SUM(Z99:Z99)"));
    }

    @Test
    void testAggregatesInsideExpressions() {
        assertEquals(6.0, eval("=SUM(A2:B2)*2"));
        assertEquals(4.0, eval("=SUM(A2:B2) + COUNT(A1)"));
        assertEquals(3.0, eval("=SUM(A2, B2)"));
    }

    @Test
    void testRoundingRemovesFloatingPointNoise() {
        assertEquals(0.3, eval("=0.1+0.2"));
        assertEquals(1.0, eval("=1/3*3"));
        assertEquals(0.3333333333, eval("=1/3"));
    }

    /**
     * Failures become #ERROR! instead of exceptions.
     */
    @Test
    void testFailuresAreContained() {
        assertEquals(ErrorToken.ERROR, eval("=UNDEFINED_FUNC(1)"));
        assertEquals(ErrorToken.ERROR, eval("=A1/0"));
        assertEquals(ErrorToken.ERROR, eval("=C3+1"));
        assertEquals(ErrorToken.ERROR, eval("=B1*2"));
        assertEquals(ErrorToken.ERROR, eval("="));
        assertEquals(ErrorToken.ERROR, eval("=1+"));
    }
}
