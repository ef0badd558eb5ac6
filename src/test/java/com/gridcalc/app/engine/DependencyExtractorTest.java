package com.gridcalc.app.engine;

import com.gridcalc.app.models.Coordinate;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyExtractorTest {

    @Test
    void testNonFormulaHasNoDependencies() {
        assertTrue(DependencyExtractor.extractDependencies("A1+B1", 10, 10).isEmpty());
        assertTrue(DependencyExtractor.extractDependencies("", 10, 10).isEmpty());
        assertTrue(DependencyExtractor.extractDependencies(null, 10, 10).isEmpty());
        assertTrue(DependencyExtractor.extractDependencies("=1+2", 10, 10).isEmpty());
    }

    @Test
    void testAddressesInOrderOfAppearance() {
        Set<Coordinate> deps = DependencyExtractor.extractDependencies("=B2*3+A1+B2", 10, 10);
        assertEquals(new LinkedHashSet<>(Arrays.asList(new Coordinate(1, 1), new Coordinate(0, 0))), deps);
    }

    /**
     * A range contributes its interior cells, not just the two corners.
     */
    @Test
    void testRangeContributesEveryCell() {
        Set<Coordinate> deps = DependencyExtractor.extractDependencies("=SUM(A1:A3)", 10, 10);
        assertEquals(3, deps.size());
        assertTrue(deps.contains(new Coordinate(1, 0)));
    }

    @Test
    void testOutOfBoundsAddressesAreDropped() {
        Set<Coordinate> deps = DependencyExtractor.extractDependencies("=Z99+A1+SUM(B1:D1)", 3, 3);
        assertEquals(new LinkedHashSet<>(Arrays.asList(
                new Coordinate(0, 0), new Coordinate(0, 1), new Coordinate(0, 2))), deps);
    }

    /**
     * Row 0, rows past the int range and overlong columns name no cell.
     */
    @Test
    void testUnaddressableReferencesAreDropped() {
        assertTrue(DependencyExtractor.extractDependencies("=A0+A99999999999+AAAAAAA1", 10, 10).isEmpty());
        assertEquals(Collections.singleton(new Coordinate(0, 0)),
                DependencyExtractor.extractDependencies("=A0+A1+SUM(A0:C0)", 10, 10));
    }

    @Test
    void testLowercaseIsNotAnAddress() {
        assertTrue(DependencyExtractor.extractDependencies("=a1+b2", 10, 10).isEmpty());
    }
}
