package com.gridcalc.app.engine;

import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.Coordinate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntactic scan of formula text for the cells it may read.
 * The result over-approximates: every address token counts, wherever it
 * appears, and a range counts with all of its cells, not just its corners.
 */
public final class DependencyExtractor {

    private static final Pattern RANGE = Pattern.compile("([A-Z]+[0-9]+)\\s*:\\s*([A-Z]+[0-9]+)");

    private DependencyExtractor() {
    }

    /**
     * @return coordinates inside the rows x columns grid, in order of first
     * appearance; empty for anything that isn't a formula
     */
    public static Set<Coordinate> extractDependencies(String formulaText, int rows, int columns) {
        if (formulaText == null || !formulaText.startsWith(CellContent.FORMULA_MARKER)) {
            return Collections.emptySet();
        }
        Set<Coordinate> dependencies = new LinkedHashSet<>();

        Matcher addresses = ReferenceCodec.FORMULA_ADDRESS.matcher(formulaText);
        while (addresses.find()) {
            Coordinate coordinate = ReferenceCodec.resolveAddress(addresses.group());
            if (coordinate != null && coordinate.isWithin(rows, columns)) {
                dependencies.add(coordinate);
            }
        }

        Matcher ranges = RANGE.matcher(formulaText);
        while (ranges.find()) {
            dependencies.addAll(RangeResolver.resolve(ranges.group(1) + ":" + ranges.group(2), rows, columns));
        }
        return dependencies;
    }
}
