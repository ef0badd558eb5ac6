package com.gridcalc.app.engine;

import com.gridcalc.app.exceptions.InvalidReferenceException;
import com.gridcalc.app.models.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between zero-based coordinates and "A1"-style addresses.
 * Columns are base-26 with A = 1 (A..Z, AA..AZ, BA..), rows are 1-indexed in text.
 */
public final class ReferenceCodec {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCodec.class);

    /**
     * An address as it may appear inside formula text. Uppercase only.
     */
    public static final Pattern FORMULA_ADDRESS = Pattern.compile("[A-Z]+[0-9]+");

    private static final Pattern ADDRESS = Pattern.compile("([A-Za-z]+)([0-9]+)");

    private ReferenceCodec() {
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26. Case-insensitive.
     * Labels past the int range saturate at {@link Integer#MAX_VALUE}, a column no grid has.
     *
     * @throws InvalidReferenceException for empty or non-alphabetic input
     */
    public static int columnIndexOf(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new InvalidReferenceException("Empty column label");
        }
        long result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidReferenceException("Invalid column label: " + letters);
            }
            if (result <= Integer.MAX_VALUE) {
                result = result * 26 + (c - 'A' + 1);
            }
        }
        return (int) Math.min(result - 1, Integer.MAX_VALUE);
    }

    /**
     * 0 -> "A", 27 -> "AB".
     */
    public static String columnLabelOf(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be >= 0, got " + index);
        }
        StringBuilder label = new StringBuilder();
        int remaining = index + 1;
        while (remaining > 0) {
            remaining--;
            label.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return label.toString();
    }

    /**
     * Strict parse: "B12" -> (11, 1). Surrounding whitespace is ignored.
     * Rows past the int range saturate the same way columns do.
     *
     * @throws InvalidReferenceException when the column or row run is missing,
     *                                   anything else is present, or the row is 0
     */
    public static Coordinate parseAddress(String text) {
        if (text == null) {
            throw new InvalidReferenceException("Missing cell address");
        }
        Matcher matcher = ADDRESS.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidReferenceException("Malformed cell address: " + text);
        }
        int row = rowNumberOf(matcher.group(2));
        if (row < 1) {
            throw new InvalidReferenceException("Row numbers start at 1: " + text);
        }
        return new Coordinate(row - 1, columnIndexOf(matcher.group(1)));
    }

    /**
     * Lenient parse used on formula text.
     * A token missing its column or row run resolves to A1, so one bad token
     * never blocks the rest of the formula. A well-formed address that names
     * no cell (row 0) resolves to null; callers treat it like any other
     * reference outside the grid.
     */
    public static Coordinate resolveAddress(String text) {
        Matcher matcher = text == null ? null : ADDRESS.matcher(text.trim());
        if (matcher == null || !matcher.matches()) {
            log.debug("Malformed cell address {}; using A1", text);
            return new Coordinate(0, 0);
        }
        int row = rowNumberOf(matcher.group(2));
        if (row < 1) {
            return null;
        }
        return new Coordinate(row - 1, columnIndexOf(matcher.group(1)));
    }

    // 1-based row number of a digit run, saturating at Integer.MAX_VALUE
    private static int rowNumberOf(String digits) {
        long result = 0;
        for (int i = 0; i < digits.length(); i++) {
            if (result <= Integer.MAX_VALUE) {
                result = result * 10 + (digits.charAt(i) - '0');
            }
        }
        return (int) Math.min(result, Integer.MAX_VALUE);
    }

    /**
     * (11, 1) -> "B12".
     */
    public static String labelOf(Coordinate coordinate) {
        return columnLabelOf(coordinate.getColumn()) + (coordinate.getRow() + 1);
    }

    public static String labelOf(int row, int column) {
        return columnLabelOf(column) + (row + 1);
    }
}
