package com.gridcalc.app.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number handling shared by aggregates, substitution and the parser.
 */
public final class NumericCoercion {

    // Leading numeric prefix: "12abc" -> 12, " -3.5e2x" -> -350, ".5" -> 0.5
    private static final Pattern NUMERIC_PREFIX =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    public static final int DISPLAY_SCALE = 10;

    private NumericCoercion() {
    }

    /**
     * Numeric reading of an evaluated value, or null when it has none.
     * Doubles are taken as-is; strings by their leading numeric prefix.
     * Empty strings and error tokens are not numeric.
     */
    public static Double toNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (!(value instanceof String)) {
            return null;
        }
        Matcher matcher = NUMERIC_PREFIX.matcher((String) value);
        if (!matcher.find()) {
            return null;
        }
        double parsed = Double.parseDouble(matcher.group(1));
        return Double.isFinite(parsed) ? parsed : null;
    }

    /**
     * Rounds to 10 decimal places (half-up) so 0.1 + 0.2 shows as 0.3.
     */
    public static double roundForDisplay(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(DISPLAY_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Plain decimal text without exponent, "8" rather than "8.0".
     * Exponent-free output matters: "1.0E10" would otherwise read as address E10.
     */
    public static String toPlainString(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
