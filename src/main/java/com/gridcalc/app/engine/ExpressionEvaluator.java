package com.gridcalc.app.engine;

import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.CellValues;
import com.gridcalc.app.models.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates one cell's formula against the values computed so far:
 * - non-formulas pass through unchanged
 * - a whole-formula SUM/AVERAGE/MAX/MIN/COUNT(range) goes straight to the aggregate
 * - otherwise embedded range aggregates and cell addresses are substituted
 *   and the remaining text is handed to the {@link ExpressionParser}
 * Any failure becomes {@link ErrorToken#ERROR}; nothing is thrown.
 */
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    // "SUM(A1:C3)" as the entire formula. Function name in any case; the argument
    // may not hold calls, lists or lowercase letters (those go through the parser)
    private static final Pattern AGGREGATE_FORMULA =
            Pattern.compile("^((?i:SUM|AVERAGE|MAX|MIN|COUNT))\\s*\\(([^(),a-z]*)\\)$");

    // "SUM(A1:C3)" inside a larger expression, e.g. "=SUM(A1:A3) * 2"
    private static final Pattern AGGREGATE_CALL = Pattern.compile(
            "\\b((?i:SUM|AVERAGE|MAX|MIN|COUNT))\\s*\\(\\s*([A-Z]+[0-9]+(?:\\s*:\\s*[A-Z]+[0-9]+)?)\\s*\\)");

    private final ExpressionParser parser;

    public ExpressionEvaluator(ExpressionParser parser) {
        this.parser = parser;
    }

    /**
     * @param formulaText raw cell content
     * @param at          the cell being evaluated, for diagnostics
     * @param values      evaluated values visible at this point of the pass
     * @return the raw text for non-formulas, otherwise a Double rounded to
     * 10 decimals, a String, or {@link ErrorToken#ERROR}
     */
    public Object evaluate(String formulaText, Coordinate at, CellValues values) {
        if (formulaText == null || !formulaText.startsWith(CellContent.FORMULA_MARKER)) {
            return formulaText;
        }
        String expression = formulaText.substring(CellContent.FORMULA_MARKER.length()).trim();
        try {
            Matcher whole = AGGREGATE_FORMULA.matcher(expression);
            if (whole.matches()) {
                AggregateFunction function = AggregateFunction.fromName(whole.group(1));
                return finish(function.apply(whole.group(2).trim(), values));
            }

            String substituted = substituteAddresses(substituteAggregates(expression, values), values);
            Object result = parser.evaluate(substituted);
            if (result instanceof Double) {
                return finish((Double) result);
            }
            return result;
        } catch (RuntimeException e) {
            log.debug("Formula {} at {} failed: {}", formulaText, ReferenceCodec.labelOf(at), e.getMessage());
            return ErrorToken.ERROR;
        }
    }

    private static Object finish(double number) {
        if (!Double.isFinite(number)) {
            return ErrorToken.ERROR;
        }
        return NumericCoercion.roundForDisplay(number);
    }

    /**
     * Replaces range aggregates embedded in a larger expression by their result.
     */
    private String substituteAggregates(String expression, CellValues values) {
        Matcher matcher = AGGREGATE_CALL.matcher(expression);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            AggregateFunction function = AggregateFunction.fromName(matcher.group(1));
            double result = function.apply(matcher.group(2).replaceAll("\\s+", ""), values);
            matcher.appendReplacement(out, Matcher.quoteReplacement(numberLiteral(result)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Replaces every address with its current value: numbers and numeric-looking
     * text inline as numbers, empty or out-of-bounds cells as 0, other text as a
     * quoted literal.
     */
    private String substituteAddresses(String expression, CellValues values) {
        Matcher matcher = ReferenceCodec.FORMULA_ADDRESS.matcher(expression);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Coordinate ref = ReferenceCodec.resolveAddress(matcher.group());
            String replacement;
            if (ref == null || !values.contains(ref.getRow(), ref.getColumn())) {
                replacement = "0";
            } else {
                replacement = operandFor(values.valueAt(ref.getRow(), ref.getColumn()));
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String operandFor(Object value) {
        if (value == null || "".equals(value)) {
            return "0";
        }
        Double number = NumericCoercion.toNumber(value);
        if (number != null) {
            return numberLiteral(number);
        }
        String text = String.valueOf(value);
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    // Negative numbers are parenthesized so "-3^2" style precedence can't change their meaning
    private static String numberLiteral(double number) {
        String plain = NumericCoercion.toPlainString(number);
        return number < 0 ? "(" + plain + ")" : plain;
    }
}
