package com.gridcalc.app.engine;

import com.gridcalc.app.exceptions.FormulaException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates the arithmetic/text sublanguage a formula is reduced to once
 * its cell addresses have been substituted.
 *
 * <pre>
 * expression := additive ( '&amp;' additive )*
 * additive   := term ( ('+' | '-') term )*
 * term       := unary ( ('*' | '/') unary )*
 * unary      := ('-' | '+') unary | power
 * power      := primary ( '^' unary )?
 * primary    := number | string | '(' expression ')' | name '(' arguments? ')'
 * </pre>
 *
 * Values are Double or String. Arithmetic needs numbers on both sides,
 * '&amp;' joins the text forms of its operands. {@code -2^2} is -4.
 * Functions: ABS, SQRT, ROUND, FLOOR, CEIL, MOD, POWER, LEN, UPPER, LOWER,
 * CONCAT and the variadic aggregates SUM, AVERAGE, MAX, MIN, COUNT.
 */
public class ExpressionParser {

    private static final int MAX_ROUND_DIGITS = 15;

    private final int maxDepth;

    public ExpressionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @return a Double (finite) or a String
     * @throws FormulaException on any syntax or evaluation problem
     */
    public Object evaluate(String expression) {
        Parse parse = new Parse(expression);
        Object result = parse.expression();
        parse.skipWhitespace();
        if (!parse.atEnd()) {
            throw new FormulaException("Unexpected '" + parse.peek() + "' at position " + parse.pos);
        }
        return result;
    }

    /**
     * Cursor over one expression. Not reusable.
     */
    private final class Parse {
        private final String text;
        private int pos;
        private int depth;

        Parse(String text) {
            this.text = text == null ? "" : text;
        }

        Object expression() {
            Object left = additive();
            while (consume('&')) {
                Object right = additive();
                left = asText(left) + asText(right);
            }
            return left;
        }

        private Object additive() {
            Object left = term();
            while (true) {
                if (consume('+')) {
                    left = checked(asNumber(left) + asNumber(term()));
                } else if (consume('-')) {
                    left = checked(asNumber(left) - asNumber(term()));
                } else {
                    return left;
                }
            }
        }

        private Object term() {
            Object left = unary();
            while (true) {
                if (consume('*')) {
                    left = checked(asNumber(left) * asNumber(unary()));
                } else if (consume('/')) {
                    double divisor = asNumber(unary());
                    if (divisor == 0) {
                        throw new FormulaException("Division by zero");
                    }
                    left = checked(asNumber(left) / divisor);
                } else {
                    return left;
                }
            }
        }

        private Object unary() {
            enter();
            try {
                if (consume('-')) {
                    return -asNumber(unary());
                }
                if (consume('+')) {
                    return asNumber(unary());
                }
                return power();
            } finally {
                depth--;
            }
        }

        private Object power() {
            Object base = primary();
            if (consume('^')) {
                return checked(Math.pow(asNumber(base), asNumber(unary())));
            }
            return base;
        }

        private Object primary() {
            skipWhitespace();
            if (atEnd()) {
                throw new FormulaException("Unexpected end of expression");
            }
            char c = peek();
            if (c == '(') {
                pos++;
                enter();
                try {
                    Object inner = expression();
                    expect(')');
                    return inner;
                } finally {
                    depth--;
                }
            }
            if (c == '"') {
                return string();
            }
            if (Character.isDigit(c) || c == '.') {
                return number();
            }
            if (Character.isLetter(c) || c == '_') {
                return call();
            }
            throw new FormulaException("Unexpected '" + c + "' at position " + pos);
        }

        private Double number() {
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                pos++;
            }
            // Optional exponent, only when digits follow
            if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
                int mark = pos;
                pos++;
                if (!atEnd() && (peek() == '+' || peek() == '-')) {
                    pos++;
                }
                if (atEnd() || !Character.isDigit(peek())) {
                    pos = mark;
                } else {
                    while (!atEnd() && Character.isDigit(peek())) {
                        pos++;
                    }
                }
            }
            String literal = text.substring(start, pos);
            try {
                return checked(Double.parseDouble(literal));
            } catch (NumberFormatException e) {
                throw new FormulaException("Malformed number: " + literal);
            }
        }

        private String string() {
            pos++; // opening quote
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c == '\\' && !atEnd()) {
                    value.append(text.charAt(pos++));
                } else {
                    value.append(c);
                }
            }
            throw new FormulaException("Unterminated string literal");
        }

        private Object call() {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                pos++;
            }
            String name = text.substring(start, pos);
            skipWhitespace();
            if (!consume('(')) {
                throw new FormulaException("Unknown name: " + name);
            }
            enter();
            try {
                List<Object> arguments = new ArrayList<>();
                if (!consume(')')) {
                    do {
                        arguments.add(expression());
                    } while (consume(','));
                    expect(')');
                }
                return invoke(name, arguments);
            } finally {
                depth--;
            }
        }

        // ------------------------
        // Cursor helpers
        // ------------------------

        private void enter() {
            if (++depth > maxDepth) {
                throw new FormulaException("Expression nested deeper than " + maxDepth);
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        private boolean consume(char expected) {
            skipWhitespace();
            if (!atEnd() && peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char expected) {
            if (!consume(expected)) {
                throw new FormulaException("Expected '" + expected + "' at position " + pos);
            }
        }
    }

    // ------------------------
    // Functions
    // ------------------------

    private static Object invoke(String name, List<Object> args) {
        String upper = name.toUpperCase(Locale.ROOT);
        AggregateFunction aggregate = AggregateFunction.fromName(upper);
        if (aggregate != null) {
            return checked(aggregate.applyToArguments(args.toArray()));
        }
        switch (upper) {
            case "ABS":
                return Math.abs(asNumber(single(upper, args)));
            case "SQRT": {
                double value = asNumber(single(upper, args));
                if (value < 0) {
                    throw new FormulaException("SQRT of a negative number");
                }
                return Math.sqrt(value);
            }
            case "ROUND": {
                arity(upper, args, 1, 2);
                int digits = args.size() == 2 ? (int) asNumber(args.get(1)) : 0;
                digits = Math.max(-MAX_ROUND_DIGITS, Math.min(MAX_ROUND_DIGITS, digits));
                return BigDecimal.valueOf(asNumber(args.get(0))).setScale(digits, RoundingMode.HALF_UP).doubleValue();
            }
            case "FLOOR":
                return Math.floor(asNumber(single(upper, args)));
            case "CEIL":
                return Math.ceil(asNumber(single(upper, args)));
            case "MOD": {
                arity(upper, args, 2, 2);
                double dividend = asNumber(args.get(0));
                double divisor = asNumber(args.get(1));
                if (divisor == 0) {
                    throw new FormulaException("MOD by zero");
                }
                // Result takes the divisor's sign
                return checked(dividend - divisor * Math.floor(dividend / divisor));
            }
            case "POWER":
                arity(upper, args, 2, 2);
                return checked(Math.pow(asNumber(args.get(0)), asNumber(args.get(1))));
            case "LEN":
                return (double) asText(single(upper, args)).length();
            case "UPPER":
                return asText(single(upper, args)).toUpperCase(Locale.ROOT);
            case "LOWER":
                return asText(single(upper, args)).toLowerCase(Locale.ROOT);
            case "CONCAT": {
                StringBuilder joined = new StringBuilder();
                for (Object arg : args) {
                    joined.append(asText(arg));
                }
                return joined.toString();
            }
            default:
                throw new FormulaException("Unknown function: " + name);
        }
    }

    private static Object single(String name, List<Object> args) {
        arity(name, args, 1, 1);
        return args.get(0);
    }

    private static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new FormulaException(name + " takes " + (min == max ? min : min + "-" + max)
                    + " argument(s), got " + args.size());
        }
    }

    // ------------------------
    // Value conversions
    // ------------------------

    private static double asNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        throw new FormulaException("Expected a number, got text \"" + value + "\"");
    }

    private static String asText(Object value) {
        if (value instanceof Double) {
            return NumericCoercion.toPlainString(NumericCoercion.roundForDisplay((Double) value));
        }
        return String.valueOf(value);
    }

    private static Double checked(double value) {
        if (!Double.isFinite(value)) {
            throw new FormulaException("Result is not a finite number");
        }
        return value;
    }
}
