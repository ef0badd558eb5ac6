package com.gridcalc.app.models;

/**
 * Raw content of one cell, classified once when it is written
 * so the recalculation pass doesn't have to sniff strings again.
 */
public final class CellContent {

    public enum Kind {
        EMPTY,
        TEXT,
        NUMBER,
        FORMULA
    }

    public static final String FORMULA_MARKER = "=";
    public static final CellContent EMPTY = new CellContent(Kind.EMPTY, "");

    private final Kind kind;
    private final String raw;

    private CellContent(Kind kind, String raw) {
        this.kind = kind;
        this.raw = raw;
    }

    /**
     * Classifies raw cell text. Null counts as empty.
     * The raw text is kept verbatim, including surrounding whitespace.
     */
    public static CellContent of(String raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        if (raw.startsWith(FORMULA_MARKER)) {
            return new CellContent(Kind.FORMULA, raw);
        }
        if (isWholeNumber(raw.trim())) {
            return new CellContent(Kind.NUMBER, raw);
        }
        return new CellContent(Kind.TEXT, raw);
    }

    private static boolean isWholeNumber(String text) {
        if (text.isEmpty()) {
            return false;
        }
        // Double.parseDouble also accepts "NaN", "Infinity", hex and a trailing "d"/"f"
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!(Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
                return false;
            }
        }
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public Kind getKind() {
        return kind;
    }
    public String getRaw() {
        return raw;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }
    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    @Override
    public String toString() {
        return kind + "[" + raw + "]";
    }
}
