package com.gridcalc.app.engine;

import com.gridcalc.app.models.CellValues;
import com.gridcalc.app.models.Coordinate;

import java.util.List;
import java.util.Locale;

/**
 * Range aggregates. Only values with a numeric reading take part;
 * text, empty and error cells are skipped, never fatal.
 * With nothing numeric every function yields 0.
 */
public enum AggregateFunction {

    SUM {
        @Override
        double reduce(double[] numbers, int count) {
            double sum = 0;
            for (int i = 0; i < count; i++) {
                sum += numbers[i];
            }
            return sum;
        }
    },
    AVERAGE {
        @Override
        double reduce(double[] numbers, int count) {
            return count == 0 ? 0 : SUM.reduce(numbers, count) / count;
        }
    },
    MAX {
        @Override
        double reduce(double[] numbers, int count) {
            if (count == 0) {
                return 0;
            }
            double max = numbers[0];
            for (int i = 1; i < count; i++) {
                max = Math.max(max, numbers[i]);
            }
            return max;
        }
    },
    MIN {
        @Override
        double reduce(double[] numbers, int count) {
            if (count == 0) {
                return 0;
            }
            double min = numbers[0];
            for (int i = 1; i < count; i++) {
                min = Math.min(min, numbers[i]);
            }
            return min;
        }
    },
    COUNT {
        @Override
        double reduce(double[] numbers, int count) {
            return count;
        }
    };

    /**
     * Folds the first {@code count} entries of {@code numbers}.
     */
    abstract double reduce(double[] numbers, int count);

    /**
     * Applies this function to every in-bounds cell of a range token
     * ("A1:B3" or "A1"), reading the values evaluated so far.
     */
    public double apply(String rangeToken, CellValues values) {
        List<Coordinate> cells =
                RangeResolver.resolve(rangeToken, values.getRowCount(), values.getColumnCount());
        double[] numbers = new double[cells.size()];
        int count = 0;
        for (Coordinate cell : cells) {
            Double number = NumericCoercion.toNumber(values.valueAt(cell.getRow(), cell.getColumn()));
            if (number != null) {
                numbers[count++] = number;
            }
        }
        return reduce(numbers, count);
    }

    /**
     * Applies this function to already evaluated arguments, as in SUM(1, A2, "x").
     */
    public double applyToArguments(Object... arguments) {
        double[] numbers = new double[arguments.length];
        int count = 0;
        for (Object argument : arguments) {
            Double number = NumericCoercion.toNumber(argument);
            if (number != null) {
                numbers[count++] = number;
            }
        }
        return reduce(numbers, count);
    }

    /**
     * Case-insensitive lookup; null when the name is not an aggregate.
     */
    public static AggregateFunction fromName(String name) {
        if (name == null) {
            return null;
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (AggregateFunction function : values()) {
            if (function.name().equals(upper)) {
                return function;
            }
        }
        return null;
    }
}
