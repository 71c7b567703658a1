package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleFunction;

/**
 * Argument coercions shared by the function families.
 * Helpers that can fail return an error FormulaValue; callers check isError() and return it.
 */
final class ArgumentUtils {

    private ArgumentUtils() {
    }

    static FormulaValue arg(List<FormulaValue> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    static FormulaValue valueError() {
        return FormulaValue.error(CellError.VALUE);
    }

    /**
     * Strict numeric argument: a number as-is, empty or missing as {@code ifEmpty},
     * an error passed through, anything else #VALUE!.
     */
    static FormulaValue number(List<FormulaValue> args, int index, double ifEmpty) {
        FormulaValue v = arg(args, index);
        if (v == null || v.isEmpty()) {
            return FormulaValue.number(ifEmpty);
        }
        if (v.isNumber() || v.isError()) {
            return v;
        }
        return valueError();
    }

    /**
     * Applies {@code fn} to the first argument read through {@link #number}.
     */
    static FormulaValue mapNumber(List<FormulaValue> args, double ifEmpty, DoubleFunction<FormulaValue> fn) {
        FormulaValue n = number(args, 0, ifEmpty);
        return n.isError() ? n : fn.apply(n.getNumber());
    }

    /**
     * #NUM! for NaN and infinities.
     */
    static FormulaValue finite(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            return FormulaValue.error(CellError.NUM);
        }
        return FormulaValue.number(n);
    }

    /**
     * First top-level error argument, or null.
     */
    static FormulaValue firstError(List<FormulaValue> args) {
        for (FormulaValue v : args) {
            if (v.isError()) {
                return v;
            }
        }
        return null;
    }

    /**
     * Numeric view truncated toward zero, or null when there is none.
     */
    static Long truncated(FormulaValue v) {
        Double n = v.asNumber();
        if (n == null || n.isNaN()) {
            return null;
        }
        return (long) n.doubleValue();
    }

    /**
     * Elements of an array in row-major order; a scalar is a one-element list.
     */
    static List<FormulaValue> flatten(FormulaValue v) {
        if (!v.isArray()) {
            return Collections.singletonList(v);
        }
        List<FormulaValue> out = new ArrayList<>();
        for (List<FormulaValue> row : v.getArray()) {
            out.addAll(row);
        }
        return out;
    }

    /**
     * Element (row, col) of an array, or EMPTY when out of bounds.
     */
    static FormulaValue element(List<List<FormulaValue>> array, int row, int col) {
        if (row >= array.size()) {
            return FormulaValue.EMPTY;
        }
        List<FormulaValue> r = array.get(row);
        return col < r.size() ? r.get(col) : FormulaValue.EMPTY;
    }

    /**
     * Collects the numbers among the arguments (array elements included), skipping
     * text, booleans and blanks. Returns the first error met, or null.
     */
    static FormulaValue collectNumbers(List<FormulaValue> args, List<Double> into) {
        for (FormulaValue arg : args) {
            for (FormulaValue v : flatten(arg)) {
                if (v.isError()) {
                    return v;
                }
                if (v.isNumber()) {
                    into.add(v.getNumber());
                }
            }
        }
        return null;
    }
}
