package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.formula.NumberText;
import com.spreadsheet.calc.models.CellError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.spreadsheet.calc.functions.ArgumentUtils.arg;
import static com.spreadsheet.calc.functions.ArgumentUtils.firstError;
import static com.spreadsheet.calc.functions.ArgumentUtils.truncated;
import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * Lookup and reference functions. Indices are 1-based and truncated toward zero:
 * an index below 1 is #VALUE!, one past the data is #REF!.
 */
final class LookupFunctions {

    static final long MAX_SEQUENCE_CELLS = 1_000_000;

    private LookupFunctions() {
    }

    static void register(FunctionTable table) {
        table.add("INDEX", 2, 3, LookupFunctions::index)
                .add("MATCH", 2, 3, LookupFunctions::match)
                .add("VLOOKUP", 3, 4, LookupFunctions::vlookup)
                .add("ROWS", 1, 1, (args, ctx) -> dimension(args.get(0), true))
                .add("COLUMNS", 1, 1, (args, ctx) -> dimension(args.get(0), false))
                .addVariadic("CHOOSE", 2, LookupFunctions::choose)
                .add("ROW", 0, 1, LookupFunctions::row)
                .add("COLUMN", 0, 1, LookupFunctions::column)
                .add("SEQUENCE", 1, 4, LookupFunctions::sequence);
    }

    /**
     * Equality used by MATCH and VLOOKUP: text case-insensitively, numbers exactly,
     * numeric text equal to the same number, blank equal to 0 and "".
     */
    static boolean lookupEquals(FormulaValue a, FormulaValue b) {
        if (a.isNumber() && b.isNumber()) {
            return a.getNumber() == b.getNumber();
        }
        if (a.isBoolean() && b.isBoolean()) {
            return a.getBoolean() == b.getBoolean();
        }
        if (a.isString() && b.isString()) {
            return a.getString().equalsIgnoreCase(b.getString());
        }
        if (a.isNumber() && b.isString() || a.isString() && b.isNumber()) {
            FormulaValue text = a.isString() ? a : b;
            FormulaValue num = a.isNumber() ? a : b;
            Double parsed = NumberText.parse(text.getString());
            return parsed != null && parsed == num.getNumber();
        }
        if (a.isEmpty() || b.isEmpty()) {
            FormulaValue other = a.isEmpty() ? b : a;
            return other.isEmpty()
                    || (other.isNumber() && other.getNumber() == 0)
                    || (other.isString() && other.getString().isEmpty());
        }
        return false;
    }

    /**
     * INDEX(array, row, [col]). Column defaults to 1.
     */
    private static FormulaValue index(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue error = firstError(args);
        if (error != null) {
            return error;
        }
        FormulaValue array = args.get(0);
        if (!array.isArray()) {
            return valueError();
        }
        int rows = array.rowCount();
        int cols = array.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.error(CellError.REF);
        }
        Long row = truncated(args.get(1));
        if (row == null || row < 1) {
            return valueError();
        }
        FormulaValue colArg = arg(args, 2);
        Long col = colArg == null ? Long.valueOf(1) : truncated(colArg);
        if (col == null || col < 1) {
            return valueError();
        }
        if (row > rows || col > cols) {
            return FormulaValue.error(CellError.REF);
        }
        return array.getArray().get((int) (row - 1)).get((int) (col - 1));
    }

    /**
     * MATCH(value, vector, [type]). Only exact matching (type 0, the default) is
     * supported; any other type is #N/A. The vector must be a single row or column.
     */
    private static FormulaValue match(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue needle = args.get(0);
        if (needle.isError()) {
            return needle;
        }
        if (needle.isArray()) {
            return valueError();
        }
        FormulaValue vector = args.get(1);
        if (!vector.isArray()) {
            return valueError();
        }
        int rows = vector.rowCount();
        int cols = vector.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.error(CellError.NA);
        }
        FormulaValue typeArg = arg(args, 2);
        long type = 0;
        if (typeArg != null) {
            if (typeArg.isError()) {
                return typeArg;
            }
            Long t = truncated(typeArg);
            type = t == null ? 0 : t;
        }
        if (type != 0) {
            return FormulaValue.error(CellError.NA);
        }

        List<FormulaValue> candidates;
        if (rows == 1) {
            candidates = vector.getArray().get(0);
        } else if (cols == 1) {
            candidates = new ArrayList<>(rows);
            for (List<FormulaValue> row : vector.getArray()) {
                candidates.add(row.get(0));
            }
        } else {
            return FormulaValue.error(CellError.NA);
        }
        for (int i = 0; i < candidates.size(); i++) {
            if (lookupEquals(needle, candidates.get(i))) {
                return FormulaValue.number(i + 1);
            }
        }
        return FormulaValue.error(CellError.NA);
    }

    /**
     * VLOOKUP(value, table, col_index, [range_lookup]). Exact match on the first
     * column; the range_lookup flag is accepted but approximate matching is not done.
     */
    private static FormulaValue vlookup(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue error = firstError(args);
        if (error != null) {
            return error;
        }
        FormulaValue needle = args.get(0);
        if (needle.isArray()) {
            return valueError();
        }
        FormulaValue table = args.get(1);
        if (!table.isArray()) {
            return valueError();
        }
        int rows = table.rowCount();
        int cols = table.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.error(CellError.NA);
        }
        Long colIndex = truncated(args.get(2));
        if (colIndex == null || colIndex < 1) {
            return valueError();
        }
        if (colIndex > cols) {
            return FormulaValue.error(CellError.REF);
        }
        for (List<FormulaValue> row : table.getArray()) {
            if (lookupEquals(needle, row.get(0))) {
                return row.get((int) (colIndex - 1));
            }
        }
        return FormulaValue.error(CellError.NA);
    }

    private static FormulaValue dimension(FormulaValue v, boolean rows) {
        if (v.isError()) {
            return v;
        }
        if (!v.isArray()) {
            return FormulaValue.number(1);
        }
        return FormulaValue.number(rows ? v.rowCount() : v.columnCount());
    }

    private static FormulaValue choose(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue indexArg = args.get(0);
        if (indexArg.isError()) {
            return indexArg;
        }
        Long index = truncated(indexArg);
        if (index == null || index < 1 || index > args.size() - 1) {
            return valueError();
        }
        return args.get(index.intValue());
    }

    /**
     * ROW(): the 1-based row of the cell being calculated. Arguments arrive as values,
     * not references, so ROW(range) numbers the range's rows from the current row.
     */
    private static FormulaValue row(List<FormulaValue> args, EvaluationContext ctx) {
        int current = ctx.getCurrentRow() + 1;
        if (args.isEmpty()) {
            return FormulaValue.number(current);
        }
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (!v.isArray()) {
            return FormulaValue.number(current);
        }
        if (v.rowCount() == 0) {
            return valueError();
        }
        List<List<FormulaValue>> out = new ArrayList<>();
        for (int i = 0; i < v.rowCount(); i++) {
            out.add(Collections.singletonList(FormulaValue.number(current + i)));
        }
        return FormulaValue.array(out);
    }

    private static FormulaValue column(List<FormulaValue> args, EvaluationContext ctx) {
        int current = ctx.getCurrentCol() + 1;
        if (args.isEmpty()) {
            return FormulaValue.number(current);
        }
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (!v.isArray()) {
            return FormulaValue.number(current);
        }
        if (v.columnCount() == 0) {
            return valueError();
        }
        List<FormulaValue> row = new ArrayList<>();
        for (int i = 0; i < v.columnCount(); i++) {
            row.add(FormulaValue.number(current + i));
        }
        return FormulaValue.array(Collections.singletonList(row));
    }

    /**
     * SEQUENCE(rows, [cols], [start], [step]): row-major numbers. Blank optional
     * arguments take their defaults (1 column, start 1, step 1).
     */
    private static FormulaValue sequence(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue error = firstError(args);
        if (error != null) {
            return error;
        }
        Long rows = truncated(args.get(0));
        if (rows == null || rows < 1) {
            return valueError();
        }
        long cols = 1;
        FormulaValue colsArg = arg(args, 1);
        if (colsArg != null && !colsArg.isEmpty()) {
            Long c = truncated(colsArg);
            if (c == null || c < 1) {
                return valueError();
            }
            cols = c;
        }
        FormulaValue start = optionalNumber(args, 2);
        FormulaValue step = optionalNumber(args, 3);
        if (start.isError()) {
            return start;
        }
        if (step.isError()) {
            return step;
        }
        if (rows > MAX_SEQUENCE_CELLS || cols > MAX_SEQUENCE_CELLS || rows * cols > MAX_SEQUENCE_CELLS) {
            return valueError();
        }

        List<List<FormulaValue>> out = new ArrayList<>((int) (long) rows);
        double current = start.getNumber();
        for (long r = 0; r < rows; r++) {
            List<FormulaValue> row = new ArrayList<>((int) cols);
            for (long c = 0; c < cols; c++) {
                row.add(FormulaValue.number(current));
                current += step.getNumber();
            }
            out.add(row);
        }
        return FormulaValue.array(out);
    }

    private static FormulaValue optionalNumber(List<FormulaValue> args, int index) {
        FormulaValue v = arg(args, index);
        if (v == null || v.isEmpty()) {
            return FormulaValue.number(1);
        }
        Double n = v.asNumber();
        return n == null ? valueError() : FormulaValue.number(n);
    }
}
