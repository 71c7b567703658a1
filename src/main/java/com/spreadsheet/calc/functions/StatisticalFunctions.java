package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.spreadsheet.calc.functions.ArgumentUtils.arg;
import static com.spreadsheet.calc.functions.ArgumentUtils.collectNumbers;
import static com.spreadsheet.calc.functions.ArgumentUtils.flatten;
import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * Counting, conditional averaging and order statistics.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void register(FunctionTable table) {
        table.addVariadic("COUNTA", 1, StatisticalFunctions::countA)
                .addVariadic("COUNTBLANK", 1, StatisticalFunctions::countBlank)
                .add("COUNTIF", 2, 2, StatisticalFunctions::countIf)
                .add("AVERAGEIF", 2, 3, StatisticalFunctions::averageIf)
                .addVariadic("MEDIAN", 1, StatisticalFunctions::median)
                .add("LARGE", 2, 2, (args, ctx) -> kth(args, true))
                .add("SMALL", 2, 2, (args, ctx) -> kth(args, false))
                .addVariadic("COUNTIFS", 2, StatisticalFunctions::countIfs)
                .addVariadic("AVERAGEIFS", 3, StatisticalFunctions::averageIfs);
    }

    // Errors count as values; an empty string does not.
    private static FormulaValue countA(List<FormulaValue> args, EvaluationContext ctx) {
        long count = 0;
        for (FormulaValue arg : args) {
            for (FormulaValue v : flatten(arg)) {
                if (!isBlank(v)) {
                    count++;
                }
            }
        }
        return FormulaValue.number(count);
    }

    private static FormulaValue countBlank(List<FormulaValue> args, EvaluationContext ctx) {
        long count = 0;
        for (FormulaValue arg : args) {
            for (FormulaValue v : flatten(arg)) {
                if (isBlank(v)) {
                    count++;
                }
            }
        }
        return FormulaValue.number(count);
    }

    private static boolean isBlank(FormulaValue v) {
        return v.isEmpty() || (v.isString() && v.getString().isEmpty());
    }

    private static FormulaValue countIf(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue range = args.get(0);
        if (range.isError()) {
            return range;
        }
        CriteriaMatcher matcher = CriteriaMatcher.of(args.get(1));
        long count = 0;
        for (FormulaValue v : flatten(range)) {
            if (matcher.matches(v)) {
                count++;
            }
        }
        return FormulaValue.number(count);
    }

    /**
     * AVERAGEIF(range, criteria, [average_range]). Cells of average_range are paired with
     * range by position; #DIV/0! when no numeric cell matches.
     */
    private static FormulaValue averageIf(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue range = args.get(0);
        if (range.isError()) {
            return range;
        }
        CriteriaMatcher matcher = CriteriaMatcher.of(args.get(1));
        FormulaValue averageArg = arg(args, 2);
        if (averageArg != null && averageArg.isError()) {
            return averageArg;
        }
        List<List<FormulaValue>> cells = CriteriaPairs.grid(range);
        List<List<FormulaValue>> averageCells = averageArg != null ? CriteriaPairs.grid(averageArg) : cells;

        double total = 0;
        long count = 0;
        for (int r = 0; r < cells.size(); r++) {
            List<FormulaValue> row = cells.get(r);
            for (int c = 0; c < row.size(); c++) {
                if (!matcher.matches(row.get(c))) {
                    continue;
                }
                FormulaValue v = ArgumentUtils.element(averageCells, r, c);
                if (v.isError()) {
                    return v;
                }
                if (v.isNumber()) {
                    total += v.getNumber();
                    count++;
                }
            }
        }
        if (count == 0) {
            return FormulaValue.error(CellError.DIV0);
        }
        return FormulaValue.number(total / count);
    }

    private static FormulaValue median(List<FormulaValue> args, EvaluationContext ctx) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = collectNumbers(args, numbers);
        if (error != null) {
            return error;
        }
        if (numbers.isEmpty()) {
            return FormulaValue.error(CellError.NUM);
        }
        Collections.sort(numbers);
        int mid = numbers.size() / 2;
        if (numbers.size() % 2 == 0) {
            return FormulaValue.number((numbers.get(mid - 1) + numbers.get(mid)) / 2);
        }
        return FormulaValue.number(numbers.get(mid));
    }

    /**
     * LARGE / SMALL(values, k). A fractional k rounds up for LARGE and down for SMALL;
     * k outside 1..count is #NUM!.
     */
    private static FormulaValue kth(List<FormulaValue> args, boolean largest) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = collectNumbers(args.subList(0, 1), numbers);
        if (error != null) {
            return error;
        }
        FormulaValue kArg = args.get(1);
        if (kArg.isError()) {
            return kArg;
        }
        if (!kArg.isNumber()) {
            return valueError();
        }
        double k = largest ? Math.ceil(kArg.getNumber()) : Math.floor(kArg.getNumber());
        if (numbers.isEmpty() || k < 1 || k > numbers.size()) {
            return FormulaValue.error(CellError.NUM);
        }
        Collections.sort(numbers);
        int position = (int) k;
        return FormulaValue.number(largest ? numbers.get(numbers.size() - position) : numbers.get(position - 1));
    }

    /**
     * COUNTIFS(range1, criteria1, ...): cells where every criteria holds. All ranges
     * must share the first range's dimensions.
     */
    private static FormulaValue countIfs(List<FormulaValue> args, EvaluationContext ctx) {
        if (args.size() % 2 != 0) {
            return valueError();
        }
        FormulaValue first = args.get(0);
        if (first.isError()) {
            return first;
        }
        int rows = first.rowCount();
        int cols = first.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.number(0);
        }
        CriteriaPairs pairs = CriteriaPairs.parse(args, 0, rows, cols);
        if (pairs.getError() != null) {
            return pairs.getError();
        }
        long count = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (pairs.matchesAll(r, c)) {
                    count++;
                }
            }
        }
        return FormulaValue.number(count);
    }

    private static FormulaValue averageIfs(List<FormulaValue> args, EvaluationContext ctx) {
        if (args.size() % 2 != 1) {
            return valueError();
        }
        FormulaValue averageRange = args.get(0);
        if (averageRange.isError()) {
            return averageRange;
        }
        int rows = averageRange.rowCount();
        int cols = averageRange.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.error(CellError.DIV0);
        }
        CriteriaPairs pairs = CriteriaPairs.parse(args, 1, rows, cols);
        if (pairs.getError() != null) {
            return pairs.getError();
        }
        List<List<FormulaValue>> cells = CriteriaPairs.grid(averageRange);
        double total = 0;
        long count = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                FormulaValue v = cells.get(r).get(c);
                if (v.isNumber() && pairs.matchesAll(r, c)) {
                    total += v.getNumber();
                    count++;
                }
            }
        }
        if (count == 0) {
            return FormulaValue.error(CellError.DIV0);
        }
        return FormulaValue.number(total / count);
    }
}
