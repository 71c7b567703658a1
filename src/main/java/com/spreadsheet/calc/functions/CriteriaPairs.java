package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.FormulaValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The (criteria_range, criteria) pairs of a SUMIFS / COUNTIFS / AVERAGEIFS call.
 * Every criteria range must have the dimensions of the grid it is checked against.
 */
final class CriteriaPairs {

    private final List<List<List<FormulaValue>>> ranges;
    private final List<CriteriaMatcher> matchers;
    private final FormulaValue error;

    private CriteriaPairs(List<List<List<FormulaValue>>> ranges, List<CriteriaMatcher> matchers, FormulaValue error) {
        this.ranges = ranges;
        this.matchers = matchers;
        this.error = error;
    }

    /**
     * Reads pairs from {@code args[from..]}. A scalar range counts as a 1x1 grid.
     */
    static CriteriaPairs parse(List<FormulaValue> args, int from, int rows, int cols) {
        List<List<List<FormulaValue>>> ranges = new ArrayList<>();
        List<CriteriaMatcher> matchers = new ArrayList<>();
        for (int i = from; i + 1 < args.size(); i += 2) {
            FormulaValue range = args.get(i);
            FormulaValue criteria = args.get(i + 1);
            if (range.isError()) {
                return failed(range);
            }
            if (range.rowCount() != rows || range.columnCount() != cols) {
                return failed(ArgumentUtils.valueError());
            }
            if (criteria.isError()) {
                return failed(criteria);
            }
            ranges.add(grid(range));
            matchers.add(CriteriaMatcher.of(criteria));
        }
        return new CriteriaPairs(ranges, matchers, null);
    }

    private static CriteriaPairs failed(FormulaValue error) {
        return new CriteriaPairs(Collections.emptyList(), Collections.emptyList(), error);
    }

    /**
     * An array's rows, or a scalar wrapped as a single cell.
     */
    static List<List<FormulaValue>> grid(FormulaValue v) {
        if (v.isArray()) {
            return v.getArray();
        }
        return Collections.singletonList(Collections.singletonList(v));
    }

    /**
     * Error value that stops the call (bad range, mismatched size, error criteria), or null.
     */
    FormulaValue getError() {
        return error;
    }

    boolean matchesAll(int row, int col) {
        for (int i = 0; i < ranges.size(); i++) {
            if (!matchers.get(i).matches(ranges.get(i).get(row).get(col))) {
                return false;
            }
        }
        return true;
    }
}
