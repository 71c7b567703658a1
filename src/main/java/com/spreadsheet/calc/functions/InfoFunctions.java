package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.util.List;
import java.util.function.Predicate;

final class InfoFunctions {

    private InfoFunctions() {
    }

    static void register(FunctionTable table) {
        table.add("ISBLANK", 1, 1, (args, ctx) -> is(args, FormulaValue::isEmpty))
                .add("ISNUMBER", 1, 1, (args, ctx) -> is(args, FormulaValue::isNumber))
                .add("ISTEXT", 1, 1, (args, ctx) -> is(args, FormulaValue::isString))
                .add("ISERROR", 1, 1, (args, ctx) -> is(args, FormulaValue::isError))
                .add("ISNA", 1, 1, (args, ctx) -> is(args, v -> v.getError() == CellError.NA))
                .add("NA", 0, 0, (args, ctx) -> FormulaValue.error(CellError.NA));
    }

    // An array argument is #VALUE!; errors are inspected, not propagated.
    private static FormulaValue is(List<FormulaValue> args, Predicate<FormulaValue> test) {
        FormulaValue v = args.get(0);
        if (v.isArray()) {
            return ArgumentUtils.valueError();
        }
        return FormulaValue.bool(test.test(v));
    }
}
