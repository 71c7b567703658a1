package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.util.List;

import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * IF, AND, OR and friends. Every argument has already been evaluated when these run,
 * so an IF picks between two computed values rather than skipping a branch.
 */
final class LogicalFunctions {

    private static final double EPSILON = 1e-10;

    private LogicalFunctions() {
    }

    static void register(FunctionTable table) {
        table.add("IF", 2, 3, LogicalFunctions::ifFunction)
                .addVariadic("AND", 1, LogicalFunctions::and)
                .addVariadic("OR", 1, LogicalFunctions::or)
                .addVariadic("XOR", 1, LogicalFunctions::xor)
                .add("NOT", 1, 1, LogicalFunctions::not)
                .add("IFERROR", 2, 2, (args, ctx) -> args.get(0).isError() ? args.get(1) : args.get(0))
                .add("IFNA", 2, 2, (args, ctx) -> args.get(0).getError() == CellError.NA ? args.get(1) : args.get(0))
                .add("TRUE", 0, 0, (args, ctx) -> FormulaValue.TRUE)
                .add("FALSE", 0, 0, (args, ctx) -> FormulaValue.FALSE)
                .addVariadic("IFS", 2, LogicalFunctions::ifs)
                .addVariadic("SWITCH", 3, LogicalFunctions::switchFunction);
    }

    /**
     * Condition as a boolean: booleans, numbers (non-zero is true), "TRUE"/"FALSE" text
     * and blank (false). Returns null when the value is not a condition.
     */
    private static Boolean condition(FormulaValue v) {
        if (v.isEmpty()) {
            return Boolean.FALSE;
        }
        if (v.isArray()) {
            return null;
        }
        return v.asBoolean();
    }

    private static FormulaValue ifFunction(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue test = args.get(0);
        if (test.isError()) {
            return test;
        }
        Boolean b = condition(test);
        if (b == null) {
            return valueError();
        }
        if (b) {
            return args.get(1);
        }
        return args.size() > 2 ? args.get(2) : FormulaValue.FALSE;
    }

    private static final class Tally {
        int truthy;
        int falsy;
        FormulaValue error;
    }

    // Booleans and numbers are counted; text and blanks are ignored. Stops at the first error.
    private static Tally tally(List<FormulaValue> args) {
        Tally tally = new Tally();
        for (FormulaValue arg : args) {
            for (FormulaValue v : ArgumentUtils.flatten(arg)) {
                if (v.isError()) {
                    tally.error = v;
                    return tally;
                }
                if (v.isBoolean() || v.isNumber()) {
                    if (v.asBoolean()) {
                        tally.truthy++;
                    } else {
                        tally.falsy++;
                    }
                }
            }
        }
        return tally;
    }

    private static FormulaValue and(List<FormulaValue> args, EvaluationContext ctx) {
        Tally tally = tally(args);
        return tally.error != null ? tally.error : FormulaValue.bool(tally.falsy == 0);
    }

    private static FormulaValue or(List<FormulaValue> args, EvaluationContext ctx) {
        Tally tally = tally(args);
        return tally.error != null ? tally.error : FormulaValue.bool(tally.truthy > 0);
    }

    private static FormulaValue xor(List<FormulaValue> args, EvaluationContext ctx) {
        Tally tally = tally(args);
        return tally.error != null ? tally.error : FormulaValue.bool(tally.truthy % 2 == 1);
    }

    private static FormulaValue not(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (v.isBoolean()) {
            return FormulaValue.bool(!v.getBoolean());
        }
        if (v.isNumber()) {
            return FormulaValue.bool(v.getNumber() == 0);
        }
        return valueError();
    }

    /**
     * IFS(cond1, value1, cond2, value2, ...): value of the first true condition, #N/A if none.
     */
    private static FormulaValue ifs(List<FormulaValue> args, EvaluationContext ctx) {
        if (args.size() % 2 != 0) {
            return valueError();
        }
        for (int i = 0; i < args.size(); i += 2) {
            FormulaValue test = args.get(i);
            if (test.isError()) {
                return test;
            }
            Boolean b = condition(test);
            if (b == null) {
                return valueError();
            }
            if (b) {
                return args.get(i + 1);
            }
        }
        return FormulaValue.error(CellError.NA);
    }

    /**
     * SWITCH(expr, value1, result1, ..., [default]). An odd count of trailing arguments
     * means the last one is the default; without a default no match is #N/A.
     */
    private static FormulaValue switchFunction(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue expression = args.get(0);
        if (expression.isError()) {
            return expression;
        }
        int remaining = args.size() - 1;
        boolean hasDefault = remaining % 2 == 1;
        int pairs = remaining / 2;
        for (int i = 0; i < pairs; i++) {
            FormulaValue candidate = args.get(1 + i * 2);
            if (candidate.isError()) {
                return candidate;
            }
            if (sameValue(expression, candidate)) {
                return args.get(2 + i * 2);
            }
        }
        return hasDefault ? args.get(args.size() - 1) : FormulaValue.error(CellError.NA);
    }

    // Blank equals 0 and ""; booleans equal 1/0; text compares case-insensitively.
    private static boolean sameValue(FormulaValue a, FormulaValue b) {
        if (a.isString() && b.isString()) {
            return a.getString().equalsIgnoreCase(b.getString());
        }
        if (a.isEmpty() && b.isEmpty()) {
            return true;
        }
        if (a.isString() || b.isString()) {
            FormulaValue text = a.isString() ? a : b;
            FormulaValue other = a.isString() ? b : a;
            return other.isEmpty() && text.getString().isEmpty();
        }
        if (a.isBoolean() && b.isBoolean()) {
            return a.getBoolean() == b.getBoolean();
        }
        Double x = a.isArray() || a.isError() ? null : a.asNumber();
        Double y = b.isArray() || b.isError() ? null : b.asNumber();
        return x != null && y != null && Math.abs(x - y) < EPSILON;
    }
}
