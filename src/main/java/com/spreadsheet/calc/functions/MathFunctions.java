package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;

import static com.spreadsheet.calc.functions.ArgumentUtils.arg;
import static com.spreadsheet.calc.functions.ArgumentUtils.finite;
import static com.spreadsheet.calc.functions.ArgumentUtils.mapNumber;
import static com.spreadsheet.calc.functions.ArgumentUtils.number;
import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * Arithmetic, rounding, trigonometric and conditional-sum functions.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionTable table) {
        table.addVariadic("SUM", 1, MathFunctions::sum)
                .addVariadic("AVERAGE", 1, MathFunctions::average)
                .addVariadic("MIN", 1, MathFunctions::min)
                .addVariadic("MAX", 1, MathFunctions::max)
                .addVariadic("COUNT", 1, MathFunctions::count)
                .addVolatile("RAND", 0, 0, MathFunctions::rand)
                .addVolatile("RANDBETWEEN", 2, 2, MathFunctions::randBetween)
                .add("ABS", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.abs(n))))
                .add("ROUND", 1, 2, (args, ctx) -> round(args, RoundingMode.HALF_UP))
                .add("ROUNDUP", 2, 2, (args, ctx) -> round(args, RoundingMode.UP))
                .add("ROUNDDOWN", 2, 2, (args, ctx) -> round(args, RoundingMode.DOWN))
                .add("TRUNC", 1, 2, (args, ctx) -> round(args, RoundingMode.DOWN))
                .add("INT", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.floor(n))))
                .add("MOD", 2, 2, MathFunctions::mod)
                .add("SIGN", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.signum(n) + 0.0)))
                .add("SQRT", 1, 1, (args, ctx) -> mapNumber(args, 0,
                        n -> n < 0 ? FormulaValue.error(CellError.NUM) : FormulaValue.number(Math.sqrt(n))))
                .add("POWER", 2, 2, MathFunctions::power)
                .add("LOG", 1, 2, MathFunctions::log)
                .add("LOG10", 1, 1, (args, ctx) -> positiveLog(args, Math::log10))
                .add("LN", 1, 1, (args, ctx) -> positiveLog(args, Math::log))
                .add("EXP", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> finite(Math.exp(n))))
                .add("PI", 0, 0, (args, ctx) -> FormulaValue.number(Math.PI))
                .add("SIN", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.sin(n))))
                .add("COS", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.cos(n))))
                .add("TAN", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> finite(Math.tan(n))))
                .add("ASIN", 1, 1, (args, ctx) -> mapNumber(args, 0,
                        n -> inUnitInterval(n) ? FormulaValue.number(Math.asin(n)) : FormulaValue.error(CellError.NUM)))
                .add("ACOS", 1, 1, (args, ctx) -> mapNumber(args, 0,
                        n -> inUnitInterval(n) ? FormulaValue.number(Math.acos(n)) : FormulaValue.error(CellError.NUM)))
                .add("ATAN", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.atan(n))))
                .add("ATAN2", 2, 2, MathFunctions::atan2)
                .add("DEGREES", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.toDegrees(n))))
                .add("RADIANS", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> FormulaValue.number(Math.toRadians(n))))
                .add("CEILING.MATH", 1, 3, (args, ctx) -> roundToMultiple(args, true))
                .add("FLOOR.MATH", 1, 3, (args, ctx) -> roundToMultiple(args, false))
                .add("ODD", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> roundToParity(n, true)))
                .add("EVEN", 1, 1, (args, ctx) -> mapNumber(args, 0, n -> roundToParity(n, false)))
                .add("SUMIF", 2, 3, MathFunctions::sumIf)
                .addVariadic("SUMIFS", 3, MathFunctions::sumIfs)
                .addVariadic("SUMPRODUCT", 1, MathFunctions::sumProduct);
    }

    // ------------------------
    // Aggregates
    // ------------------------

    // Only numbers take part; text, booleans and blanks are skipped.
    private static FormulaValue sum(List<FormulaValue> args, EvaluationContext ctx) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = ArgumentUtils.collectNumbers(args, numbers);
        if (error != null) {
            return error;
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return FormulaValue.number(total);
    }

    private static FormulaValue average(List<FormulaValue> args, EvaluationContext ctx) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = ArgumentUtils.collectNumbers(args, numbers);
        if (error != null) {
            return error;
        }
        if (numbers.isEmpty()) {
            return FormulaValue.error(CellError.DIV0);
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return FormulaValue.number(total / numbers.size());
    }

    private static FormulaValue min(List<FormulaValue> args, EvaluationContext ctx) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = ArgumentUtils.collectNumbers(args, numbers);
        if (error != null) {
            return error;
        }
        double result = Double.POSITIVE_INFINITY;
        for (double n : numbers) {
            result = Math.min(result, n);
        }
        return FormulaValue.number(numbers.isEmpty() ? 0 : result);
    }

    private static FormulaValue max(List<FormulaValue> args, EvaluationContext ctx) {
        List<Double> numbers = new ArrayList<>();
        FormulaValue error = ArgumentUtils.collectNumbers(args, numbers);
        if (error != null) {
            return error;
        }
        double result = Double.NEGATIVE_INFINITY;
        for (double n : numbers) {
            result = Math.max(result, n);
        }
        return FormulaValue.number(numbers.isEmpty() ? 0 : result);
    }

    // Counts numbers; errors are not counted and do not propagate.
    private static FormulaValue count(List<FormulaValue> args, EvaluationContext ctx) {
        int count = 0;
        for (FormulaValue arg : args) {
            for (FormulaValue v : ArgumentUtils.flatten(arg)) {
                if (v.isNumber()) {
                    count++;
                }
            }
        }
        return FormulaValue.number(count);
    }

    // ------------------------
    // Random
    // ------------------------

    private static FormulaValue rand(List<FormulaValue> args, EvaluationContext ctx) {
        return FormulaValue.number(ThreadLocalRandom.current().nextDouble());
    }

    private static FormulaValue randBetween(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue bottom = args.get(0);
        FormulaValue top = args.get(1);
        if (bottom.isError()) {
            return bottom;
        }
        if (top.isError()) {
            return top;
        }
        if (!bottom.isNumber() || !top.isNumber()) {
            return valueError();
        }
        double low = Math.ceil(bottom.getNumber());
        double high = Math.floor(top.getNumber());
        if (low > high) {
            return FormulaValue.error(CellError.NUM);
        }
        double span = high - low + 1;
        return FormulaValue.number(Math.floor(ThreadLocalRandom.current().nextDouble() * span) + low);
    }

    // ------------------------
    // Rounding
    // ------------------------

    /**
     * ROUND / ROUNDUP / ROUNDDOWN / TRUNC. Digits are truncated to an integer;
     * negative digits round to the left of the decimal point.
     * The number is rounded in decimal, so ROUND(2.675, 2) is 2.68 as displayed.
     * HALF_UP and UP both round away from zero for negative numbers.
     */
    private static FormulaValue round(List<FormulaValue> args, RoundingMode mode) {
        FormulaValue n = number(args, 0, 0);
        if (n.isError()) {
            return n;
        }
        FormulaValue digits = number(args, 1, 0);
        if (digits.isError()) {
            return digits;
        }
        double value = n.getNumber();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return FormulaValue.error(CellError.NUM);
        }
        int scale = (int) Math.max(-400, Math.min(400, digits.getNumber()));
        double rounded = BigDecimal.valueOf(value).setScale(scale, mode).doubleValue();
        return FormulaValue.number(rounded + 0.0);
    }

    // The result takes the sign of the divisor.
    private static FormulaValue mod(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue n = number(args, 0, 0);
        if (n.isError()) {
            return n;
        }
        FormulaValue d = number(args, 1, 0);
        if (d.isError()) {
            return d;
        }
        double divisor = d.getNumber();
        if (divisor == 0) {
            return FormulaValue.error(CellError.DIV0);
        }
        double dividend = n.getNumber();
        return finite(dividend - divisor * Math.floor(dividend / divisor) + 0.0);
    }

    /**
     * CEILING.MATH (up) and FLOOR.MATH (down). Significance defaults to 1 and only its
     * magnitude counts; a zero significance gives 0. A non-zero mode flips the direction
     * for negative numbers only: CEILING.MATH(-4.3,1,1) is -5, FLOOR.MATH(-4.7,1,1) is -4.
     */
    private static FormulaValue roundToMultiple(List<FormulaValue> args, boolean ceiling) {
        FormulaValue n = number(args, 0, 0);
        if (n.isError()) {
            return n;
        }
        FormulaValue sig = number(args, 1, 1);
        if (sig.isError()) {
            return sig;
        }
        FormulaValue modeArg = arg(args, 2);
        boolean mode = false;
        if (modeArg != null) {
            if (modeArg.isError()) {
                return modeArg;
            }
            Boolean b = modeArg.isNumber() || modeArg.isBoolean() ? modeArg.asBoolean() : null;
            mode = b != null && b;
        }

        double significance = Math.abs(sig.getNumber());
        if (significance == 0) {
            return FormulaValue.number(0);
        }
        double value = n.getNumber();
        double result;
        if (ceiling) {
            result = value < 0 && mode
                    ? -(Math.ceil(-value / significance) * significance)
                    : Math.ceil(value / significance) * significance;
        } else {
            result = value < 0 && mode
                    ? -(Math.floor(-value / significance) * significance)
                    : Math.floor(value / significance) * significance;
        }
        return FormulaValue.number(result + 0.0);
    }

    // Away from zero to the nearest odd (or even) integer. ODD(0) is 1, EVEN(0) is 0.
    private static FormulaValue roundToParity(double n, boolean odd) {
        if (n == 0) {
            return FormulaValue.number(odd ? 1 : 0);
        }
        double sign = n > 0 ? 1 : -1;
        double ceiling = Math.ceil(Math.abs(n));
        boolean isEven = ceiling % 2 == 0;
        if (odd == isEven) {
            ceiling += 1;
        }
        return FormulaValue.number(sign * ceiling);
    }

    // ------------------------
    // Powers and logarithms
    // ------------------------

    private static FormulaValue power(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue base = number(args, 0, 0);
        if (base.isError()) {
            return base;
        }
        FormulaValue exponent = number(args, 1, 0);
        if (exponent.isError()) {
            return exponent;
        }
        return finite(Math.pow(base.getNumber(), exponent.getNumber()));
    }

    private static FormulaValue log(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue first = args.get(0);
        if (first.isEmpty()) {
            return FormulaValue.error(CellError.NUM);
        }
        FormulaValue n = number(args, 0, 0);
        if (n.isError()) {
            return n;
        }
        FormulaValue base = number(args, 1, 10);
        if (base.isError()) {
            return base;
        }
        double value = n.getNumber();
        double b = base.getNumber();
        if (value <= 0 || b <= 0 || b == 1) {
            return FormulaValue.error(CellError.NUM);
        }
        return FormulaValue.number(Math.log(value) / Math.log(b));
    }

    private static FormulaValue positiveLog(List<FormulaValue> args, DoubleUnaryOperator fn) {
        FormulaValue first = args.get(0);
        if (first.isEmpty()) {
            return FormulaValue.error(CellError.NUM);
        }
        return mapNumber(args, 0, n -> n > 0 ? FormulaValue.number(fn.applyAsDouble(n)) : FormulaValue.error(CellError.NUM));
    }

    private static boolean inUnitInterval(double n) {
        return n >= -1 && n <= 1;
    }

    // ATAN2(x, y) is atan2(y, x) in the usual argument order.
    private static FormulaValue atan2(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue x = number(args, 0, 0);
        if (x.isError()) {
            return x;
        }
        FormulaValue y = number(args, 1, 0);
        if (y.isError()) {
            return y;
        }
        if (x.getNumber() == 0 && y.getNumber() == 0) {
            return FormulaValue.error(CellError.DIV0);
        }
        return FormulaValue.number(Math.atan2(y.getNumber(), x.getNumber()));
    }

    // ------------------------
    // Conditional sums
    // ------------------------

    /**
     * SUMIF(range, criteria, [sum_range]). Positions of range that match are summed from
     * sum_range (or range itself); positions outside sum_range and non-numbers are skipped.
     */
    private static FormulaValue sumIf(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue range = args.get(0);
        if (range.isError()) {
            return range;
        }
        CriteriaMatcher matcher = CriteriaMatcher.of(args.get(1));
        FormulaValue sumArg = arg(args, 2);
        if (sumArg != null && sumArg.isError()) {
            return sumArg;
        }
        List<List<FormulaValue>> cells = CriteriaPairs.grid(range);
        List<List<FormulaValue>> sumCells = sumArg != null && (sumArg.isArray() || !range.isArray())
                ? CriteriaPairs.grid(sumArg)
                : cells;

        double total = 0;
        for (int r = 0; r < cells.size(); r++) {
            List<FormulaValue> row = cells.get(r);
            for (int c = 0; c < row.size(); c++) {
                if (!matcher.matches(row.get(c))) {
                    continue;
                }
                FormulaValue v = ArgumentUtils.element(sumCells, r, c);
                if (v.isError()) {
                    return v;
                }
                if (v.isNumber()) {
                    total += v.getNumber();
                }
            }
        }
        return FormulaValue.number(total);
    }

    /**
     * SUMIFS(sum_range, criteria_range1, criteria1, ...). All criteria ranges must match
     * the size of sum_range, else #VALUE!.
     */
    private static FormulaValue sumIfs(List<FormulaValue> args, EvaluationContext ctx) {
        if (args.size() % 2 != 1) {
            return valueError();
        }
        FormulaValue sumRange = args.get(0);
        if (sumRange.isError()) {
            return sumRange;
        }
        int rows = sumRange.rowCount();
        int cols = sumRange.columnCount();
        if (rows == 0 || cols == 0) {
            return FormulaValue.number(0);
        }
        CriteriaPairs pairs = CriteriaPairs.parse(args, 1, rows, cols);
        if (pairs.getError() != null) {
            return pairs.getError();
        }
        List<List<FormulaValue>> cells = CriteriaPairs.grid(sumRange);
        double total = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (!pairs.matchesAll(r, c)) {
                    continue;
                }
                FormulaValue v = cells.get(r).get(c);
                if (v.isError()) {
                    return v;
                }
                if (v.isNumber()) {
                    total += v.getNumber();
                }
            }
        }
        return FormulaValue.number(total);
    }

    /**
     * SUMPRODUCT: element-wise product of equally sized arrays, summed.
     * Booleans count as 1/0; text, blanks and error elements as 0.
     */
    private static FormulaValue sumProduct(List<FormulaValue> args, EvaluationContext ctx) {
        int rows = -1;
        int cols = -1;
        double[] products = null;
        for (FormulaValue arg : args) {
            if (arg.isError()) {
                return arg;
            }
            if (arg.isString()) {
                return valueError();
            }
            if (products == null) {
                rows = arg.rowCount();
                cols = arg.columnCount();
                if (rows == 0 || cols == 0) {
                    return valueError();
                }
                products = new double[rows * cols];
                Arrays.fill(products, 1.0);
            } else if (arg.rowCount() != rows || arg.columnCount() != cols) {
                return valueError();
            }
            List<FormulaValue> values = ArgumentUtils.flatten(arg);
            for (int i = 0; i < products.length; i++) {
                products[i] *= productFactor(values.get(i));
            }
        }
        double total = 0;
        for (double p : products) {
            total += p;
        }
        return FormulaValue.number(total);
    }

    private static double productFactor(FormulaValue v) {
        if (v.isNumber()) {
            return v.getNumber();
        }
        if (v.isBoolean()) {
            return v.getBoolean() ? 1 : 0;
        }
        return 0;
    }
}
