package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.ArgumentCountException;
import com.spreadsheet.calc.exceptions.FormulaEvaluationException;
import com.spreadsheet.calc.exceptions.UnknownFunctionException;
import com.spreadsheet.calc.formula.ArrayLiteral;
import com.spreadsheet.calc.formula.BinaryExpr;
import com.spreadsheet.calc.formula.BooleanLiteral;
import com.spreadsheet.calc.formula.CellReference;
import com.spreadsheet.calc.formula.ErrorLiteral;
import com.spreadsheet.calc.formula.FormulaExpr;
import com.spreadsheet.calc.formula.FormulaParser;
import com.spreadsheet.calc.formula.FormulaVisitor;
import com.spreadsheet.calc.formula.FunctionCall;
import com.spreadsheet.calc.formula.NameReference;
import com.spreadsheet.calc.formula.NumberLiteral;
import com.spreadsheet.calc.formula.RangeReference;
import com.spreadsheet.calc.formula.StringLiteral;
import com.spreadsheet.calc.formula.UnaryExpr;
import com.spreadsheet.calc.functions.FunctionDefinition;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.CellError;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tree-walking interpreter for parsed formulas.
 * Spreadsheet errors (#DIV/0!, #N/A, ...) are returned as values;
 * failures that leave no value to return (unknown function, wrong argument
 * count, arithmetic on non-numeric text) are thrown as FormulaException subclasses.
 */
public final class Evaluator {

    private Evaluator() {
    }

    /**
     * Parses and evaluates formula text ("=1+2"). Parse and evaluation failures propagate.
     */
    public static FormulaValue evaluate(String formula, EvaluationContext ctx) {
        return evaluate(FormulaParser.parse(formula), ctx);
    }

    public static FormulaValue evaluate(FormulaExpr expr, EvaluationContext ctx) {
        ctx.enter();
        try {
            return expr.accept(new EvaluatingVisitor(ctx));
        } finally {
            ctx.exit();
        }
    }

    /**
     * Three-way comparison behind every comparison operator:
     * - empty compares as the number 0
     * - numbers numerically, text case-insensitively, FALSE before TRUE
     * - across types: number < text < boolean
     * - errors by error code
     */
    public static int compare(FormulaValue left, FormulaValue right) {
        FormulaValue l = left.isEmpty() ? FormulaValue.number(0) : left;
        FormulaValue r = right.isEmpty() ? FormulaValue.number(0) : right;

        if (l.getType() == r.getType()) {
            switch (l.getType()) {
                case NUMBER: {
                    double a = l.getNumber();
                    double b = r.getNumber();
                    return a < b ? -1 : (a > b ? 1 : 0);
                }
                case STRING:
                    return Integer.signum(l.getString().toLowerCase(Locale.ROOT)
                            .compareTo(r.getString().toLowerCase(Locale.ROOT)));
                case BOOLEAN:
                    return Boolean.compare(l.getBoolean(), r.getBoolean());
                case ERROR:
                    return Integer.signum(l.getError().getCode() - r.getError().getCode());
                default:
                    return 0;
            }
        }
        int lr = typeRank(l);
        int rr = typeRank(r);
        if (lr < 0 || rr < 0) {
            return 0;
        }
        return Integer.compare(lr, rr);
    }

    private static int typeRank(FormulaValue v) {
        switch (v.getType()) {
            case NUMBER:
                return 0;
            case STRING:
                return 1;
            case BOOLEAN:
                return 2;
            default:
                return -1;
        }
    }

    private static final class EvaluatingVisitor implements FormulaVisitor<FormulaValue> {

        private final EvaluationContext ctx;

        EvaluatingVisitor(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public FormulaValue visitNumber(NumberLiteral expr) {
            return FormulaValue.number(expr.getValue());
        }

        @Override
        public FormulaValue visitString(StringLiteral expr) {
            return FormulaValue.string(expr.getValue());
        }

        @Override
        public FormulaValue visitBoolean(BooleanLiteral expr) {
            return FormulaValue.bool(expr.getValue());
        }

        @Override
        public FormulaValue visitError(ErrorLiteral expr) {
            return FormulaValue.error(expr.getError());
        }

        @Override
        public FormulaValue visitCellReference(CellReference expr) {
            return ctx.getCellValue(expr.getSheet(), expr.getAddress().getRow(), expr.getAddress().getCol());
        }

        @Override
        public FormulaValue visitRangeReference(RangeReference expr) {
            return ctx.getRangeValues(expr.getSheet(), expr.getRange());
        }

        @Override
        public FormulaValue visitNameReference(NameReference expr) {
            return ctx.resolveNamedRange(expr.getName());
        }

        @Override
        public FormulaValue visitBinary(BinaryExpr expr) {
            FormulaValue left = evaluate(expr.getLeft(), ctx);
            FormulaValue right = evaluate(expr.getRight(), ctx);

            // Left error wins over right error
            if (left.isError()) {
                return left;
            }
            if (right.isError()) {
                return right;
            }

            switch (expr.getOperator()) {
                case ADD:
                    return FormulaValue.number(left.toNumber() + right.toNumber());
                case SUBTRACT:
                    return FormulaValue.number(left.toNumber() - right.toNumber());
                case MULTIPLY:
                    return FormulaValue.number(left.toNumber() * right.toNumber());
                case DIVIDE: {
                    double l = left.toNumber();
                    double r = right.toNumber();
                    if (r == 0.0) {
                        return FormulaValue.error(CellError.DIV0);
                    }
                    return FormulaValue.number(l / r);
                }
                case POWER: {
                    double result = Math.pow(left.toNumber(), right.toNumber());
                    if (Double.isNaN(result) || Double.isInfinite(result)) {
                        return FormulaValue.error(CellError.NUM);
                    }
                    return FormulaValue.number(result);
                }
                case EQUAL:
                    return FormulaValue.bool(compare(left, right) == 0);
                case NOT_EQUAL:
                    return FormulaValue.bool(compare(left, right) != 0);
                case LESS_THAN:
                    return FormulaValue.bool(compare(left, right) < 0);
                case LESS_EQUAL:
                    return FormulaValue.bool(compare(left, right) <= 0);
                case GREATER_THAN:
                    return FormulaValue.bool(compare(left, right) > 0);
                case GREATER_EQUAL:
                    return FormulaValue.bool(compare(left, right) >= 0);
                case CONCAT:
                    return FormulaValue.string(left.asString() + right.asString());
                default:
                    throw new FormulaEvaluationException(
                            "Operator '" + expr.getOperator().getSymbol() + "' is not supported in this context");
            }
        }

        @Override
        public FormulaValue visitUnary(UnaryExpr expr) {
            FormulaValue operand = evaluate(expr.getOperand(), ctx);
            if (operand.isError()) {
                return operand;
            }
            double n = operand.toNumber();
            switch (expr.getOperator()) {
                case NEGATE:
                    return FormulaValue.number(-n);
                case PERCENT:
                    return FormulaValue.number(n / 100.0);
                default:
                    throw new FormulaEvaluationException("Unsupported unary operator " + expr.getOperator());
            }
        }

        /**
         * 1) Look the name up in the registry.
         * 2) Check the argument count against the declared arity.
         * 3) Evaluate every argument, left to right, before the call,
         *    including branches IF-like functions will not use.
         * 4) Invoke the implementation.
         */
        @Override
        public FormulaValue visitFunctionCall(FunctionCall expr) {
            String name = expr.getName();
            FunctionDefinition function = FunctionRegistry.getInstance().get(name);
            if (function == null) {
                throw new UnknownFunctionException(name);
            }

            int count = expr.getArguments().size();
            if (count < function.getMinArgs()) {
                throw new ArgumentCountException(name, "at least " + function.getMinArgs(), count);
            }
            if (function.getMaxArgs() != null && count > function.getMaxArgs()) {
                throw new ArgumentCountException(name, "at most " + function.getMaxArgs(), count);
            }

            List<FormulaValue> args = new ArrayList<>(count);
            for (FormulaExpr arg : expr.getArguments()) {
                args.add(evaluate(arg, ctx));
            }
            return function.getImplementation().apply(args, ctx);
        }

        @Override
        public FormulaValue visitArray(ArrayLiteral expr) {
            List<List<FormulaValue>> rows = new ArrayList<>();
            for (List<FormulaExpr> row : expr.getRows()) {
                List<FormulaValue> values = new ArrayList<>(row.size());
                for (FormulaExpr item : row) {
                    values.add(evaluate(item, ctx));
                }
                rows.add(values);
            }
            return FormulaValue.array(rows);
        }
    }
}
