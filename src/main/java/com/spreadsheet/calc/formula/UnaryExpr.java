package com.spreadsheet.calc.formula;

import java.util.Objects;

public final class UnaryExpr extends FormulaExpr {
    private final UnaryOperator operator;
    private final FormulaExpr operand;

    public UnaryExpr(UnaryOperator operator, FormulaExpr operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public FormulaExpr getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryExpr)) {
            return false;
        }
        UnaryExpr that = (UnaryExpr) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator == UnaryOperator.NEGATE ? "-" + operand : operand + "%";
    }
}
