package com.spreadsheet.calc.formula;

import java.util.Objects;

public final class BinaryExpr extends FormulaExpr {
    private final BinaryOperator operator;
    private final FormulaExpr left;
    private final FormulaExpr right;

    public BinaryExpr(BinaryOperator operator, FormulaExpr left, FormulaExpr right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FormulaExpr getLeft() {
        return left;
    }

    public FormulaExpr getRight() {
        return right;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryExpr)) {
            return false;
        }
        BinaryExpr that = (BinaryExpr) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + operator.getSymbol() + right + ")";
    }
}
