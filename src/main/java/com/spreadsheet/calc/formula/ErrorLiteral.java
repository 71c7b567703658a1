package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellError;

public final class ErrorLiteral extends FormulaExpr {
    private final CellError error;

    public ErrorLiteral(CellError error) {
        this.error = error;
    }

    public CellError getError() {
        return error;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorLiteral && ((ErrorLiteral) o).error == error;
    }

    @Override
    public int hashCode() {
        return error.hashCode();
    }

    @Override
    public String toString() {
        return error.getText();
    }
}
