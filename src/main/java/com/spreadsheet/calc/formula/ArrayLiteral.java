package com.spreadsheet.calc.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An inline array such as {1,2;3,4}: ',' separates columns, ';' separates rows.
 */
public final class ArrayLiteral extends FormulaExpr {
    private final List<List<FormulaExpr>> rows;

    public ArrayLiteral(List<List<FormulaExpr>> rows) {
        List<List<FormulaExpr>> copy = new ArrayList<>();
        for (List<FormulaExpr> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<List<FormulaExpr>> getRows() {
        return rows;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayLiteral && ((ArrayLiteral) o).rows.equals(rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return rows.stream()
                .map(row -> row.stream().map(String::valueOf).collect(Collectors.joining(",")))
                .collect(Collectors.joining(";", "{", "}"));
    }
}
