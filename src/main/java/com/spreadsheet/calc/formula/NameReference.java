package com.spreadsheet.calc.formula;

/**
 * A reference to a defined name, resolved at evaluation time.
 */
public final class NameReference extends FormulaExpr {
    private final String name;

    public NameReference(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNameReference(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NameReference && ((NameReference) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
