package com.spreadsheet.calc.formula;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call such as SUM(A1:A3, 2). The name is stored upper-cased.
 */
public final class FunctionCall extends FormulaExpr {
    private final String name;
    private final List<FormulaExpr> arguments;

    public FunctionCall(String name, List<FormulaExpr> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<FormulaExpr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCall)) {
            return false;
        }
        FunctionCall that = (FunctionCall) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
    }
}
