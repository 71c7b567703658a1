package com.spreadsheet.calc.functions;

import java.util.Objects;

/**
 * Registry entry: name, arity and volatility of a built-in function plus its implementation.
 */
public final class FunctionDefinition {

    private final String name;
    private final int minArgs;
    private final Integer maxArgs;
    private final boolean volatileFunction;
    private final FormulaFunction implementation;

    /**
     * @param maxArgs upper bound on the argument count, or null for no bound
     */
    public FunctionDefinition(String name, int minArgs, Integer maxArgs, boolean volatileFunction,
                              FormulaFunction implementation) {
        this.name = Objects.requireNonNull(name, "name");
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.volatileFunction = volatileFunction;
        this.implementation = Objects.requireNonNull(implementation, "implementation");
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public Integer getMaxArgs() {
        return maxArgs;
    }

    /**
     * Volatile functions (RAND, NOW, ...) are recomputed on every calculation pass.
     */
    public boolean isVolatile() {
        return volatileFunction;
    }

    public FormulaFunction getImplementation() {
        return implementation;
    }

    @Override
    public String toString() {
        return name + "(" + minArgs + ".." + (maxArgs == null ? "*" : maxArgs) + ")";
    }
}
