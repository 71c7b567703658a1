package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a function is called with too few or too many arguments.
 * For example: "SUM expects at least 1 argument(s), got 0".
 */
public class ArgumentCountException extends FormulaException {
    private final String function;
    private final String expected;
    private final int actual;

    public ArgumentCountException(String function, String expected, int actual) {
        super(function + " expects " + expected + " argument(s), got " + actual);
        this.function = function;
        this.expected = expected;
        this.actual = actual;
    }

    public String getFunction() {
        return function;
    }

    public String getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
