package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a formula calls a function the registry does not know.
 */
public class UnknownFunctionException extends FormulaException {
    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
