package com.spreadsheet.calc.exceptions;

/**
 * Thrown when formula text cannot be parsed,
 * e.g. a missing leading '=', an unbalanced parenthesis or trailing input.
 */
public class FormulaParseException extends FormulaException {
    public FormulaParseException(String message) {
        super(message);
    }
}
