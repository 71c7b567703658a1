package com.spreadsheet.calc.exceptions;

/**
 * Thrown when evaluation cannot continue, e.g. arithmetic on text
 * that is not a number, or a range operator outside a reference.
 */
public class FormulaEvaluationException extends FormulaException {
    public FormulaEvaluationException(String message) {
        super(message);
    }
}
