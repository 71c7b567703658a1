package com.spreadsheet.calc.exceptions;

/**
 * Thrown when resolving a defined name leads back to the same name
 * (e.g. Rate refers to "=Rate*2").
 * Cell-level cycles are not failures: the calculation pass resolves them.
 */
public class CircularReferenceException extends FormulaException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
