package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a defined name cannot be resolved to a value.
 */
public class InvalidReferenceException extends FormulaException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
