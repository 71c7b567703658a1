package com.spreadsheet.calc.exceptions;

/**
 * Base class of engine-internal failures: the formula currently being
 * parsed or evaluated cannot produce a value at all.
 * Distinct from spreadsheet error values (#DIV/0!, #N/A, ...) which are
 * ordinary results.
 */
public class FormulaException extends RuntimeException {
    public FormulaException(String message) {
        super(message);
    }
}
