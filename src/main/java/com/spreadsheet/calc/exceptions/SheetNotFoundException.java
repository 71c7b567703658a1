package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a request names a worksheet the workbook doesn't have.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
