package com.spreadsheet.calc.exceptions;

/**
 * Thrown when an A1-style address or range is malformed
 * or lies outside the sheet bounds, e.g. "A0" or "1A".
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
