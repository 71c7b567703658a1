package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidCellAddressException;

import java.util.Objects;

/**
 * A 0-based (row, col) position inside a worksheet.
 * "A1" is (0, 0), "$B$2" is (1, 1).
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private final int row;
    private final int col;

    public CellAddress(int row, int col) {
        if (row < 0 || row >= MAX_ROWS) {
            throw new InvalidCellAddressException("Row out of range: " + row);
        }
        if (col < 0 || col >= MAX_COLUMNS) {
            throw new InvalidCellAddressException("Column out of range: " + col);
        }
        this.row = row;
        this.col = col;
    }

    /**
     * Parses an A1-style address. '$' markers are accepted and ignored,
     * column letters are case-insensitive.
     */
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new InvalidCellAddressException("Cell address is null");
        }
        String clean = text.trim().replace("$", "");
        int i = 0;
        while (i < clean.length() && isAsciiLetter(clean.charAt(i))) {
            i++;
        }
        if (i == 0 || i == clean.length()) {
            throw new InvalidCellAddressException("Invalid cell address: " + text);
        }
        String letters = clean.substring(0, i);
        String digits = clean.substring(i);
        for (int k = 0; k < digits.length(); k++) {
            char c = digits.charAt(k);
            if (c < '0' || c > '9') {
                throw new InvalidCellAddressException("Invalid cell address: " + text);
            }
        }
        if (digits.length() > 7) {
            throw new InvalidCellAddressException("Row out of range in address: " + text);
        }
        int rowNumber = Integer.parseInt(digits);
        if (rowNumber < 1) {
            throw new InvalidCellAddressException("Row number must be >= 1: " + text);
        }
        return new CellAddress(rowNumber - 1, columnIndex(letters));
    }

    /**
     * Converts column letters to a 0-based index: A -> 0, Z -> 25, AA -> 26.
     */
    public static int columnIndex(String letters) {
        if (letters.isEmpty() || letters.length() > 3) {
            throw new InvalidCellAddressException("Invalid column: " + letters);
        }
        int col = 0;
        for (char c : letters.toUpperCase().toCharArray()) {
            if (c < 'A' || c > 'Z') {
                throw new InvalidCellAddressException("Invalid column letter: " + c);
            }
            col = col * 26 + (c - 'A' + 1);
        }
        if (col > MAX_COLUMNS) {
            throw new InvalidCellAddressException("Column too large: " + letters);
        }
        return col - 1;
    }

    /**
     * Converts a 0-based column index to letters: 0 -> A, 26 -> AA.
     */
    public static String columnLetters(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public CellAddress offset(int rows, int cols) {
        return new CellAddress(row + rows, col + cols);
    }

    public String toA1() {
        return columnLetters(col) + (row + 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
