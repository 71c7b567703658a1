package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidCellAddressException;

import java.util.Objects;

/**
 * A rectangular block of cells. The start is always the top-left corner
 * and the end the bottom-right one, whatever order the corners were given in.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress a, CellAddress b) {
        this.start = new CellAddress(Math.min(a.getRow(), b.getRow()), Math.min(a.getCol(), b.getCol()));
        this.end = new CellAddress(Math.max(a.getRow(), b.getRow()), Math.max(a.getCol(), b.getCol()));
    }

    /**
     * Parses "A1:B3". A single address yields a one-cell range.
     */
    public static CellRange parse(String text) {
        if (text == null) {
            throw new InvalidCellAddressException("Range is null");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            CellAddress single = CellAddress.parse(text);
            return new CellRange(single, single);
        }
        return new CellRange(
                CellAddress.parse(text.substring(0, colon)),
                CellAddress.parse(text.substring(colon + 1)));
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public int rowCount() {
        return end.getRow() - start.getRow() + 1;
    }

    public int columnCount() {
        return end.getCol() - start.getCol() + 1;
    }

    public boolean contains(int row, int col) {
        return row >= start.getRow() && row <= end.getRow()
                && col >= start.getCol() && col <= end.getCol();
    }

    public boolean intersects(CellRange other) {
        return start.getRow() <= other.end.getRow() && other.start.getRow() <= end.getRow()
                && start.getCol() <= other.end.getCol() && other.start.getCol() <= end.getCol();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start.toA1() + ":" + end.toA1();
    }
}
