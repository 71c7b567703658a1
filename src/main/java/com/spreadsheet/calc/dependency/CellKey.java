package com.spreadsheet.calc.dependency;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.Worksheet;

/**
 * Identity of one cell in a workbook: (sheet index, row, col), all 0-based.
 */
public final class CellKey implements Comparable<CellKey> {

    private final int sheet;
    private final int row;
    private final int col;

    public CellKey(int sheet, int row, int col) {
        this.sheet = sheet;
        this.row = row;
        this.col = col;
    }

    public int getSheet() {
        return sheet;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * "Sheet1!B2" using the workbook's sheet names, or "#3!B2" when the index is unknown.
     */
    public String label(Workbook workbook) {
        Worksheet ws = workbook == null ? null : workbook.getWorksheet(sheet);
        String prefix = ws == null ? "#" + sheet : ws.getName();
        return prefix + "!" + new CellAddress(row, col).toA1();
    }

    @Override
    public int compareTo(CellKey other) {
        if (sheet != other.sheet) {
            return Integer.compare(sheet, other.sheet);
        }
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
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey that = (CellKey) o;
        return sheet == that.sheet && row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return (sheet * 31 + row) * 31 + col;
    }

    @Override
    public String toString() {
        return "#" + sheet + "!" + new CellAddress(row, col).toA1();
    }
}
