package com.spreadsheet.calc.models;

/**
 * Footprint of an active spill: the array size written from its source cell.
 */
public class SpillInfo {
    private final int rows;
    private final int cols;

    public SpillInfo(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
