package com.spreadsheet.calc.models;

/**
 * Workbook-wide settings consulted during calculation.
 */
public class WorkbookSettings {
    // false = 1900 date system, true = 1904 date system
    private boolean date1904;

    public boolean isDate1904() {
        return date1904;
    }

    public void setDate1904(boolean date1904) {
        this.date1904 = date1904;
    }
}
