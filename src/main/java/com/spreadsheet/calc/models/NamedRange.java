package com.spreadsheet.calc.models;

/**
 * A defined name. refersTo is one of:
 * - a formula ("=SUM(Sheet1!A1:A3)")
 * - a constant ("0.0725", "TRUE")
 * - a cell or range reference ("Sheet1!$B$1", "'My Sheet'!A1:C3")
 * A null sheetIndex means the name is visible from every sheet.
 */
public class NamedRange {
    private final String name;
    private final String refersTo;
    private final Integer sheetIndex;

    public NamedRange(String name, String refersTo, Integer sheetIndex) {
        this.name = name;
        this.refersTo = refersTo;
        this.sheetIndex = sheetIndex;
    }

    public String getName() {
        return name;
    }

    public String getRefersTo() {
        return refersTo;
    }

    public Integer getSheetIndex() {
        return sheetIndex;
    }

    public boolean isWorkbookScoped() {
        return sheetIndex == null;
    }

    public boolean isFormula() {
        return refersTo.startsWith("=");
    }
}
