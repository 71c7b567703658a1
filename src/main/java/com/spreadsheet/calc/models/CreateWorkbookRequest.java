package com.spreadsheet.calc.models;

import java.util.List;

/**
 * Body of POST /workbook: {"sheets": ["Data", "Summary"], "date1904": false}.
 * Both fields are optional.
 */
public class CreateWorkbookRequest {
    private List<String> sheets;
    private boolean date1904;

    public CreateWorkbookRequest() {
    }

    public CreateWorkbookRequest(List<String> sheets, boolean date1904) {
        this.sheets = sheets;
        this.date1904 = date1904;
    }

    public List<String> getSheets() {
        return sheets;
    }

    public void setSheets(List<String> sheets) {
        this.sheets = sheets;
    }

    public boolean isDate1904() {
        return date1904;
    }

    public void setDate1904(boolean date1904) {
        this.date1904 = date1904;
    }
}
