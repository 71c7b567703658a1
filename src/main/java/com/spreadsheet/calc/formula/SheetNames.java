package com.spreadsheet.calc.formula;

/**
 * Renders sheet qualifiers, quoting names that are not plain identifiers.
 */
final class SheetNames {

    private SheetNames() {
    }

    static String qualify(String sheet) {
        if (sheet == null) {
            return "";
        }
        if (sheet.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            return sheet + "!";
        }
        return "'" + sheet.replace("'", "''") + "'!";
    }
}
