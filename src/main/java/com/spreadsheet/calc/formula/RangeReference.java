package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellRange;

import java.util.Objects;

/**
 * A rectangular range reference such as A1:B3 or Sheet2!C1:C10.
 */
public final class RangeReference extends FormulaExpr {
    private final String sheet;
    private final CellRange range;

    public RangeReference(String sheet, CellRange range) {
        this.sheet = sheet;
        this.range = range;
    }

    public String getSheet() {
        return sheet;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitRangeReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeReference)) {
            return false;
        }
        RangeReference that = (RangeReference) o;
        return Objects.equals(sheet, that.sheet) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, range);
    }

    @Override
    public String toString() {
        return SheetNames.qualify(sheet) + range;
    }
}
