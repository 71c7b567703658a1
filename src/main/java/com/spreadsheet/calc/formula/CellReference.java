package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;

import java.util.Objects;

/**
 * A single-cell reference, optionally qualified with a sheet name (null = current sheet).
 */
public final class CellReference extends FormulaExpr {
    private final String sheet;
    private final CellAddress address;

    public CellReference(String sheet, CellAddress address) {
        this.sheet = sheet;
        this.address = address;
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return Objects.equals(sheet, that.sheet) && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, address);
    }

    @Override
    public String toString() {
        return SheetNames.qualify(sheet) + address.toA1();
    }
}
