package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Persisted content of a single cell.
 * Represents one of:
 * - EMPTY, BOOLEAN, NUMBER, STRING, ERROR literals
 * - FORMULA: the formula text ("=A1+1"), plus the last calculated value and,
 *   for a spilled dynamic array, the full array result
 * - SPILL_TARGET: a marker written into a cell covered by another cell's spill,
 *   pointing back at the source and the offset inside the array
 * Instances are immutable; formula results are written by replacing the value.
 */
public final class CellValue {

    public enum Type {
        EMPTY,
        BOOLEAN,
        NUMBER,
        STRING,
        ERROR,
        FORMULA,
        SPILL_TARGET
    }

    private static final CellValue EMPTY = new CellValue(Type.EMPTY, null, null, null, null, 0, 0, 0, 0);

    private final Type type;
    // Boolean, Double, String or CellError depending on type
    private final Object scalar;
    private final String formulaText;
    private final CellValue cachedValue;
    private final List<List<CellValue>> arrayResult;
    private final int sourceRow;
    private final int sourceCol;
    private final int offsetRow;
    private final int offsetCol;

    private CellValue(Type type, Object scalar, String formulaText, CellValue cachedValue,
                      List<List<CellValue>> arrayResult,
                      int sourceRow, int sourceCol, int offsetRow, int offsetCol) {
        this.type = type;
        this.scalar = scalar;
        this.formulaText = formulaText;
        this.cachedValue = cachedValue;
        this.arrayResult = arrayResult;
        this.sourceRow = sourceRow;
        this.sourceCol = sourceCol;
        this.offsetRow = offsetRow;
        this.offsetCol = offsetCol;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue of(boolean value) {
        return new CellValue(Type.BOOLEAN, value, null, null, null, 0, 0, 0, 0);
    }

    public static CellValue of(double value) {
        return new CellValue(Type.NUMBER, value, null, null, null, 0, 0, 0, 0);
    }

    public static CellValue of(String value) {
        Objects.requireNonNull(value, "value");
        return new CellValue(Type.STRING, value, null, null, null, 0, 0, 0, 0);
    }

    public static CellValue error(CellError error) {
        Objects.requireNonNull(error, "error");
        return new CellValue(Type.ERROR, error, null, null, null, 0, 0, 0, 0);
    }

    /**
     * A formula cell with no calculated value yet. A missing leading '=' is added.
     */
    public static CellValue formula(String text) {
        Objects.requireNonNull(text, "text");
        String normalized = text.startsWith("=") ? text : "=" + text;
        return new CellValue(Type.FORMULA, null, normalized, null, null, 0, 0, 0, 0);
    }

    public static CellValue spillTarget(int sourceRow, int sourceCol, int offsetRow, int offsetCol) {
        return new CellValue(Type.SPILL_TARGET, null, null, null, null, sourceRow, sourceCol, offsetRow, offsetCol);
    }

    /**
     * Same formula, new calculated scalar. Any retained array result is dropped.
     */
    public CellValue withCachedValue(CellValue value) {
        requireFormula();
        return new CellValue(Type.FORMULA, null, formulaText, value, null, 0, 0, 0, 0);
    }

    /**
     * Same formula, new spilled array result. The cached value is the top-left element.
     */
    public CellValue withArrayResult(List<List<CellValue>> array) {
        requireFormula();
        List<List<CellValue>> copy = new ArrayList<>();
        for (List<CellValue> row : array) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        CellValue topLeft = copy.get(0).get(0);
        return new CellValue(Type.FORMULA, null, formulaText, topLeft,
                Collections.unmodifiableList(copy), 0, 0, 0, 0);
    }

    private void requireFormula() {
        if (type != Type.FORMULA) {
            throw new IllegalStateException("Not a formula cell: " + this);
        }
    }

    public Type getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }

    public boolean isFormula() {
        return type == Type.FORMULA;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isSpillTarget() {
        return type == Type.SPILL_TARGET;
    }

    public Double getNumber() {
        return type == Type.NUMBER ? (Double) scalar : null;
    }

    public Boolean getBoolean() {
        return type == Type.BOOLEAN ? (Boolean) scalar : null;
    }

    public String getString() {
        return type == Type.STRING ? (String) scalar : null;
    }

    public CellError getError() {
        return type == Type.ERROR ? (CellError) scalar : null;
    }

    public String getFormulaText() {
        return formulaText;
    }

    /**
     * Last calculated value of a formula cell, or null if it was never calculated.
     */
    public CellValue getCachedValue() {
        return cachedValue;
    }

    public List<List<CellValue>> getArrayResult() {
        return arrayResult;
    }

    public int getSourceRow() {
        return sourceRow;
    }

    public int getSourceCol() {
        return sourceCol;
    }

    public int getOffsetRow() {
        return offsetRow;
    }

    public int getOffsetCol() {
        return offsetCol;
    }

    /**
     * Value as seen by readers that do not resolve spills:
     * a formula yields its cached value (EMPTY if never calculated),
     * anything else yields itself.
     */
    public CellValue effectiveValue() {
        if (type == Type.FORMULA) {
            return cachedValue == null ? EMPTY : cachedValue;
        }
        return this;
    }

    /**
     * Plain Java value for JSON output: Double, Boolean, String, the error text,
     * or null for an empty cell.
     */
    public Object toPlainValue() {
        switch (type) {
            case NUMBER:
            case BOOLEAN:
            case STRING:
                return scalar;
            case ERROR:
                return ((CellError) scalar).getText();
            case FORMULA:
                return effectiveValue().toPlainValue();
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return type == that.type
                && sourceRow == that.sourceRow
                && sourceCol == that.sourceCol
                && offsetRow == that.offsetRow
                && offsetCol == that.offsetCol
                && Objects.equals(scalar, that.scalar)
                && Objects.equals(formulaText, that.formulaText)
                && Objects.equals(cachedValue, that.cachedValue)
                && Objects.equals(arrayResult, that.arrayResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, scalar, formulaText, cachedValue, sourceRow, sourceCol, offsetRow, offsetCol);
    }

    @Override
    public String toString() {
        switch (type) {
            case EMPTY:
                return "";
            case BOOLEAN:
                return ((Boolean) scalar) ? "TRUE" : "FALSE";
            case FORMULA:
                return formulaText;
            case SPILL_TARGET:
                return "";
            default:
                return String.valueOf(scalar);
        }
    }
}
