package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.FormulaEvaluationException;
import com.spreadsheet.calc.formula.NumberText;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An in-flight evaluation result: a number, string, boolean, error value,
 * a rectangular 2-D array, or empty.
 */
public final class FormulaValue {

    public enum Type {
        NUMBER,
        STRING,
        BOOLEAN,
        ERROR,
        ARRAY,
        EMPTY
    }

    public static final FormulaValue EMPTY = new FormulaValue(Type.EMPTY, null);
    public static final FormulaValue TRUE = new FormulaValue(Type.BOOLEAN, Boolean.TRUE);
    public static final FormulaValue FALSE = new FormulaValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;
    private final Object value;

    private FormulaValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static FormulaValue number(double n) {
        return new FormulaValue(Type.NUMBER, n);
    }

    public static FormulaValue string(String s) {
        return new FormulaValue(Type.STRING, Objects.requireNonNull(s, "s"));
    }

    public static FormulaValue bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static FormulaValue error(CellError e) {
        return new FormulaValue(Type.ERROR, Objects.requireNonNull(e, "e"));
    }

    /**
     * Wraps rows of values. Rows are copied; callers must pass a rectangular grid.
     */
    public static FormulaValue array(List<List<FormulaValue>> rows) {
        List<List<FormulaValue>> copy = new ArrayList<>(rows.size());
        for (List<FormulaValue> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new FormulaValue(Type.ARRAY, Collections.unmodifiableList(copy));
    }

    public static FormulaValue empty() {
        return EMPTY;
    }

    // ------------------------
    // Type checks and raw access
    // ------------------------

    public Type getType() {
        return type;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isArray() {
        return type == Type.ARRAY;
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }

    public double getNumber() {
        requireType(Type.NUMBER);
        return (Double) value;
    }

    public String getString() {
        requireType(Type.STRING);
        return (String) value;
    }

    public boolean getBoolean() {
        requireType(Type.BOOLEAN);
        return (Boolean) value;
    }

    /**
     * The error carried by this value, or null if it is not an error.
     */
    public CellError getError() {
        return type == Type.ERROR ? (CellError) value : null;
    }

    @SuppressWarnings("unchecked")
    public List<List<FormulaValue>> getArray() {
        requireType(Type.ARRAY);
        return (List<List<FormulaValue>>) value;
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " but value is " + type);
        }
    }

    public int rowCount() {
        return type == Type.ARRAY ? getArray().size() : 1;
    }

    public int columnCount() {
        if (type != Type.ARRAY) {
            return 1;
        }
        List<List<FormulaValue>> rows = getArray();
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    // ------------------------
    // Coercions
    // ------------------------

    /**
     * Numeric view: numbers as-is, TRUE/FALSE as 1/0, numeric text parsed,
     * empty as 0. Returns null for anything else.
     */
    public Double asNumber() {
        switch (type) {
            case NUMBER:
                return (Double) value;
            case BOOLEAN:
                return ((Boolean) value) ? 1.0 : 0.0;
            case STRING:
                return NumberText.parse((String) value);
            case EMPTY:
                return 0.0;
            default:
                return null;
        }
    }

    /**
     * Like {@link #asNumber()} but fails the evaluation when there is no numeric view.
     */
    public double toNumber() {
        Double n = asNumber();
        if (n == null) {
            throw new FormulaEvaluationException("Cannot convert " + this + " to a number");
        }
        return n;
    }

    /**
     * Boolean view: booleans as-is, numbers as non-zero, "TRUE"/"FALSE" text.
     * Returns null for anything else.
     */
    public Boolean asBoolean() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value;
            case NUMBER:
                return (Double) value != 0.0;
            case STRING: {
                String upper = ((String) value).toUpperCase(Locale.ROOT);
                if (upper.equals("TRUE")) {
                    return true;
                }
                if (upper.equals("FALSE")) {
                    return false;
                }
                return null;
            }
            default:
                return null;
        }
    }

    /**
     * Text view used by concatenation and the text functions.
     * Integral numbers below 1e15 print without a decimal point,
     * an array prints as #VALUE!.
     */
    public String asString() {
        switch (type) {
            case NUMBER:
                return NumberText.format((Double) value);
            case STRING:
                return (String) value;
            case BOOLEAN:
                return ((Boolean) value) ? "TRUE" : "FALSE";
            case ERROR:
                return ((CellError) value).getText();
            case ARRAY:
                return CellError.VALUE.getText();
            default:
                return "";
        }
    }

    // ------------------------
    // Conversion to and from persisted cell values
    // ------------------------

    /**
     * Converts a result for storage. Arrays cannot be stored in one cell and become #VALUE!.
     */
    public CellValue toCellValue() {
        switch (type) {
            case NUMBER:
                return CellValue.of((Double) value);
            case STRING:
                return CellValue.of((String) value);
            case BOOLEAN:
                return CellValue.of((Boolean) value);
            case ERROR:
                return CellValue.error((CellError) value);
            case ARRAY:
                return CellValue.error(CellError.VALUE);
            default:
                return CellValue.empty();
        }
    }

    /**
     * Converts stored content for evaluation. A formula yields its cached value.
     * A spill target carries no value of its own and yields EMPTY; callers that
     * need the spilled value read through Worksheet.getResolvedValueAt.
     */
    public static FormulaValue fromCellValue(CellValue cell) {
        if (cell == null) {
            return EMPTY;
        }
        switch (cell.getType()) {
            case NUMBER:
                return number(cell.getNumber());
            case STRING:
                return string(cell.getString());
            case BOOLEAN:
                return bool(cell.getBoolean());
            case ERROR:
                return error(cell.getError());
            case FORMULA:
                return fromCellValue(cell.getCachedValue());
            default:
                return EMPTY;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaValue)) {
            return false;
        }
        FormulaValue that = (FormulaValue) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return "\"" + value + "\"";
            case ARRAY:
                return "Array" + value;
            case EMPTY:
                return "Empty";
            default:
                return asString();
        }
    }
}
