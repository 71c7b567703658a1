package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaEvaluationException;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.formula.CellReference;
import com.spreadsheet.calc.formula.FormulaExpr;
import com.spreadsheet.calc.formula.FormulaParser;
import com.spreadsheet.calc.formula.NumberText;
import com.spreadsheet.calc.formula.RangeReference;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.NamedRange;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.Worksheet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Where a formula is being evaluated: an optional read-only workbook, the
 * current sheet index and the current 0-based row/col (used by ROW() and
 * COLUMN() without arguments).
 * A context without a workbook ("simple" mode) reads every cell as empty,
 * which is enough for standalone function evaluation.
 * A context also tracks evaluation depth and the defined names being
 * resolved, so it belongs to a single evaluation at a time.
 */
public class EvaluationContext {

    static final int MAX_DEPTH = 1000;

    private final Workbook workbook;
    private final int currentSheet;
    private final int currentRow;
    private final int currentCol;

    private int depth;
    private final Set<String> namesInProgress = new HashSet<>();

    public EvaluationContext(Workbook workbook, int currentSheet, int currentRow, int currentCol) {
        this.workbook = workbook;
        this.currentSheet = currentSheet;
        this.currentRow = currentRow;
        this.currentCol = currentCol;
    }

    /**
     * No workbook, positioned at A1 of sheet 0.
     */
    public static EvaluationContext simple() {
        return new EvaluationContext(null, 0, 0, 0);
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public int getCurrentSheet() {
        return currentSheet;
    }

    public int getCurrentRow() {
        return currentRow;
    }

    public int getCurrentCol() {
        return currentCol;
    }

    public boolean isDate1904() {
        return workbook != null && workbook.getSettings().isDate1904();
    }

    // ------------------------
    // Depth guard
    // ------------------------

    void enter() {
        if (++depth > MAX_DEPTH) {
            throw new FormulaEvaluationException("Formula evaluation nested deeper than " + MAX_DEPTH + " levels");
        }
    }

    void exit() {
        depth--;
    }

    // ------------------------
    // Cell access
    // ------------------------

    /**
     * Value of one cell. An unknown sheet yields #REF!.
     */
    public FormulaValue getCellValue(String sheet, int row, int col) {
        if (workbook == null) {
            return FormulaValue.EMPTY;
        }
        Worksheet worksheet = resolveSheet(sheet);
        if (worksheet == null) {
            return FormulaValue.error(CellError.REF);
        }
        return FormulaValue.fromCellValue(worksheet.getResolvedValueAt(row, col));
    }

    /**
     * Values of a rectangular range as an array. Without a workbook the array is empty.
     */
    public FormulaValue getRangeValues(String sheet, CellRange range) {
        if (workbook == null) {
            return FormulaValue.array(new ArrayList<>());
        }
        Worksheet worksheet = resolveSheet(sheet);
        if (worksheet == null) {
            return FormulaValue.error(CellError.REF);
        }
        List<List<FormulaValue>> rows = new ArrayList<>();
        for (int r = range.getStart().getRow(); r <= range.getEnd().getRow(); r++) {
            List<FormulaValue> cols = new ArrayList<>();
            for (int c = range.getStart().getCol(); c <= range.getEnd().getCol(); c++) {
                cols.add(FormulaValue.fromCellValue(worksheet.getResolvedValueAt(r, c)));
            }
            rows.add(cols);
        }
        return FormulaValue.array(rows);
    }

    private Worksheet resolveSheet(String sheet) {
        if (sheet == null) {
            return workbook.getWorksheet(currentSheet);
        }
        Integer index = workbook.sheetIndex(sheet);
        return index == null ? null : workbook.getWorksheet(index);
    }

    // ------------------------
    // Defined names
    // ------------------------

    /**
     * Resolves a defined name as seen from the current sheet:
     * 1) "=..." is parsed and evaluated in this context
     * 2) a numeric or TRUE/FALSE constant is returned as-is
     * 3) otherwise it must be a cell or range reference, optionally sheet-qualified
     */
    public FormulaValue resolveNamedRange(String name) {
        if (workbook == null) {
            throw new InvalidReferenceException("No workbook context for name lookup: " + name);
        }
        NamedRange named = workbook.getNamedRange(name, currentSheet);
        if (named == null) {
            throw new InvalidReferenceException("Unknown name: " + name);
        }

        String key = name.toLowerCase(Locale.ROOT);
        if (!namesInProgress.add(key)) {
            throw new CircularReferenceException("Name refers to itself: " + name);
        }
        try {
            return resolveDefinition(named.getRefersTo().trim());
        } finally {
            namesInProgress.remove(key);
        }
    }

    private FormulaValue resolveDefinition(String refersTo) {
        if (refersTo.startsWith("=")) {
            return Evaluator.evaluate(FormulaParser.parse(refersTo), this);
        }

        Double number = NumberText.parse(refersTo);
        if (number != null) {
            return FormulaValue.number(number);
        }
        String upper = refersTo.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE")) {
            return FormulaValue.TRUE;
        }
        if (upper.equals("FALSE")) {
            return FormulaValue.FALSE;
        }

        FormulaExpr reference;
        try {
            reference = FormulaParser.parse("=" + refersTo);
        } catch (FormulaParseException e) {
            throw new InvalidReferenceException("Invalid reference in name definition: " + refersTo);
        }
        if (reference instanceof CellReference || reference instanceof RangeReference) {
            return Evaluator.evaluate(reference, this);
        }
        throw new InvalidReferenceException("Name definition is not a reference: " + refersTo);
    }
}
