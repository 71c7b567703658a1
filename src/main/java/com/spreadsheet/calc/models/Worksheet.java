package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One sheet of a workbook:
 * - a name
 * - a sparse map of CellAddress -> CellValue
 * - the registry of active spill sources and their footprint
 * - merged regions (which block spills)
 */
public class Worksheet {

    private final String name;
    private final Map<CellAddress, CellValue> cells = new ConcurrentHashMap<>();
    // Source cell -> size of the array it currently spills
    private final Map<CellAddress, SpillInfo> spillSources = new ConcurrentHashMap<>();
    private final List<CellRange> mergedRegions = new ArrayList<>();

    public Worksheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // ------------------------
    // Cell access
    // ------------------------

    /**
     * Raw stored content, EMPTY if nothing is stored.
     */
    public CellValue getValueAt(int row, int col) {
        CellValue value = cells.get(new CellAddress(row, col));
        return value == null ? CellValue.empty() : value;
    }

    public CellValue getValue(String address) {
        CellAddress addr = CellAddress.parse(address);
        return getValueAt(addr.getRow(), addr.getCol());
    }

    /**
     * Value a reader sees after calculation: a formula yields its cached result,
     * a spill target yields the matching element of its source's array.
     */
    public CellValue getResolvedValueAt(int row, int col) {
        CellValue value = getValueAt(row, col);
        switch (value.getType()) {
            case FORMULA:
                return value.effectiveValue();
            case SPILL_TARGET:
                return resolveSpillTarget(value);
            default:
                return value;
        }
    }

    private CellValue resolveSpillTarget(CellValue target) {
        CellValue source = getValueAt(target.getSourceRow(), target.getSourceCol());
        List<List<CellValue>> array = source.getArrayResult();
        if (!source.isFormula() || array == null) {
            return CellValue.empty();
        }
        if (target.getOffsetRow() >= array.size()
                || target.getOffsetCol() >= array.get(target.getOffsetRow()).size()) {
            return CellValue.empty();
        }
        return array.get(target.getOffsetRow()).get(target.getOffsetCol());
    }

    /**
     * Cached value of a formula cell, or the stored value itself otherwise.
     * Spill targets are returned as markers.
     */
    public CellValue getCalculatedValueAt(int row, int col) {
        CellValue value = getValueAt(row, col);
        return value.isFormula() ? value.effectiveValue() : value;
    }

    public void setCellValue(String address, CellValue value) {
        CellAddress addr = CellAddress.parse(address);
        setCellValueAt(addr.getRow(), addr.getCol(), value);
    }

    /**
     * Stores a value. Overwriting a spill source removes the cells it spilled into.
     */
    public void setCellValueAt(int row, int col, CellValue value) {
        CellAddress addr = new CellAddress(row, col);
        clearSpill(row, col);
        if (value == null || value.isEmpty()) {
            cells.remove(addr);
        } else {
            cells.put(addr, value);
        }
    }

    public void setCellFormula(String address, String formula) {
        setCellValue(address, CellValue.formula(formula));
    }

    public void setCellFormulaAt(int row, int col, String formula) {
        setCellValueAt(row, col, CellValue.formula(formula));
    }

    public void clearCell(String address) {
        setCellValue(address, CellValue.empty());
    }

    public int cellCount() {
        return cells.size();
    }

    /**
     * Stored cells in row-major order.
     */
    public Map<CellAddress, CellValue> getCells() {
        return Collections.unmodifiableMap(new TreeMap<>(cells));
    }

    // ------------------------
    // Formula support
    // ------------------------

    /**
     * Every formula cell as address -> formula text, in row-major order.
     */
    public Map<CellAddress, String> formulaCells() {
        Map<CellAddress, String> formulas = new TreeMap<>();
        for (Map.Entry<CellAddress, CellValue> entry : cells.entrySet()) {
            if (entry.getValue().isFormula()) {
                formulas.put(entry.getKey(), entry.getValue().getFormulaText());
            }
        }
        return formulas;
    }

    /**
     * Writes the calculated scalar of a formula cell.
     * Returns false if the cell is not a formula.
     */
    public boolean setFormulaResult(int row, int col, CellValue result) {
        CellAddress addr = new CellAddress(row, col);
        CellValue current = cells.get(addr);
        if (current == null || !current.isFormula()) {
            return false;
        }
        clearSpill(row, col);
        cells.put(addr, current.withCachedValue(result));
        return true;
    }

    /**
     * Writes a dynamic array result with the source at the top-left corner:
     * 1) a 1x1 array is stored as a plain scalar
     * 2) the source's previous spill targets are always cleared first
     * 3) if any covered cell is occupied (other than by this source's own markers)
     *    or merged, the source becomes #SPILL! and nothing else is touched
     * 4) otherwise every covered cell receives a SpillTarget marker
     * Returns true when the array was spilled.
     */
    public boolean setArrayFormulaResult(int row, int col, List<List<CellValue>> array) {
        CellAddress addr = new CellAddress(row, col);
        CellValue current = cells.get(addr);
        if (current == null || !current.isFormula()) {
            return false;
        }
        int numRows = array.size();
        int numCols = numRows == 0 ? 0 : array.get(0).size();
        if (numRows == 0 || numCols == 0) {
            setFormulaResult(row, col, CellValue.error(CellError.CALC));
            return false;
        }
        if (numRows == 1 && numCols == 1) {
            return setFormulaResult(row, col, array.get(0).get(0));
        }

        clearSpill(row, col);

        if (!canSpillTo(row, col, numRows, numCols)) {
            cells.put(addr, current.withCachedValue(CellValue.error(CellError.SPILL)));
            return false;
        }

        spillSources.put(addr, new SpillInfo(numRows, numCols));
        cells.put(addr, current.withArrayResult(array));
        for (int r = 0; r < numRows; r++) {
            for (int c = 0; c < numCols; c++) {
                if (r == 0 && c == 0) {
                    continue;
                }
                cells.put(new CellAddress(row + r, col + c), CellValue.spillTarget(row, col, r, c));
            }
        }
        return true;
    }

    /**
     * Removes the spill targets written from a source and unregisters it.
     */
    public void clearSpill(int row, int col) {
        SpillInfo info = spillSources.remove(new CellAddress(row, col));
        if (info == null) {
            return;
        }
        for (int r = 0; r < info.getRows(); r++) {
            for (int c = 0; c < info.getCols(); c++) {
                if (r == 0 && c == 0) {
                    continue;
                }
                CellAddress target = new CellAddress(row + r, col + c);
                CellValue value = cells.get(target);
                if (value != null && value.isSpillTarget()
                        && value.getSourceRow() == row && value.getSourceCol() == col) {
                    cells.remove(target);
                }
            }
        }
    }

    /**
     * True when every cell of the rectangle except the source is empty
     * or already a spill target of this same source, none is merged,
     * and the rectangle fits inside the sheet.
     */
    public boolean canSpillTo(int sourceRow, int sourceCol, int numRows, int numCols) {
        if (sourceRow + numRows > CellAddress.MAX_ROWS || sourceCol + numCols > CellAddress.MAX_COLUMNS) {
            return false;
        }
        for (int r = 0; r < numRows; r++) {
            for (int c = 0; c < numCols; c++) {
                if (r == 0 && c == 0) {
                    continue;
                }
                int row = sourceRow + r;
                int col = sourceCol + c;
                CellValue value = cells.get(new CellAddress(row, col));
                if (value != null && !value.isEmpty()) {
                    boolean ownTarget = value.isSpillTarget()
                            && value.getSourceRow() == sourceRow
                            && value.getSourceCol() == sourceCol;
                    if (!ownTarget) {
                        return false;
                    }
                }
                if (isMerged(row, col)) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isSpillTarget(int row, int col) {
        return getValueAt(row, col).isSpillTarget();
    }

    public boolean isSpillSource(int row, int col) {
        return spillSources.containsKey(new CellAddress(row, col));
    }

    public SpillInfo getSpillInfo(int row, int col) {
        return spillSources.get(new CellAddress(row, col));
    }

    /**
     * Source of the spill covering a cell, or null if the cell is not a spill target.
     */
    public CellAddress getSpillSource(int row, int col) {
        CellValue value = getValueAt(row, col);
        if (!value.isSpillTarget()) {
            return null;
        }
        return new CellAddress(value.getSourceRow(), value.getSourceCol());
    }

    // ------------------------
    // Merged regions
    // ------------------------

    public synchronized void mergeCells(CellRange range) {
        for (CellRange existing : mergedRegions) {
            if (existing.intersects(range)) {
                throw new IllegalArgumentException("Range " + range + " overlaps merged region " + existing);
            }
        }
        mergedRegions.add(range);
    }

    public synchronized boolean isMerged(int row, int col) {
        for (CellRange region : mergedRegions) {
            if (region.contains(row, col)) {
                return true;
            }
        }
        return false;
    }
}
