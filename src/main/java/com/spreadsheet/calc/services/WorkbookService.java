package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.CalculationProperties;
import com.spreadsheet.calc.dependency.DependencyGraph;
import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.exceptions.WorkbookNotFoundException;
import com.spreadsheet.calc.formula.FormulaParser;
import com.spreadsheet.calc.formula.NumberText;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.Worksheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workbooks held in memory, with cell editing, defined names, calculation passes
 * and one-off formula evaluation.
 * Writes take the workbook's write lock, reads its read lock.
 */
@Service
public class WorkbookService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory
    private final Map<Long, Workbook> workbooks = new ConcurrentHashMap<>();

    private final CalculationProperties properties;

    @Autowired
    public WorkbookService(CalculationProperties properties) {
        this.properties = properties;
    }

    public WorkbookService() {
        this(new CalculationProperties());
    }

    /**
     * Creates a workbook with the given sheets ("Sheet1" when none) and returns its ID.
     */
    public long createWorkbook(List<String> sheetNames, boolean date1904) {
        Workbook workbook = new Workbook(sheetNames);
        workbook.getSettings().setDate1904(date1904);
        workbooks.put(workbook.getId(), workbook);
        logger.debug("Created workbook {} with {} sheet(s)", workbook.getId(), workbook.sheetCount());
        return workbook.getId();
    }

    public Workbook getWorkbook(long workbookId) {
        Workbook workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    public int addWorksheet(long workbookId, String name) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            return workbook.addWorksheet(name == null ? null : name.trim());
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Sets a cell from raw text:
     * 1) blank text clears the cell
     * 2) text starting with '=' is a formula; it must parse, otherwise the cell is left as it was
     * 3) anything else is a number, TRUE/FALSE, an error literal or plain text
     * With auto-calculate on, a full pass follows the write.
     */
    public void setCell(long workbookId, String sheetName, String address, String rawValue) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            Worksheet sheet = workbook.getWorksheet(sheetName);
            CellAddress addr = CellAddress.parse(address);
            if (rawValue != null && rawValue.startsWith("=")) {
                FormulaParser.parse(rawValue);
                sheet.setCellFormulaAt(addr.getRow(), addr.getCol(), rawValue);
            } else {
                sheet.setCellValueAt(addr.getRow(), addr.getCol(), parseLiteral(rawValue));
            }
            if (properties.isAutoCalculate()) {
                runPass(workbook, properties.toOptions());
            }
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public void clearCell(long workbookId, String sheetName, String address) {
        setCell(workbookId, sheetName, address, null);
    }

    /**
     * Defines a name. With a sheet the name is visible from that sheet only,
     * otherwise from the whole workbook.
     */
    public void defineName(long workbookId, String name, String refersTo, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            if (sheetName == null) {
                workbook.defineName(name, refersTo);
            } else {
                workbook.getWorksheet(sheetName);
                workbook.defineNameForSheet(name, refersTo, workbook.sheetIndex(sheetName));
            }
            if (properties.isAutoCalculate()) {
                runPass(workbook, properties.toOptions());
            }
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Runs a full pass. Null options use the configured defaults.
     */
    public CalculationStats calculate(long workbookId, CalculationOptions options) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            return runPass(workbook, options == null ? properties.toOptions() : options);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Evaluates a formula against the workbook without storing it. The address, when
     * given, is the position ROW() and COLUMN() see. Failures propagate.
     */
    public FormulaValue evaluateFormula(long workbookId, String sheetName, String address, String formula) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            workbook.getWorksheet(sheetName);
            int sheetIndex = workbook.sheetIndex(sheetName);
            CellAddress at = address == null || address.isBlank() ? new CellAddress(0, 0) : CellAddress.parse(address);
            EvaluationContext ctx = new EvaluationContext(workbook, sheetIndex, at.getRow(), at.getCol());
            return Evaluator.evaluate(formula, ctx);
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Returns "A1" -> calculated value for every stored cell of a sheet,
     * spilled cells included. Errors appear as their display text.
     */
    public Map<String, Object> getSheetData(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            Worksheet sheet = workbook.getWorksheet(sheetName);
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress addr : sheet.getCells().keySet()) {
                CellValue value = sheet.getResolvedValueAt(addr.getRow(), addr.getCol());
                data.put(addr.toA1(), value.toPlainValue());
            }
            return data;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * precedent -> cells that read it, keyed "Sheet!A1".
     */
    public Map<String, Set<String>> getForwardDependencies(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return dependencyGraph(workbook).forwardView(key -> key.label(workbook));
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * formula cell -> cells it reads, keyed "Sheet!A1".
     */
    public Map<String, Set<String>> getReverseDependencies(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return dependencyGraph(workbook).reverseView(key -> key.label(workbook));
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Plain Java form of a value for JSON: Double, Boolean, String, error text,
     * null for blank, nested lists for an array.
     */
    public static Object toPlainValue(FormulaValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case STRING:
                return value.getString();
            case BOOLEAN:
                return value.getBoolean();
            case ERROR:
                return value.getError().getText();
            case ARRAY: {
                List<List<Object>> rows = new ArrayList<>();
                for (List<FormulaValue> row : value.getArray()) {
                    List<Object> out = new ArrayList<>(row.size());
                    for (FormulaValue v : row) {
                        out.add(toPlainValue(v));
                    }
                    rows.add(out);
                }
                return rows;
            }
            default:
                return null;
        }
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private CalculationStats runPass(Workbook workbook, CalculationOptions options) {
        return new CalculationEngine(options).calculateAll(workbook);
    }

    private DependencyGraph dependencyGraph(Workbook workbook) {
        return new CalculationEngine(properties.toOptions()).buildDependencyGraph(workbook);
    }

    /**
     * Literal cell content: number, TRUE/FALSE, error literal, else text. Blank clears.
     */
    static CellValue parseLiteral(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return CellValue.empty();
        }
        String trimmed = rawValue.trim();
        Double number = NumberText.parse(trimmed);
        if (number != null) {
            return CellValue.of(number);
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return CellValue.of(upper.equals("TRUE"));
        }
        CellError error = CellError.fromText(trimmed);
        if (error != null) {
            return CellValue.error(error);
        }
        return CellValue.of(rawValue);
    }
}
