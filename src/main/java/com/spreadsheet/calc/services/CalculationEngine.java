package com.spreadsheet.calc.services;

import com.spreadsheet.calc.dependency.CellKey;
import com.spreadsheet.calc.dependency.DependencyGraph;
import com.spreadsheet.calc.dependency.ReferenceExtractor;
import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.formula.FormulaExpr;
import com.spreadsheet.calc.formula.FormulaParser;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.Worksheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recalculates every formula of a workbook. One pass runs four phases:
 * 1) collect: parse each formula, note volatile ones, record the cells it reads
 * 2) detect cycles: mark every formula cell that can reach itself
 * 3) order: precedents before dependents
 * 4) evaluate: a single sweep, or repeated sweeps when iterative mode is on and cycles exist
 *
 * The caller must hold the workbook's write lock for the whole pass.
 * A failure in one cell is counted and logged; it never stops the pass.
 */
public class CalculationEngine {

    private static final Logger logger = LoggerFactory.getLogger(CalculationEngine.class);

    private final CalculationOptions options;

    // State of the pass in progress; rebuilt by every calculateAll
    private DependencyGraph graph;
    private Map<CellKey, FormulaExpr> parsedFormulas;
    private Set<CellKey> volatileCells;
    private Set<CellKey> circularCells;

    public CalculationEngine(CalculationOptions options) {
        this.options = options == null ? new CalculationOptions() : options;
    }

    public CalculationOptions getOptions() {
        return options;
    }

    public CalculationStats calculateAll(Workbook workbook) {
        CalculationStats stats = new CalculationStats();
        graph = new DependencyGraph();
        parsedFormulas = new LinkedHashMap<>();
        volatileCells = new HashSet<>();
        circularCells = new HashSet<>();

        if (!options.isForceFullCalculation()) {
            logger.debug("Only full recalculation is supported, running a full pass");
        }

        collectFormulas(workbook, stats);
        if (stats.getFormulaCount() == 0) {
            logger.debug("Workbook {} has no formulas to calculate", workbook.getId());
            return stats;
        }

        for (CellKey key : parsedFormulas.keySet()) {
            if (graph.hasCircularReference(key)) {
                circularCells.add(key);
            }
        }
        stats.setCircularReferences(circularCells.size());

        List<CellKey> order = calculationOrder();
        logger.debug("Workbook {}: {} formulas, {} circular, {} volatile",
                workbook.getId(), stats.getFormulaCount(), circularCells.size(), volatileCells.size());

        if (circularCells.isEmpty() || !options.isIterative()) {
            calculateSimple(workbook, order, stats);
        } else {
            calculateIterative(workbook, order, stats);
        }

        logger.info("Calculated workbook {}: {}", workbook.getId(), stats);
        return stats;
    }

    /**
     * Runs the collect phase only and returns the resulting graph.
     */
    public DependencyGraph buildDependencyGraph(Workbook workbook) {
        graph = new DependencyGraph();
        parsedFormulas = new LinkedHashMap<>();
        volatileCells = new HashSet<>();
        collectFormulas(workbook, new CalculationStats());
        return graph;
    }

    // ------------------------
    // Phases
    // ------------------------

    private void collectFormulas(Workbook workbook, CalculationStats stats) {
        List<Worksheet> sheets = workbook.getWorksheets();
        for (int sheetIndex = 0; sheetIndex < sheets.size(); sheetIndex++) {
            Worksheet sheet = sheets.get(sheetIndex);
            for (Map.Entry<CellAddress, String> entry : sheet.formulaCells().entrySet()) {
                CellAddress addr = entry.getKey();
                CellKey key = new CellKey(sheetIndex, addr.getRow(), addr.getCol());

                FormulaExpr ast;
                try {
                    ast = FormulaParser.parse(entry.getValue());
                } catch (FormulaException ex) {
                    logger.warn("Failed to parse formula at {}!{}: {}", sheet.getName(), addr.toA1(), ex.getMessage());
                    stats.incrementErrors();
                    continue;
                }

                if (options.isCalculateVolatile() && ReferenceExtractor.containsVolatileFunction(ast)) {
                    volatileCells.add(key);
                }

                for (CellKey ref : ReferenceExtractor.extract(ast, sheetIndex, workbook)) {
                    graph.addDependency(ref, key);
                    CellKey spillSource = spillSourceOf(workbook, ref);
                    if (spillSource != null) {
                        graph.addDependency(spillSource, key);
                    }
                }

                parsedFormulas.put(key, ast);
            }
        }
        stats.setFormulaCount(parsedFormulas.size());
        stats.setVolatileCells(volatileCells.size());
    }

    // A cell filled by the previous pass's spill is produced by its source formula
    private static CellKey spillSourceOf(Workbook workbook, CellKey ref) {
        Worksheet sheet = workbook.getWorksheet(ref.getSheet());
        if (sheet == null) {
            return null;
        }
        CellAddress source = sheet.getSpillSource(ref.getRow(), ref.getCol());
        return source == null ? null : new CellKey(ref.getSheet(), source.getRow(), source.getCol());
    }

    private List<CellKey> calculationOrder() {
        List<CellKey> order = new ArrayList<>();
        for (CellKey key : graph.getRecalcOrder(parsedFormulas.keySet())) {
            if (parsedFormulas.containsKey(key)) {
                order.add(key);
            }
        }
        return order;
    }

    private void calculateSimple(Workbook workbook, List<CellKey> order, CalculationStats stats) {
        for (CellKey key : order) {
            Worksheet sheet = workbook.getWorksheet(key.getSheet());
            if (circularCells.contains(key)) {
                sheet.setFormulaResult(key.getRow(), key.getCol(), CellValue.error(CellError.REF));
                stats.incrementErrors();
                continue;
            }
            FormulaValue result = evaluateCell(workbook, key, stats);
            store(sheet, key, result);
            stats.incrementCellsCalculated();
        }
        stats.setIterations(1);
        stats.setConverged(true);
    }

    /**
     * Repeats the sweep until the largest change of a circular cell's numeric value is
     * at most maxChange, or maxIterations sweeps have run. Changes are measured against
     * the value each circular cell held before the sweep, blank counting as 0.
     */
    private void calculateIterative(Workbook workbook, List<CellKey> order, CalculationStats stats) {
        Map<CellKey, Double> previous = new HashMap<>();
        for (CellKey key : circularCells) {
            Worksheet sheet = workbook.getWorksheet(key.getSheet());
            Double seed = numericValue(sheet.getCalculatedValueAt(key.getRow(), key.getCol()));
            if (seed == null) {
                // e.g. the #REF! of an earlier non-iterative pass; start from blank
                sheet.setFormulaResult(key.getRow(), key.getCol(), CellValue.empty());
                seed = 0.0;
            }
            previous.put(key, seed);
        }

        boolean converged = false;
        for (int iteration = 0; iteration < options.getMaxIterations(); iteration++) {
            stats.setIterations(iteration + 1);
            double maxChange = 0;
            boolean firstSweep = iteration == 0;

            for (CellKey key : order) {
                Worksheet sheet = workbook.getWorksheet(key.getSheet());
                FormulaValue result = evaluateCell(workbook, key, firstSweep ? stats : null);
                store(sheet, key, result);

                if (circularCells.contains(key) && result.isNumber()) {
                    Double old = previous.get(key);
                    if (old != null) {
                        maxChange = Math.max(maxChange, Math.abs(result.getNumber() - old));
                    }
                    previous.put(key, result.getNumber());
                }
                if (firstSweep) {
                    stats.incrementCellsCalculated();
                }
            }

            logger.debug("Iteration {}: max change {}", iteration + 1, maxChange);
            if (maxChange <= options.getMaxChange()) {
                converged = true;
                break;
            }
        }

        stats.setConverged(converged);
        if (!converged) {
            logger.warn("Workbook {} did not converge after {} iterations", workbook.getId(), options.getMaxIterations());
        }
    }

    // ------------------------
    // Per-cell helpers
    // ------------------------

    /**
     * Evaluates one formula cell. A failure becomes #VALUE! and, when {@code stats}
     * is given, is counted as an error.
     */
    private FormulaValue evaluateCell(Workbook workbook, CellKey key, CalculationStats stats) {
        EvaluationContext ctx = new EvaluationContext(workbook, key.getSheet(), key.getRow(), key.getCol());
        try {
            return Evaluator.evaluate(parsedFormulas.get(key), ctx);
        } catch (FormulaException ex) {
            if (stats != null) {
                logger.warn("Evaluation error at {}: {}", key.label(workbook), ex.getMessage());
                stats.incrementErrors();
            }
            return FormulaValue.error(CellError.VALUE);
        } catch (RuntimeException ex) {
            // one cell failing never stops the pass
            if (stats != null) {
                logger.error("Unexpected failure evaluating {}", key.label(workbook), ex);
                stats.incrementErrors();
            }
            return FormulaValue.error(CellError.VALUE);
        }
    }

    private static void store(Worksheet sheet, CellKey key, FormulaValue result) {
        if (result.isArray()) {
            List<List<CellValue>> cells = new ArrayList<>();
            for (List<FormulaValue> row : result.getArray()) {
                List<CellValue> converted = new ArrayList<>(row.size());
                for (FormulaValue v : row) {
                    converted.add(v.toCellValue());
                }
                cells.add(converted);
            }
            if (!sheet.setArrayFormulaResult(key.getRow(), key.getCol(), cells)) {
                logger.debug("Array result at {}!{} was not spilled", sheet.getName(),
                        new CellAddress(key.getRow(), key.getCol()).toA1());
            }
        } else {
            sheet.setFormulaResult(key.getRow(), key.getCol(), result.toCellValue());
        }
    }

    private static Double numericValue(CellValue value) {
        if (value.isEmpty()) {
            return 0.0;
        }
        return value.getType() == CellValue.Type.NUMBER ? value.getNumber() : null;
    }
}
