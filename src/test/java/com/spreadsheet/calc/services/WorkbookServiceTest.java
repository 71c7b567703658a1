package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.CalculationProperties;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidCellAddressException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.exceptions.WorkbookNotFoundException;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookServiceTest {

    private WorkbookService workbookService;
    private long workbookId;

    @BeforeEach
    void setUp() {
        workbookService = new WorkbookService();
        workbookId = workbookService.createWorkbook(Arrays.asList("Sheet1", "Data"), false);
    }

    @Test
    void testCreateWorkbook() {
        assertEquals(2, workbookService.getWorkbook(workbookId).sheetCount());

        long defaultId = workbookService.createWorkbook(null, true);
        assertNotEquals(workbookId, defaultId);
        assertEquals("Sheet1", workbookService.getWorkbook(defaultId).getWorksheet(0).getName());
        assertTrue(workbookService.getWorkbook(defaultId).getSettings().isDate1904());
    }

    @Test
    void testUnknownWorkbookAndSheet() {
        assertThrows(WorkbookNotFoundException.class, () -> workbookService.getWorkbook(-1));
        assertThrows(SheetNotFoundException.class,
                () -> workbookService.setCell(workbookId, "Missing", "A1", "1"));
        assertThrows(InvalidCellAddressException.class,
                () -> workbookService.setCell(workbookId, "Sheet1", "1A", "1"));
    }

    @Test
    void testParseLiteral() {
        assertEquals(CellValue.of(12.5), WorkbookService.parseLiteral("12.5"));
        assertEquals(CellValue.of(true), WorkbookService.parseLiteral("true"));
        assertEquals(CellValue.error(CellError.NA), WorkbookService.parseLiteral("#N/A"));
        assertEquals(CellValue.of("hello"), WorkbookService.parseLiteral("hello"));
        assertTrue(WorkbookService.parseLiteral("").isEmpty());
        assertTrue(WorkbookService.parseLiteral(null).isEmpty());
    }

    @Test
    void testSetCellRecalculates() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "10");
        workbookService.setCell(workbookId, "Sheet1", "A2", "=A1*3");
        assertEquals(30.0, workbookService.getSheetData(workbookId, "Sheet1").get("A2"));

        workbookService.setCell(workbookId, "Sheet1", "A1", "2");
        assertEquals(6.0, workbookService.getSheetData(workbookId, "Sheet1").get("A2"));
    }

    @Test
    void testAutoCalculateOff() {
        CalculationProperties properties = new CalculationProperties();
        properties.setAutoCalculate(false);
        WorkbookService manual = new WorkbookService(properties);
        long id = manual.createWorkbook(null, false);

        manual.setCell(id, "Sheet1", "A1", "=1+1");
        assertNull(manual.getSheetData(id, "Sheet1").get("A1"));

        CalculationStats stats = manual.calculate(id, null);
        assertEquals(1, stats.getFormulaCount());
        assertEquals(2.0, manual.getSheetData(id, "Sheet1").get("A1"));
    }

    @Test
    void testInvalidFormulaLeavesCellUnchanged() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "5");
        assertThrows(FormulaParseException.class,
                () -> workbookService.setCell(workbookId, "Sheet1", "A1", "=1+"));
        assertEquals(5.0, workbookService.getSheetData(workbookId, "Sheet1").get("A1"));
    }

    @Test
    void testClearCell() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "5");
        workbookService.clearCell(workbookId, "Sheet1", "A1");
        assertFalse(workbookService.getSheetData(workbookId, "Sheet1").containsKey("A1"));
    }

    @Test
    void testAddWorksheet() {
        assertEquals(2, workbookService.addWorksheet(workbookId, " Summary "));
        assertThrows(IllegalArgumentException.class, () -> workbookService.addWorksheet(workbookId, "data"));
        assertThrows(IllegalArgumentException.class, () -> workbookService.addWorksheet(workbookId, " "));
    }

    @Test
    void testDefineName() {
        workbookService.setCell(workbookId, "Data", "A1", "0.25");
        workbookService.defineName(workbookId, "Rate", "Data!A1", null);
        workbookService.setCell(workbookId, "Sheet1", "B1", "=100*Rate");
        assertEquals(25.0, workbookService.getSheetData(workbookId, "Sheet1").get("B1"));

        assertThrows(SheetNotFoundException.class,
                () -> workbookService.defineName(workbookId, "Local", "A1", "Missing"));
    }

    @Test
    void testEvaluateFormula() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "4");
        assertEquals(FormulaValue.number(16), workbookService.evaluateFormula(workbookId, "Sheet1", null, "=A1^2"));
        assertEquals(FormulaValue.number(3), workbookService.evaluateFormula(workbookId, "Sheet1", "B3", "=ROW()"));
        assertThrows(FormulaParseException.class,
                () -> workbookService.evaluateFormula(workbookId, "Sheet1", null, "=(1"));
        // evaluation does not store anything
        assertEquals(1, workbookService.getSheetData(workbookId, "Sheet1").size());
    }

    @Test
    void testSheetDataIncludesSpilledCells() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "=SEQUENCE(3)");
        workbookService.setCell(workbookId, "Sheet1", "B1", "=1/0");

        Map<String, Object> data = workbookService.getSheetData(workbookId, "Sheet1");
        assertEquals(1.0, data.get("A1"));
        assertEquals(3.0, data.get("A3"));
        assertEquals("#DIV/0!", data.get("B1"));
    }

    @Test
    void testDependencyViews() {
        workbookService.setCell(workbookId, "Data", "A1", "1");
        workbookService.setCell(workbookId, "Sheet1", "B1", "=Data!A1+1");
        workbookService.setCell(workbookId, "Sheet1", "C1", "=B1");

        Map<String, Set<String>> forward = workbookService.getForwardDependencies(workbookId);
        assertEquals(Set.of("Sheet1!B1"), forward.get("Data!A1"));
        assertEquals(Set.of("Sheet1!C1"), forward.get("Sheet1!B1"));

        Map<String, Set<String>> reverse = workbookService.getReverseDependencies(workbookId);
        assertEquals(Set.of("Data!A1"), reverse.get("Sheet1!B1"));
        assertFalse(reverse.containsKey("Data!A1"));
    }

    @Test
    void testCalculateWithOptions() {
        workbookService.setCell(workbookId, "Sheet1", "A1", "=B1/2+1");
        workbookService.setCell(workbookId, "Sheet1", "B1", "=A1");
        assertEquals("#REF!", workbookService.getSheetData(workbookId, "Sheet1").get("A1"));

        CalculationStats stats = workbookService.calculate(workbookId, CalculationOptions.iterative(200, 0.00001));
        assertTrue(stats.isConverged());
        assertEquals(2.0, (Double) workbookService.getSheetData(workbookId, "Sheet1").get("A1"), 0.001);
    }

    @Test
    void testToPlainValue() {
        assertEquals(1.5, WorkbookService.toPlainValue(FormulaValue.number(1.5)));
        assertEquals(Boolean.TRUE, WorkbookService.toPlainValue(FormulaValue.TRUE));
        assertEquals("#N/A", WorkbookService.toPlainValue(FormulaValue.error(CellError.NA)));
        assertNull(WorkbookService.toPlainValue(FormulaValue.EMPTY));
        assertEquals(List.of(List.of(1.0, "x")), WorkbookService.toPlainValue(
                FormulaValue.array(List.of(List.of(FormulaValue.number(1), FormulaValue.string("x"))))));
    }
}
