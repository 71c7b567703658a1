package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.Worksheet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LookupFunctionsTest {

    private static final String TABLE = "{\"apple\",1.5;\"pear\",2;\"plum\",3}";

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    @Test
    void testIndex() {
        assertEquals(FormulaValue.number(4), eval("=INDEX({1,2;3,4},2,2)"));
        assertEquals(FormulaValue.number(3), eval("=INDEX({1,2;3,4},2)"));
        assertEquals(FormulaValue.number(2), eval("=INDEX({1,2;3,4},1.9,2.7)"));
        assertEquals(CellError.VALUE, eval("=INDEX({1,2;3,4},0,1)").getError());
        assertEquals(CellError.REF, eval("=INDEX({1,2;3,4},3,1)").getError());
        assertEquals(CellError.REF, eval("=INDEX({1,2;3,4},1,3)").getError());
    }

    @Test
    void testMatchExact() {
        assertEquals(FormulaValue.number(2), eval("=MATCH(\"PEAR\",{\"apple\",\"pear\",\"plum\"},0)"));
        assertEquals(FormulaValue.number(3), eval("=MATCH(30,{10;20;30})"));
        assertEquals(FormulaValue.number(1), eval("=MATCH(\"10\",{10,20})"));
        assertEquals(CellError.NA, eval("=MATCH(99,{10,20})").getError());
    }

    @Test
    void testMatchOnlySupportsExactType() {
        assertEquals(CellError.NA, eval("=MATCH(20,{10,20},1)").getError());
        assertEquals(CellError.NA, eval("=MATCH(20,{10,20},-1)").getError());
        assertEquals(CellError.NA, eval("=MATCH(1,{1,2;3,4})").getError());
    }

    @Test
    void testVlookup() {
        assertEquals(FormulaValue.number(2), eval("=VLOOKUP(\"Pear\"," + TABLE + ",2,FALSE)"));
        assertEquals(FormulaValue.string("plum"), eval("=VLOOKUP(\"plum\"," + TABLE + ",1)"));
        assertEquals(CellError.NA, eval("=VLOOKUP(\"fig\"," + TABLE + ",2)").getError());
        assertEquals(CellError.REF, eval("=VLOOKUP(\"pear\"," + TABLE + ",3)").getError());
        assertEquals(CellError.VALUE, eval("=VLOOKUP(\"pear\"," + TABLE + ",0)").getError());
    }

    @Test
    void testRowsColumnsChoose() {
        assertEquals(FormulaValue.number(3), eval("=ROWS(" + TABLE + ")"));
        assertEquals(FormulaValue.number(2), eval("=COLUMNS(" + TABLE + ")"));
        assertEquals(FormulaValue.number(1), eval("=ROWS(5)"));
        assertEquals(FormulaValue.string("b"), eval("=CHOOSE(2,\"a\",\"b\",\"c\")"));
        assertEquals(CellError.VALUE, eval("=CHOOSE(4,\"a\",\"b\",\"c\")").getError());
    }

    @Test
    void testRowAndColumnUseCurrentCell() {
        Workbook workbook = new Workbook();
        EvaluationContext ctx = new EvaluationContext(workbook, 0, 4, 2);
        assertEquals(FormulaValue.number(5), Evaluator.evaluate("=ROW()", ctx));
        assertEquals(FormulaValue.number(3), Evaluator.evaluate("=COLUMN()", ctx));

        FormulaValue rows = Evaluator.evaluate("=ROW(A1:A3)", ctx);
        assertEquals(3, rows.rowCount());
        assertEquals(FormulaValue.number(7), rows.getArray().get(2).get(0));
    }

    @Test
    void testLookupAgainstWorksheetRange() {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.getWorksheet(0);
        sheet.setCellValue("A1", CellValue.of("id"));
        sheet.setCellValue("A2", CellValue.of(101));
        sheet.setCellValue("A3", CellValue.of(102));
        sheet.setCellValue("B1", CellValue.of("name"));
        sheet.setCellValue("B2", CellValue.of("Ada"));
        sheet.setCellValue("B3", CellValue.of("Grace"));
        EvaluationContext ctx = new EvaluationContext(workbook, 0, 9, 9);
        assertEquals(FormulaValue.string("Grace"), Evaluator.evaluate("=VLOOKUP(102,A1:B3,2,FALSE)", ctx));
        assertEquals(FormulaValue.string("Ada"), Evaluator.evaluate("=INDEX(B1:B3,MATCH(101,A1:A3,0))", ctx));
    }

    @Test
    void testSequence() {
        FormulaValue seq = eval("=SEQUENCE(3)");
        assertEquals(3, seq.rowCount());
        assertEquals(1, seq.columnCount());
        assertEquals(FormulaValue.number(3), seq.getArray().get(2).get(0));

        FormulaValue grid = eval("=SEQUENCE(2,3,10,5)");
        assertEquals(List.of(
                List.of(FormulaValue.number(10), FormulaValue.number(15), FormulaValue.number(20)),
                List.of(FormulaValue.number(25), FormulaValue.number(30), FormulaValue.number(35))),
                grid.getArray());
    }

    @Test
    void testSequenceLimits() {
        assertEquals(CellError.VALUE, eval("=SEQUENCE(0)").getError());
        assertEquals(CellError.VALUE, eval("=SEQUENCE(1,-1)").getError());
        assertEquals(CellError.VALUE, eval("=SEQUENCE(2000,1000)").getError());
    }

    @Test
    void testLookupEquals() {
        assertTrue(LookupFunctions.lookupEquals(FormulaValue.string("ABC"), FormulaValue.string("abc")));
        assertTrue(LookupFunctions.lookupEquals(FormulaValue.EMPTY, FormulaValue.number(0)));
        assertTrue(LookupFunctions.lookupEquals(FormulaValue.EMPTY, FormulaValue.string("")));
        assertFalse(LookupFunctions.lookupEquals(FormulaValue.TRUE, FormulaValue.number(1)));
    }
}
