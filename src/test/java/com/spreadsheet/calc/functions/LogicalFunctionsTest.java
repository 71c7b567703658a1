package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicalFunctionsTest {

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    @Test
    void testIf() {
        assertEquals(FormulaValue.string("yes"), eval("=IF(1>0,\"yes\",\"no\")"));
        assertEquals(FormulaValue.string("no"), eval("=IF(0,\"yes\",\"no\")"));
        assertEquals(FormulaValue.FALSE, eval("=IF(FALSE,1)"));
        assertEquals(FormulaValue.number(1), eval("=IF(\"true\",1,2)"));
    }

    @Test
    void testIfTreatsBlankAsFalse() {
        assertEquals(FormulaValue.number(2), eval("=IF(A1,1,2)"));
    }

    @Test
    void testIfConditionErrors() {
        assertEquals(CellError.DIV0, eval("=IF(1/0,1,2)").getError());
        assertEquals(CellError.VALUE, eval("=IF(\"maybe\",1,2)").getError());
    }

    @Test
    void testIfEvaluatesBothBranches() {
        // the untaken branch is still evaluated, but its error is not returned
        assertEquals(FormulaValue.number(1), eval("=IF(TRUE,1,1/0)"));
    }

    @Test
    void testAndOrXor() {
        assertEquals(FormulaValue.TRUE, eval("=AND(TRUE,1,{TRUE,2})"));
        assertEquals(FormulaValue.FALSE, eval("=AND(TRUE,0)"));
        assertEquals(FormulaValue.TRUE, eval("=OR(FALSE,0,1)"));
        assertEquals(FormulaValue.FALSE, eval("=OR(FALSE,\"text\")"));
        assertEquals(FormulaValue.TRUE, eval("=XOR(TRUE,FALSE,FALSE)"));
        assertEquals(FormulaValue.FALSE, eval("=XOR(TRUE,TRUE)"));
        assertEquals(CellError.NA, eval("=AND(TRUE,#N/A)").getError());
    }

    @Test
    void testNot() {
        assertEquals(FormulaValue.FALSE, eval("=NOT(TRUE)"));
        assertEquals(FormulaValue.TRUE, eval("=NOT(0)"));
        assertEquals(CellError.VALUE, eval("=NOT(\"x\")").getError());
    }

    @Test
    void testIfErrorAndIfNa() {
        assertEquals(FormulaValue.number(0), eval("=IFERROR(1/0,0)"));
        assertEquals(FormulaValue.number(5), eval("=IFERROR(5,0)"));
        assertEquals(FormulaValue.string("none"), eval("=IFNA(NA(),\"none\")"));
        assertEquals(CellError.DIV0, eval("=IFNA(1/0,\"none\")").getError());
    }

    @Test
    void testTrueAndFalseFunctions() {
        assertEquals(FormulaValue.TRUE, eval("=TRUE()"));
        assertEquals(FormulaValue.FALSE, eval("=FALSE()"));
    }

    @Test
    void testIfs() {
        assertEquals(FormulaValue.string("b"), eval("=IFS(1>2,\"a\",2>1,\"b\")"));
        assertEquals(CellError.NA, eval("=IFS(FALSE,1,FALSE,2)").getError());
        assertEquals(CellError.VALUE, eval("=IFS(TRUE,1,FALSE)").getError());
    }

    @Test
    void testSwitch() {
        assertEquals(FormulaValue.string("two"), eval("=SWITCH(2,1,\"one\",2,\"two\")"));
        assertEquals(FormulaValue.string("A"), eval("=SWITCH(\"a\",\"A\",\"A\",\"other\")"));
        assertEquals(FormulaValue.string("other"), eval("=SWITCH(9,1,\"one\",\"other\")"));
        assertEquals(CellError.NA, eval("=SWITCH(9,1,\"one\")").getError());
    }
}
