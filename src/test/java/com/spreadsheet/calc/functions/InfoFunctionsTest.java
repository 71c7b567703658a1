package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InfoFunctionsTest {

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    @Test
    void testTypePredicates() {
        assertEquals(FormulaValue.TRUE, eval("=ISBLANK(A1)"));
        assertEquals(FormulaValue.FALSE, eval("=ISBLANK(\"\")"));
        assertEquals(FormulaValue.TRUE, eval("=ISNUMBER(1.5)"));
        assertEquals(FormulaValue.FALSE, eval("=ISNUMBER(\"1.5\")"));
        assertEquals(FormulaValue.TRUE, eval("=ISTEXT(\"x\")"));
    }

    @Test
    void testErrorPredicatesDoNotPropagate() {
        assertEquals(FormulaValue.TRUE, eval("=ISERROR(1/0)"));
        assertEquals(FormulaValue.FALSE, eval("=ISERROR(1)"));
        assertEquals(FormulaValue.TRUE, eval("=ISNA(NA())"));
        assertEquals(FormulaValue.FALSE, eval("=ISNA(1/0)"));
        assertEquals(CellError.NA, eval("=NA()").getError());
    }

    @Test
    void testArrayArgumentIsValueError() {
        assertEquals(CellError.VALUE, eval("=ISNUMBER({1,2})").getError());
    }
}
