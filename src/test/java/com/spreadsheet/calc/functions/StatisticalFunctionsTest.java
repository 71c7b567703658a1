package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalFunctionsTest {

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    private static double number(String formula) {
        FormulaValue value = eval(formula);
        assertTrue(value.isNumber(), () -> formula + " gave " + value);
        return value.getNumber();
    }

    @Test
    void testCountAAndCountBlank() {
        assertEquals(4.0, number("=COUNTA({1,\"a\",TRUE,#N/A,\"\"})"));
        assertEquals(1.0, number("=COUNTBLANK({1,\"\",\"x\"})"));
        // a blank cell reference
        assertEquals(1.0, number("=COUNTBLANK(A1)"));
    }

    @Test
    void testCountIf() {
        assertEquals(2.0, number("=COUNTIF({1,5,10},\">=5\")"));
        assertEquals(2.0, number("=COUNTIF({\"Apple\",\"apple\",\"pear\"},\"APPLE\")"));
        assertEquals(1.0, number("=COUNTIF({\"cat\",\"cart\",\"dog\"},\"c?t\")"));
        assertEquals(2.0, number("=COUNTIF({\"cat\",\"cart\",\"dog\"},\"<>dog\")"));
        assertEquals(1.0, number("=COUNTIF({1,2,3},2)"));
    }

    @Test
    void testNumericCriteriaIgnoreNumericText() {
        assertEquals(1.0, number("=COUNTIF({5,\"5\"},5)"));
        assertEquals(1.0, number("=COUNTIF({5,\"5\"},\">4\")"));
    }

    @Test
    void testAverageIf() {
        assertEquals(7.5, number("=AVERAGEIF({1,5,10},\">=5\")"));
        assertEquals(25.0, number("=AVERAGEIF({\"a\",\"b\",\"a\"},\"a\",{20,40,30})"));
        assertEquals(CellError.DIV0, eval("=AVERAGEIF({1,2},\">5\")").getError());
    }

    @Test
    void testMedian() {
        assertEquals(2.0, number("=MEDIAN(3,1,2)"));
        assertEquals(2.5, number("=MEDIAN({4,1,3,2})"));
        assertEquals(CellError.NUM, eval("=MEDIAN({\"a\"})").getError());
    }

    @Test
    void testLargeAndSmall() {
        assertEquals(9.0, number("=LARGE({3,9,4,7},1)"));
        assertEquals(7.0, number("=LARGE({3,9,4,7},2)"));
        assertEquals(3.0, number("=SMALL({3,9,4,7},1)"));
        // fractional k: LARGE rounds up, SMALL rounds down
        assertEquals(7.0, number("=LARGE({3,9,4,7},1.2)"));
        assertEquals(3.0, number("=SMALL({3,9,4,7},1.8)"));
        assertEquals(CellError.NUM, eval("=LARGE({3,9},3)").getError());
        assertEquals(CellError.NUM, eval("=SMALL({3,9},0)").getError());
        assertEquals(CellError.VALUE, eval("=SMALL({3,9},\"1\")").getError());
    }

    @Test
    void testCountIfs() {
        assertEquals(1.0, number("=COUNTIFS({\"x\",\"y\",\"x\"},\"x\",{1,2,3},\">2\")"));
        assertEquals(2.0, number("=COUNTIFS({\"x\",\"y\",\"x\"},\"x\")"));
        assertEquals(CellError.VALUE, eval("=COUNTIFS({\"x\",\"y\"},\"x\",{1,2,3},\">2\")").getError());
        assertEquals(CellError.VALUE, eval("=COUNTIFS({\"x\",\"y\"},\"x\",{1,2})").getError());
    }

    @Test
    void testAverageIfs() {
        assertEquals(20.0, number("=AVERAGEIFS({10,20,30},{\"a\",\"b\",\"a\"},\"a\")"));
        assertEquals(30.0, number("=AVERAGEIFS({10,20,30},{\"a\",\"b\",\"a\"},\"a\",{1,1,2},2)"));
        assertEquals(CellError.DIV0, eval("=AVERAGEIFS({10,20},{\"a\",\"b\"},\"z\")").getError());
        assertEquals(CellError.VALUE, eval("=AVERAGEIFS({10,20},{\"a\",\"b\"},\"a\",{1,2})").getError());
    }
}
