package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest {

    private static final double DELTA = 1e-9;

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    private static double number(String formula) {
        FormulaValue value = eval(formula);
        assertTrue(value.isNumber(), () -> formula + " gave " + value);
        return value.getNumber();
    }

    private static CellError error(String formula) {
        return eval(formula).getError();
    }

    @Test
    void testAggregates() {
        assertEquals(10.0, number("=SUM(1,2,3,4)"));
        assertEquals(10.0, number("=SUM({1,2;3,4})"));
        assertEquals(2.5, number("=AVERAGE({1,2,3,4})"));
        assertEquals(-1.0, number("=MIN(3,-1,2)"));
        assertEquals(3.0, number("=MAX(3,-1,2)"));
        assertEquals(2.0, number("=COUNT(1,\"a\",TRUE,2)"));
    }

    @Test
    void testAggregatesSkipNonNumbersInArrays() {
        assertEquals(3.0, number("=SUM({1,\"x\",TRUE,2})"));
        assertEquals(0.0, number("=MIN({\"a\",\"b\"})"));
        assertEquals(0.0, number("=MAX({\"a\"})"));
        assertEquals(CellError.DIV0, error("=AVERAGE({\"a\"})"));
    }

    @Test
    void testAggregatesPropagateErrors() {
        assertEquals(CellError.NA, error("=SUM(1,#N/A)"));
        assertEquals(CellError.DIV0, error("=MAX({1,#DIV/0!})"));
        // COUNT ignores errors
        assertEquals(1.0, number("=COUNT(1,#N/A)"));
    }

    @Test
    void testRoundHalfAwayFromZero() {
        assertEquals(3.0, number("=ROUND(2.5,0)"));
        assertEquals(-3.0, number("=ROUND(-2.5,0)"));
        assertEquals(2.68, number("=ROUND(2.675,2)"), DELTA);
        assertEquals(1300.0, number("=ROUND(1250,-2)"));
        assertEquals(3.0, number("=ROUND(3.2)"));
    }

    @Test
    void testRoundUpAndDown() {
        assertEquals(3.2, number("=ROUNDUP(3.14159,1)"), DELTA);
        assertEquals(-3.2, number("=ROUNDUP(-3.14159,1)"), DELTA);
        assertEquals(3.1, number("=ROUNDDOWN(3.19,1)"), DELTA);
        assertEquals(-8.0, number("=TRUNC(-8.9)"));
        assertEquals(-9.0, number("=INT(-8.9)"));
    }

    @Test
    void testModTakesSignOfDivisor() {
        assertEquals(1.0, number("=MOD(3,2)"));
        assertEquals(1.0, number("=MOD(-3,2)"));
        assertEquals(-1.0, number("=MOD(3,-2)"));
        assertEquals(-1.0, number("=MOD(-3,-2)"));
        assertEquals(CellError.DIV0, error("=MOD(1,0)"));
    }

    @Test
    void testStrictNumericArguments() {
        assertEquals(CellError.VALUE, error("=ABS(\"5\")"));
        assertEquals(CellError.VALUE, error("=ROUND(\"x\",1)"));
        assertEquals(5.0, number("=ABS(-5)"));
        // blank reads as zero
        assertEquals(0.0, number("=ABS(A1)"));
    }

    @Test
    void testPowersAndLogs() {
        assertEquals(3.0, number("=SQRT(9)"));
        assertEquals(CellError.NUM, error("=SQRT(-1)"));
        assertEquals(1024.0, number("=POWER(2,10)"));
        assertEquals(CellError.NUM, error("=POWER(-1,0.5)"));
        assertEquals(2.0, number("=LOG(100)"), DELTA);
        assertEquals(3.0, number("=LOG(8,2)"), DELTA);
        assertEquals(3.0, number("=LOG10(1000)"), DELTA);
        assertEquals(1.0, number("=LN(EXP(1))"), DELTA);
        assertEquals(CellError.NUM, error("=LN(0)"));
        assertEquals(CellError.NUM, error("=LOG10(A1)"));
        assertEquals(CellError.NUM, error("=LOG(10,1)"));
        assertEquals(CellError.NUM, error("=EXP(1000)"));
    }

    @Test
    void testTrigonometry() {
        assertEquals(Math.PI, number("=PI()"), DELTA);
        assertEquals(1.0, number("=SIN(PI()/2)"), DELTA);
        assertEquals(180.0, number("=DEGREES(PI())"), DELTA);
        assertEquals(Math.PI / 4, number("=ATAN2(1,1)"), DELTA);
        assertEquals(CellError.DIV0, error("=ATAN2(0,0)"));
        assertEquals(CellError.NUM, error("=ASIN(2)"));
        assertEquals(-1.0, number("=SIGN(-7)"));
    }

    @Test
    void testCeilingAndFloorMath() {
        assertEquals(5.0, number("=CEILING.MATH(4.3)"));
        assertEquals(-4.0, number("=CEILING.MATH(-4.3)"));
        assertEquals(-5.0, number("=CEILING.MATH(-4.3,1,1)"));
        assertEquals(8.0, number("=CEILING.MATH(6.7,2)"));
        assertEquals(4.0, number("=FLOOR.MATH(4.7)"));
        assertEquals(-5.0, number("=FLOOR.MATH(-4.7)"));
        assertEquals(-4.0, number("=FLOOR.MATH(-4.7,1,1)"));
        assertEquals(6.0, number("=FLOOR.MATH(7.3,2)"));
        assertEquals(0.0, number("=FLOOR.MATH(7.3,0)"));
    }

    @Test
    void testOddAndEven() {
        assertEquals(3.0, number("=ODD(1.5)"));
        assertEquals(3.0, number("=ODD(2)"));
        assertEquals(-3.0, number("=ODD(-1.5)"));
        assertEquals(1.0, number("=ODD(0)"));
        assertEquals(2.0, number("=EVEN(1.5)"));
        assertEquals(4.0, number("=EVEN(3)"));
        assertEquals(-2.0, number("=EVEN(-1.5)"));
    }

    @Test
    void testRandom() {
        for (int i = 0; i < 20; i++) {
            double r = number("=RAND()");
            assertTrue(r >= 0 && r < 1);
            double b = number("=RANDBETWEEN(1,3)");
            assertTrue(b == 1 || b == 2 || b == 3);
        }
        assertEquals(CellError.NUM, error("=RANDBETWEEN(5,1)"));
    }

    @Test
    void testSumIf() {
        assertEquals(7.0, number("=SUMIF({1,2,3,4},\">2\")"));
        assertEquals(4.0, number("=SUMIF({\"a\",\"b\",\"a\"},\"a\",{1,2,3})"));
        assertEquals(5.0, number("=SUMIF({\"apple\",\"pear\",\"apricot\"},\"ap*\",{2,4,3})"));
        assertEquals(0.0, number("=SUMIF({1,2},\">5\")"));
    }

    @Test
    void testSumIfs() {
        assertEquals(3.0, number("=SUMIFS({1,2,3},{\"x\",\"y\",\"x\"},\"x\",{1,1,5},\">2\")"));
        assertEquals(4.0, number("=SUMIFS({1,2,3},{\"x\",\"y\",\"x\"},\"x\")"));
        assertEquals(CellError.VALUE, error("=SUMIFS({1,2,3},{\"x\",\"y\"},\"x\")"));
        assertEquals(CellError.VALUE, error("=SUMIFS({1,2,3},{\"x\",\"y\",\"x\"},\"x\",{1,1,1})"));
    }

    @Test
    void testSumProduct() {
        assertEquals(70.0, number("=SUMPRODUCT({1,2;3,4},{5,6;7,8})"));
        assertEquals(10.0, number("=SUMPRODUCT({1,2;3,4})"));
        assertEquals(CellError.VALUE, error("=SUMPRODUCT({1,2},{1,2,3})"));
    }
}
