package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.Evaluator;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextFunctionsTest {

    private static FormulaValue eval(String formula) {
        return Evaluator.evaluate(formula, EvaluationContext.simple());
    }

    private static String text(String formula) {
        FormulaValue value = eval(formula);
        assertTrue(value.isString(), () -> formula + " gave " + value);
        return value.getString();
    }

    @Test
    void testLength() {
        assertEquals(5.0, eval("=LEN(\"hello\")").getNumber());
        assertEquals(0.0, eval("=LEN(\"\")").getNumber());
        assertEquals(2.0, eval("=LEN(42)").getNumber());
        assertEquals(4.0, eval("=LENB(TRUE)").getNumber());
    }

    @Test
    void testLeftRightMid() {
        assertEquals("he", text("=LEFT(\"hello\",2)"));
        assertEquals("h", text("=LEFT(\"hello\")"));
        assertEquals("hello", text("=LEFT(\"hello\",99)"));
        assertEquals("lo", text("=RIGHT(\"hello\",2)"));
        assertEquals("ell", text("=MID(\"hello\",2,3)"));
        assertEquals("", text("=MID(\"hello\",10,3)"));
        assertEquals(CellError.VALUE, eval("=MID(\"hello\",0,3)").getError());
        assertEquals(CellError.VALUE, eval("=LEFT(\"hello\",-1)").getError());
    }

    @Test
    void testCaseAndWhitespace() {
        assertEquals("abc", text("=LOWER(\"AbC\")"));
        assertEquals("ABC", text("=UPPER(\"AbC\")"));
        assertEquals("a b c", text("=TRIM(\"  a   b c  \")"));
        assertEquals("Hello World-Wide", text("=PROPER(\"hELLO wORLD-wide\")"));
        assertEquals("ab", text("=CLEAN(\"a\"&CHAR(9)&\"b\")"));
    }

    @Test
    void testConcat() {
        assertEquals("a1TRUE", text("=CONCAT(\"a\",1,TRUE)"));
        assertEquals("1234", text("=CONCATENATE({1,2;3,4})"));
        assertEquals(CellError.NA, eval("=CONCAT(\"a\",NA())").getError());
    }

    @Test
    void testFindIsCaseSensitive() {
        assertEquals(1.0, eval("=FIND(\"H\",\"Hello\")").getNumber());
        assertEquals(CellError.VALUE, eval("=FIND(\"h\",\"Hello\")").getError());
        assertEquals(4.0, eval("=FIND(\"l\",\"Hello\",4)").getNumber());
        assertEquals(CellError.VALUE, eval("=FIND(\"l\",\"Hello\",9)").getError());
    }

    @Test
    void testSearchIgnoresCase() {
        assertEquals(1.0, eval("=SEARCH(\"h\",\"Hello\")").getNumber());
        assertEquals(3.0, eval("=SEARCH(\"LL\",\"Hello\")").getNumber());
        assertEquals(CellError.VALUE, eval("=SEARCH(\"z\",\"Hello\")").getError());
    }

    @Test
    void testExactAndRept() {
        assertEquals(FormulaValue.FALSE, eval("=EXACT(\"a\",\"A\")"));
        assertEquals(FormulaValue.TRUE, eval("=EXACT(\"1\",1)"));
        assertEquals("ababab", text("=REPT(\"ab\",3)"));
        assertEquals("", text("=REPT(\"ab\",0)"));
        assertEquals(CellError.VALUE, eval("=REPT(\"ab\",-1)").getError());
        assertEquals(CellError.VALUE, eval("=REPT(\"ab\",20000)").getError());
    }

    @Test
    void testReptHugeCounts() {
        assertEquals(CellError.VALUE, eval("=REPT(\"ab\",5E+18)").getError());
        assertEquals(CellError.VALUE, eval("=REPT(\"\",1E+18)").getError());
        assertEquals("", text("=REPT(\"\",100)"));
    }

    @Test
    void testHugeCountsAreClamped() {
        assertEquals("bc", text("=MID(\"abc\",2,1E+300)"));
        assertEquals("", text("=MID(\"abc\",1E+300,1E+300)"));
        assertEquals("abc", text("=LEFT(\"abc\",1E+300)"));
        assertEquals("abc", text("=RIGHT(\"abc\",1E+300)"));
    }

    @Test
    void testSubstitute() {
        assertEquals("a-b-c", text("=SUBSTITUTE(\"a b c\",\" \",\"-\")"));
        assertEquals("a b-c", text("=SUBSTITUTE(\"a b c\",\" \",\"-\",2)"));
        assertEquals("a b c", text("=SUBSTITUTE(\"a b c\",\" \",\"-\",5)"));
        assertEquals("abc", text("=SUBSTITUTE(\"abc\",\"\",\"x\")"));
        assertEquals(CellError.VALUE, eval("=SUBSTITUTE(\"abc\",\"a\",\"x\",0)").getError());
    }

    @Test
    void testCharAndCode() {
        assertEquals("A", text("=CHAR(65)"));
        assertEquals(65.0, eval("=CODE(\"ABC\")").getNumber());
        assertEquals(CellError.VALUE, eval("=CHAR(0)").getError());
        assertEquals(CellError.VALUE, eval("=CODE(\"\")").getError());
    }

    @Test
    void testValueTAndN() {
        assertEquals(12.5, eval("=VALUE(\" 12.5 \")").getNumber());
        assertEquals(CellError.VALUE, eval("=VALUE(\"abc\")").getError());
        assertEquals("x", text("=T(\"x\")"));
        assertEquals("", text("=T(5)"));
        assertEquals(1.0, eval("=N(TRUE)").getNumber());
        assertEquals(0.0, eval("=N(\"7\")").getNumber());
    }
}
