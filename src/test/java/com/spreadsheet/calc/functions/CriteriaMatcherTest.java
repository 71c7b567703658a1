package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CriteriaMatcherTest {

    private static boolean matches(String criteria, FormulaValue value) {
        return CriteriaMatcher.of(FormulaValue.string(criteria)).matches(value);
    }

    @Test
    void testNumericCriteria() {
        CriteriaMatcher five = CriteriaMatcher.of(FormulaValue.number(5));
        assertTrue(five.matches(FormulaValue.number(5)));
        assertFalse(five.matches(FormulaValue.string("5")));
        assertTrue(matches("5", FormulaValue.number(5)));
        assertTrue(CriteriaMatcher.of(FormulaValue.TRUE).matches(FormulaValue.number(1)));
    }

    @Test
    void testComparisons() {
        assertTrue(matches(">5", FormulaValue.number(6)));
        assertFalse(matches(">5", FormulaValue.number(5)));
        assertTrue(matches(">=5", FormulaValue.number(5)));
        assertTrue(matches("<0", FormulaValue.number(-1)));
        assertTrue(matches("<=0", FormulaValue.number(0)));
        assertTrue(matches("<>0", FormulaValue.number(3)));
        assertTrue(matches("=2.5", FormulaValue.number(2.5)));
        assertFalse(matches(">5", FormulaValue.string("9")));
    }

    @Test
    void testTextCriteria() {
        assertTrue(matches("apple", FormulaValue.string("APPLE")));
        assertTrue(matches("=apple", FormulaValue.string("Apple")));
        assertFalse(matches("<>apple", FormulaValue.string("apple")));
        assertTrue(matches("<>apple", FormulaValue.string("pear")));
    }

    @Test
    void testWildcards() {
        assertTrue(matches("a*", FormulaValue.string("abc")));
        assertTrue(matches("*c", FormulaValue.string("abc")));
        assertTrue(matches("a?c", FormulaValue.string("abc")));
        assertFalse(matches("a?c", FormulaValue.string("abbc")));
        assertTrue(matches("*b*", FormulaValue.string("abc")));
        assertTrue(CriteriaMatcher.wildcardMatch("a*b*c", "aXbYbZc"));
        assertFalse(CriteriaMatcher.wildcardMatch("a*b", "ac"));
    }

    @Test
    void testBlankCriteria() {
        CriteriaMatcher blank = CriteriaMatcher.of(FormulaValue.string(""));
        assertTrue(blank.matches(FormulaValue.EMPTY));
        assertTrue(blank.matches(FormulaValue.string("")));
        assertFalse(blank.matches(FormulaValue.number(0)));
        assertTrue(matches("=", FormulaValue.EMPTY));
    }

    @Test
    void testErrorCriteriaMatchNothing() {
        CriteriaMatcher error = CriteriaMatcher.of(FormulaValue.error(CellError.NA));
        assertFalse(error.matches(FormulaValue.error(CellError.NA)));
        assertFalse(error.matches(FormulaValue.number(0)));
    }
}
