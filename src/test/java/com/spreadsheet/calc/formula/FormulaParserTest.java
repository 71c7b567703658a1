package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    @Test
    void testPrecedence() {
        assertEquals("(1+(2*3))", FormulaParser.parse("=1+2*3").toString());
        assertEquals("((1+2)*3)", FormulaParser.parse("=(1+2)*3").toString());
        assertEquals("((1+2)=3)", FormulaParser.parse("=1+2=3").toString());
        assertEquals("(\"a\"&(1+2))", FormulaParser.parse("=\"a\"&1+2").toString());
    }

    @Test
    void testExponentIsRightAssociative() {
        assertEquals("(2^(3^2))", FormulaParser.parse("=2^3^2").toString());
    }

    @Test
    void testUnaryMinusBindsTighterThanExponent() {
        FormulaExpr expr = FormulaParser.parse("=-2^2");
        assertTrue(expr instanceof BinaryExpr);
        BinaryExpr power = (BinaryExpr) expr;
        assertEquals(BinaryOperator.POWER, power.getOperator());
        assertEquals(new UnaryExpr(UnaryOperator.NEGATE, new NumberLiteral(2)), power.getLeft());
    }

    @Test
    void testPercentIsPostfix() {
        FormulaExpr expr = FormulaParser.parse("=50%");
        assertEquals(new UnaryExpr(UnaryOperator.PERCENT, new NumberLiteral(50)), expr);
    }

    @Test
    void testCellAndRangeReferences() {
        assertEquals(new CellReference(null, new CellAddress(1, 1)), FormulaParser.parse("=$B$2"));
        assertEquals(new RangeReference(null, CellRange.parse("A1:B3")), FormulaParser.parse("=A1:B3"));
        // an unqualified end takes the start's sheet
        assertEquals(new RangeReference("Data", CellRange.parse("A1:A5")), FormulaParser.parse("=Data!A1:A5"));
        assertEquals(new CellReference("My Sheet", new CellAddress(0, 0)), FormulaParser.parse("='My Sheet'!A1"));
    }

    @Test
    void testRangeAcrossSheetsRejected() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=Sheet1!A1:Sheet2!B2"));
    }

    @Test
    void testFunctionCallNameIsUpperCased() {
        FormulaExpr expr = FormulaParser.parse("=sum(A1:A3, 4)");
        assertTrue(expr instanceof FunctionCall);
        FunctionCall call = (FunctionCall) expr;
        assertEquals("SUM", call.getName());
        assertEquals(2, call.getArguments().size());
        assertEquals(0, ((FunctionCall) FormulaParser.parse("=PI()")).getArguments().size());
    }

    @Test
    void testNameReference() {
        assertEquals(new NameReference("TaxRate"), FormulaParser.parse("=TaxRate"));
    }

    @Test
    void testArrayLiteral() {
        FormulaExpr expr = FormulaParser.parse("={1,2;3,4}");
        assertTrue(expr instanceof ArrayLiteral);
        ArrayLiteral array = (ArrayLiteral) expr;
        assertEquals(2, array.getRows().size());
        assertEquals(new NumberLiteral(4), array.getRows().get(1).get(1));
    }

    @Test
    void testRaggedArrayRejected() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("={1,2;3}"));
    }

    @Test
    void testMissingEqualsSign() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("1+2"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse(null));
    }

    @Test
    void testTrailingInputRejected() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=1 2"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=(1+2"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=SUM(1,2"));
    }

    @Test
    void testNestingLimit() {
        StringBuilder ok = new StringBuilder("=");
        StringBuilder tooDeep = new StringBuilder("=");
        for (int i = 0; i < 100; i++) {
            ok.append('(');
        }
        ok.append('1');
        for (int i = 0; i < 100; i++) {
            ok.append(')');
        }
        for (int i = 0; i < 300; i++) {
            tooDeep.append('(');
        }
        tooDeep.append('1');
        for (int i = 0; i < 300; i++) {
            tooDeep.append(')');
        }
        assertEquals(new NumberLiteral(1), FormulaParser.parse(ok.toString()));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse(tooDeep.toString()));
    }

    @Test
    void testInvalidReference() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=XFE1"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=A0"));
    }
}
