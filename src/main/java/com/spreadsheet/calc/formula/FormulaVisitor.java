package com.spreadsheet.calc.formula;

/**
 * One method per AST node type.
 */
public interface FormulaVisitor<R> {

    R visitNumber(NumberLiteral expr);

    R visitString(StringLiteral expr);

    R visitBoolean(BooleanLiteral expr);

    R visitError(ErrorLiteral expr);

    R visitCellReference(CellReference expr);

    R visitRangeReference(RangeReference expr);

    R visitNameReference(NameReference expr);

    R visitBinary(BinaryExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitFunctionCall(FunctionCall expr);

    R visitArray(ArrayLiteral expr);
}
