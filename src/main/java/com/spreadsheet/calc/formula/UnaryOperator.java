package com.spreadsheet.calc.formula;

public enum UnaryOperator {
    // prefix -
    NEGATE,
    // postfix %, divides by 100
    PERCENT
}
