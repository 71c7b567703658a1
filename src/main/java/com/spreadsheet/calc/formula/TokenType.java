package com.spreadsheet.calc.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    // function name or defined name
    IDENTIFIER,
    CELL_REF,
    // "Sheet1!" or "'My Sheet'!"
    SHEET_REF,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    PERCENT,
    AMPERSAND,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_EQUAL,
    GREATER_THAN,
    GREATER_EQUAL,
    COLON,
    COMMA,
    SEMICOLON,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    EOF
}
