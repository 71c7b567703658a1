package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellError;

/**
 * A lexical token. text holds the source lexeme for identifiers, cell references
 * and sheet names (unquoted), and the unescaped content for strings.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final double number;
    private final boolean bool;
    private final CellError error;
    private final int position;

    private Token(TokenType type, String text, double number, boolean bool, CellError error, int position) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.bool = bool;
        this.error = error;
        this.position = position;
    }

    static Token simple(TokenType type, String text, int position) {
        return new Token(type, text, 0, false, null, position);
    }

    static Token number(double value, String text, int position) {
        return new Token(TokenType.NUMBER, text, value, false, null, position);
    }

    static Token bool(boolean value, String text, int position) {
        return new Token(TokenType.BOOLEAN, text, 0, value, null, position);
    }

    static Token error(CellError value, String text, int position) {
        return new Token(TokenType.ERROR, text, 0, false, value, position);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public double getNumber() {
        return number;
    }

    public boolean getBoolean() {
        return bool;
    }

    public CellError getError() {
        return error;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of formula" : type + "(" + text + ")";
    }
}
