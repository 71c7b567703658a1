package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.models.CellError;

import java.util.Locale;

/**
 * Single-lookahead lexer over formula text (without the leading '=').
 * Tokens are produced one at a time by {@link #next()}; whitespace between
 * tokens is skipped.
 */
public class Tokenizer {

    private final String input;
    private int pos;

    public Tokenizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Scans the next token, returning EOF once the input is exhausted.
     */
    public Token next() {
        skipWhitespace();
        if (isAtEnd()) {
            return Token.simple(TokenType.EOF, "", pos);
        }

        int start = pos;
        char c = peek();

        switch (c) {
            case '+':
                return single(TokenType.PLUS);
            case '-':
                return single(TokenType.MINUS);
            case '*':
                return single(TokenType.STAR);
            case '/':
                return single(TokenType.SLASH);
            case '^':
                return single(TokenType.CARET);
            case '%':
                return single(TokenType.PERCENT);
            case '&':
                return single(TokenType.AMPERSAND);
            case ':':
                return single(TokenType.COLON);
            case ',':
                return single(TokenType.COMMA);
            case ';':
                return single(TokenType.SEMICOLON);
            case '(':
                return single(TokenType.LEFT_PAREN);
            case ')':
                return single(TokenType.RIGHT_PAREN);
            case '{':
                return single(TokenType.LEFT_BRACE);
            case '}':
                return single(TokenType.RIGHT_BRACE);
            case '=':
                return single(TokenType.EQUAL);
            case '<':
                pos++;
                if (peekIs('=')) {
                    pos++;
                    return Token.simple(TokenType.LESS_EQUAL, "<=", start);
                }
                if (peekIs('>')) {
                    pos++;
                    return Token.simple(TokenType.NOT_EQUAL, "<>", start);
                }
                return Token.simple(TokenType.LESS_THAN, "<", start);
            case '>':
                pos++;
                if (peekIs('=')) {
                    pos++;
                    return Token.simple(TokenType.GREATER_EQUAL, ">=", start);
                }
                return Token.simple(TokenType.GREATER_THAN, ">", start);
            case '"':
                return scanString();
            case '\'':
                return scanQuotedSheet();
            case '#':
                return scanError();
            default:
                break;
        }

        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            return scanNumber();
        }
        if (isAsciiLetter(c) || c == '_' || c == '$') {
            return scanIdentifierOrReference();
        }
        throw new FormulaParseException("Unexpected character '" + c + "' at position " + start);
    }

    private Token single(TokenType type) {
        int start = pos;
        pos++;
        return Token.simple(type, input.substring(start, pos), start);
    }

    // "" inside a string is an escaped quote
    private Token scanString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"') {
                if (peekAt(1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return Token.simple(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated string starting at position " + start);
    }

    // 'My Sheet'! with '' as an escaped quote
    private Token scanQuotedSheet() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'') {
                if (peekAt(1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                if (!peekIs('!')) {
                    throw new FormulaParseException("Expected '!' after quoted sheet name at position " + pos);
                }
                pos++;
                return Token.simple(TokenType.SHEET_REF, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated sheet name starting at position " + start);
    }

    private Token scanNumber() {
        int start = pos;
        while (isDigit(peek())) {
            pos++;
        }
        if (peekIs('.')) {
            pos++;
            while (isDigit(peek())) {
                pos++;
            }
        }
        if (peekIs('e') || peekIs('E')) {
            pos++;
            if (peekIs('+') || peekIs('-')) {
                pos++;
            }
            int digitsStart = pos;
            while (isDigit(peek())) {
                pos++;
            }
            if (pos == digitsStart) {
                throw new FormulaParseException("Malformed exponent in number at position " + start);
            }
        }
        String text = input.substring(start, pos);
        return Token.number(Double.parseDouble(text), text, start);
    }

    // Error literals come from a closed list; an unknown #name is an identifier
    private Token scanError() {
        int start = pos;
        pos++;
        while (!isAtEnd()) {
            char c = peek();
            if (isAsciiLetter(c) || isDigit(c) || c == '!' || c == '/' || c == '?' || c == '_') {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        CellError error = CellError.fromText(text);
        if (error != null) {
            return Token.error(error, text, start);
        }
        return Token.simple(TokenType.IDENTIFIER, text, start);
    }

    private Token scanIdentifierOrReference() {
        int start = pos;
        while (!isAtEnd()) {
            char c = peek();
            if (isAsciiLetter(c) || isDigit(c) || c == '_' || c == '$' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);

        if (peekIs('!')) {
            pos++;
            return Token.simple(TokenType.SHEET_REF, text, start);
        }

        // TRUE( and FALSE( are function calls
        boolean callFollows = peekIs('(');
        String upper = text.toUpperCase(Locale.ROOT);
        if (!callFollows && upper.equals("TRUE")) {
            return Token.bool(true, text, start);
        }
        if (!callFollows && upper.equals("FALSE")) {
            return Token.bool(false, text, start);
        }
        // LOG10( is a function call, not a reference to column LOG row 10
        if (!callFollows && isCellReference(text)) {
            return Token.simple(TokenType.CELL_REF, text, start);
        }
        return Token.simple(TokenType.IDENTIFIER, text, start);
    }

    /**
     * Optional '$', letters, optional '$', digits, and nothing else.
     */
    static boolean isCellReference(String text) {
        int i = 0;
        int n = text.length();
        if (i < n && text.charAt(i) == '$') {
            i++;
        }
        int lettersStart = i;
        while (i < n && isAsciiLetter(text.charAt(i))) {
            i++;
        }
        if (i == lettersStart) {
            return false;
        }
        if (i < n && text.charAt(i) == '$') {
            i++;
        }
        int digitsStart = i;
        while (i < n && isDigit(text.charAt(i))) {
            i++;
        }
        return i > digitsStart && i == n;
    }

    // ----------------------------------------------------------------
    // Character helpers
    // ----------------------------------------------------------------

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private boolean peekIs(char c) {
        return !isAtEnd() && peek() == c;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
