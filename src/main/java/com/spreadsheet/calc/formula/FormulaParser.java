package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidCellAddressException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for formula text.
 * Precedence, lowest to highest:
 * 1) comparison  = <> < <= > >=
 * 2) concatenation  &
 * 3) additive  + -
 * 4) multiplicative  * /
 * 5) exponent  ^ (right-associative)
 * 6) unary prefix - and +, postfix %
 * 7) range  :
 * 8) primary: literals, references, calls, parentheses, arrays
 */
public class FormulaParser {

    static final int MAX_NESTING = 256;

    private final Tokenizer tokenizer;
    private Token current;
    private int depth;

    private FormulaParser(String body) {
        this.tokenizer = new Tokenizer(body);
        this.current = tokenizer.next();
    }

    /**
     * Parses a formula. The text must start with '=' (surrounding whitespace is ignored)
     * and must be consumed completely.
     */
    public static FormulaExpr parse(String formula) {
        if (formula == null) {
            throw new FormulaParseException("Formula is null");
        }
        String trimmed = formula.trim();
        if (!trimmed.startsWith("=")) {
            throw new FormulaParseException("Formula must start with '='");
        }
        FormulaParser parser = new FormulaParser(trimmed.substring(1));
        FormulaExpr expr = parser.parseExpression();
        if (!parser.current.is(TokenType.EOF)) {
            throw new FormulaParseException("Unexpected " + parser.current
                    + " after expression at position " + parser.current.getPosition());
        }
        return expr;
    }

    // ----------------------------------------------------------------
    // Token helpers
    // ----------------------------------------------------------------

    private Token consume() {
        Token token = current;
        current = tokenizer.next();
        return token;
    }

    private void expect(TokenType type) {
        if (!current.is(type)) {
            throw new FormulaParseException("Expected " + type + ", got " + current
                    + " at position " + current.getPosition());
        }
        consume();
    }

    private void enter() {
        if (++depth > MAX_NESTING) {
            throw new FormulaParseException("Formula is nested too deeply");
        }
    }

    private void exit() {
        depth--;
    }

    // ----------------------------------------------------------------
    // Precedence ladder
    // ----------------------------------------------------------------

    private FormulaExpr parseExpression() {
        enter();
        try {
            return parseComparison();
        } finally {
            exit();
        }
    }

    private FormulaExpr parseComparison() {
        FormulaExpr left = parseConcatenation();
        while (true) {
            BinaryOperator op = comparisonOperator(current.getType());
            if (op == null) {
                return left;
            }
            consume();
            left = new BinaryExpr(op, left, parseConcatenation());
        }
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQUAL:
                return BinaryOperator.EQUAL;
            case NOT_EQUAL:
                return BinaryOperator.NOT_EQUAL;
            case LESS_THAN:
                return BinaryOperator.LESS_THAN;
            case LESS_EQUAL:
                return BinaryOperator.LESS_EQUAL;
            case GREATER_THAN:
                return BinaryOperator.GREATER_THAN;
            case GREATER_EQUAL:
                return BinaryOperator.GREATER_EQUAL;
            default:
                return null;
        }
    }

    private FormulaExpr parseConcatenation() {
        FormulaExpr left = parseAdditive();
        while (current.is(TokenType.AMPERSAND)) {
            consume();
            left = new BinaryExpr(BinaryOperator.CONCAT, left, parseAdditive());
        }
        return left;
    }

    private FormulaExpr parseAdditive() {
        FormulaExpr left = parseMultiplicative();
        while (current.is(TokenType.PLUS) || current.is(TokenType.MINUS)) {
            BinaryOperator op = consume().is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new BinaryExpr(op, left, parseMultiplicative());
        }
        return left;
    }

    private FormulaExpr parseMultiplicative() {
        FormulaExpr left = parseExponent();
        while (current.is(TokenType.STAR) || current.is(TokenType.SLASH)) {
            BinaryOperator op = consume().is(TokenType.STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            left = new BinaryExpr(op, left, parseExponent());
        }
        return left;
    }

    // 2^3^2 = 2^(3^2)
    private FormulaExpr parseExponent() {
        FormulaExpr left = parseUnary();
        if (!current.is(TokenType.CARET)) {
            return left;
        }
        consume();
        enter();
        try {
            return new BinaryExpr(BinaryOperator.POWER, left, parseExponent());
        } finally {
            exit();
        }
    }

    private FormulaExpr parseUnary() {
        if (current.is(TokenType.MINUS) || current.is(TokenType.PLUS)) {
            boolean negate = consume().is(TokenType.MINUS);
            enter();
            try {
                FormulaExpr operand = parseUnary();
                return negate ? new UnaryExpr(UnaryOperator.NEGATE, operand) : operand;
            } finally {
                exit();
            }
        }

        FormulaExpr expr = parseRange();
        while (current.is(TokenType.PERCENT)) {
            consume();
            expr = new UnaryExpr(UnaryOperator.PERCENT, expr);
        }
        return expr;
    }

    /**
     * A ':' between two cell references on the same sheet becomes a RangeReference;
     * an unqualified end takes the sheet of a qualified start (Sheet2!A1:B3).
     * Any other operands produce a RANGE binary expression.
     */
    private FormulaExpr parseRange() {
        FormulaExpr left = parsePrimary();
        if (!current.is(TokenType.COLON)) {
            return left;
        }
        consume();
        FormulaExpr right = parsePrimary();

        if (left instanceof CellReference && right instanceof CellReference) {
            CellReference start = (CellReference) left;
            CellReference end = (CellReference) right;
            String sheet = start.getSheet();
            if (end.getSheet() != null && (sheet == null || !sheet.equalsIgnoreCase(end.getSheet()))) {
                throw new FormulaParseException("Range references must be on the same sheet");
            }
            return new RangeReference(sheet, new CellRange(start.getAddress(), end.getAddress()));
        }
        return new BinaryExpr(BinaryOperator.RANGE, left, right);
    }

    private FormulaExpr parsePrimary() {
        Token token = current;
        switch (token.getType()) {
            case NUMBER:
                consume();
                return new NumberLiteral(token.getNumber());
            case STRING:
                consume();
                return new StringLiteral(token.getText());
            case BOOLEAN:
                consume();
                return new BooleanLiteral(token.getBoolean());
            case ERROR:
                consume();
                return new ErrorLiteral(token.getError());
            case LEFT_PAREN: {
                consume();
                FormulaExpr inner = parseExpression();
                expect(TokenType.RIGHT_PAREN);
                return inner;
            }
            case LEFT_BRACE:
                return parseArray();
            case SHEET_REF:
                consume();
                if (!current.is(TokenType.CELL_REF)) {
                    throw new FormulaParseException("Expected cell reference after sheet name '"
                            + token.getText() + "'");
                }
                return cellReference(token.getText(), consume());
            case CELL_REF:
                consume();
                return cellReference(null, token);
            case IDENTIFIER:
                consume();
                if (current.is(TokenType.LEFT_PAREN)) {
                    return parseFunctionCall(token.getText());
                }
                return new NameReference(token.getText());
            default:
                throw new FormulaParseException("Unexpected " + token + " at position " + token.getPosition());
        }
    }

    private FormulaExpr parseArray() {
        expect(TokenType.LEFT_BRACE);
        List<List<FormulaExpr>> rows = new ArrayList<>();
        List<FormulaExpr> row = new ArrayList<>();

        if (!current.is(TokenType.RIGHT_BRACE)) {
            row.add(parseExpression());
            while (!current.is(TokenType.RIGHT_BRACE)) {
                if (current.is(TokenType.COMMA)) {
                    consume();
                    row.add(parseExpression());
                } else if (current.is(TokenType.SEMICOLON)) {
                    consume();
                    rows.add(row);
                    row = new ArrayList<>();
                    row.add(parseExpression());
                } else {
                    throw new FormulaParseException("Expected ',' ';' or '}' in array, got " + current);
                }
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        expect(TokenType.RIGHT_BRACE);
        for (List<FormulaExpr> r : rows) {
            if (r.size() != rows.get(0).size()) {
                throw new FormulaParseException("Array rows must all have the same number of columns");
            }
        }
        return new ArrayLiteral(rows);
    }

    private FormulaExpr parseFunctionCall(String name) {
        expect(TokenType.LEFT_PAREN);
        List<FormulaExpr> args = new ArrayList<>();
        if (!current.is(TokenType.RIGHT_PAREN)) {
            args.add(parseExpression());
            while (current.is(TokenType.COMMA)) {
                consume();
                args.add(parseExpression());
            }
        }
        expect(TokenType.RIGHT_PAREN);
        return new FunctionCall(name.toUpperCase(Locale.ROOT), args);
    }

    private FormulaExpr cellReference(String sheet, Token token) {
        try {
            return new CellReference(sheet, CellAddress.parse(token.getText()));
        } catch (InvalidCellAddressException e) {
            throw new FormulaParseException("Invalid cell reference '" + token.getText() + "': " + e.getMessage());
        }
    }
}
