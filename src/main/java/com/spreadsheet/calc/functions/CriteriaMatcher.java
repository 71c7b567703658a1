package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.formula.NumberText;

import java.util.Locale;

/**
 * Criteria used by SUMIF, COUNTIF, AVERAGEIF and their *IFS variants.
 * A criterion is one of:
 * - a number (or boolean as 1/0): matches numeric cells equal to it
 * - text with a comparison prefix (">5", "<=10", "<>0", "=5"): numeric comparison
 * - "=text" or "<>text": case-insensitive text (in)equality
 * - plain text: case-insensitive match, '*' and '?' as wildcards
 * - empty text or an empty value: matches blank cells
 * Numeric criteria never match text that merely looks like a number.
 */
public final class CriteriaMatcher {

    private static final double EPSILON = 1e-10;

    private enum Kind {
        NUMBER,
        COMPARISON,
        TEXT,
        NOT_TEXT,
        BLANK,
        NONE
    }

    private enum Comparison {
        EQUAL,
        NOT_EQUAL,
        LESS_THAN,
        LESS_EQUAL,
        GREATER_THAN,
        GREATER_EQUAL
    }

    private final Kind kind;
    private final Comparison comparison;
    private final double number;
    private final String pattern;

    private CriteriaMatcher(Kind kind, Comparison comparison, double number, String pattern) {
        this.kind = kind;
        this.comparison = comparison;
        this.number = number;
        this.pattern = pattern;
    }

    public static CriteriaMatcher of(FormulaValue criteria) {
        switch (criteria.getType()) {
            case NUMBER:
                return new CriteriaMatcher(Kind.NUMBER, null, criteria.getNumber(), null);
            case BOOLEAN:
                return new CriteriaMatcher(Kind.NUMBER, null, criteria.getBoolean() ? 1 : 0, null);
            case STRING:
                return fromText(criteria.getString());
            case EMPTY:
                return new CriteriaMatcher(Kind.BLANK, null, 0, null);
            default:
                // errors and arrays match nothing
                return new CriteriaMatcher(Kind.NONE, null, 0, null);
        }
    }

    private static CriteriaMatcher fromText(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) {
            return new CriteriaMatcher(Kind.BLANK, null, 0, null);
        }

        Comparison op = null;
        String rest = s;
        if (s.startsWith(">=")) {
            op = Comparison.GREATER_EQUAL;
            rest = s.substring(2);
        } else if (s.startsWith("<=")) {
            op = Comparison.LESS_EQUAL;
            rest = s.substring(2);
        } else if (s.startsWith("<>")) {
            op = Comparison.NOT_EQUAL;
            rest = s.substring(2);
        } else if (s.startsWith(">")) {
            op = Comparison.GREATER_THAN;
            rest = s.substring(1);
        } else if (s.startsWith("<")) {
            op = Comparison.LESS_THAN;
            rest = s.substring(1);
        } else if (s.startsWith("=")) {
            op = Comparison.EQUAL;
            rest = s.substring(1);
        }

        if (op != null) {
            rest = rest.trim();
            Double n = NumberText.parse(rest);
            if (n != null) {
                return new CriteriaMatcher(Kind.COMPARISON, op, n, null);
            }
            if (op == Comparison.EQUAL) {
                return rest.isEmpty()
                        ? new CriteriaMatcher(Kind.BLANK, null, 0, null)
                        : new CriteriaMatcher(Kind.TEXT, null, 0, rest.toLowerCase(Locale.ROOT));
            }
            if (op == Comparison.NOT_EQUAL) {
                return new CriteriaMatcher(Kind.NOT_TEXT, null, 0, rest.toLowerCase(Locale.ROOT));
            }
            // ">abc" and friends fall through to a literal text match
        }

        Double n = NumberText.parse(s);
        if (n != null) {
            return new CriteriaMatcher(Kind.NUMBER, null, n, null);
        }
        return new CriteriaMatcher(Kind.TEXT, null, 0, s.toLowerCase(Locale.ROOT));
    }

    public boolean matches(FormulaValue value) {
        switch (kind) {
            case NUMBER: {
                Double n = numericCell(value);
                return n != null && Math.abs(n - number) < EPSILON;
            }
            case COMPARISON: {
                Double n = numericCell(value);
                return n != null && compare(n);
            }
            case TEXT:
                return wildcardMatch(pattern, value.asString().toLowerCase(Locale.ROOT));
            case NOT_TEXT:
                return !wildcardMatch(pattern, value.asString().toLowerCase(Locale.ROOT));
            case BLANK:
                return value.isEmpty() || (value.isString() && value.getString().isEmpty());
            default:
                return false;
        }
    }

    private static Double numericCell(FormulaValue value) {
        if (value.isNumber()) {
            return value.getNumber();
        }
        if (value.isBoolean()) {
            return value.getBoolean() ? 1.0 : 0.0;
        }
        return null;
    }

    private boolean compare(double n) {
        switch (comparison) {
            case EQUAL:
                return Math.abs(n - number) < EPSILON;
            case NOT_EQUAL:
                return Math.abs(n - number) >= EPSILON;
            case LESS_THAN:
                return n < number;
            case LESS_EQUAL:
                return n <= number;
            case GREATER_THAN:
                return n > number;
            case GREATER_EQUAL:
                return n >= number;
            default:
                return false;
        }
    }

    /**
     * '*' matches any run of characters, '?' exactly one. Backtracks to the last '*'.
     */
    static boolean wildcardMatch(String pattern, String text) {
        if (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0) {
            return pattern.equals(text);
        }
        int p = 0;
        int t = 0;
        int starP = -1;
        int starT = 0;
        while (t < text.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == text.charAt(t))) {
                p++;
                t++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starP = p;
                starT = t;
                p++;
            } else if (starP >= 0) {
                p = starP + 1;
                starT++;
                t = starT;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }
}
