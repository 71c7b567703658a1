package com.spreadsheet.calc.formula;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Number to text and text to number conversions shared by the parser,
 * the evaluator and the text functions.
 */
public final class NumberText {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumberText() {
    }

    /**
     * Integral values below 1e15 print without a decimal point ("42", not "42.0");
     * anything else prints in its shortest plain form ("0.1", "1.5").
     */
    public static String format(double n) {
        if (Double.isNaN(n)) {
            return "NaN";
        }
        if (Double.isInfinite(n)) {
            return n > 0 ? "inf" : "-inf";
        }
        if (n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return BigDecimal.valueOf(n).stripTrailingZeros().toPlainString();
    }

    /**
     * Strict decimal parse: optional sign, digits with an optional fraction,
     * optional exponent. No surrounding whitespace, no hex, no "Infinity".
     * Returns null when the text is not a number.
     */
    public static Double parse(String text) {
        if (text == null || !NUMBER.matcher(text).matches()) {
            return null;
        }
        return Double.parseDouble(text);
    }
}
