package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.formula.NumberText;

import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

import static com.spreadsheet.calc.functions.ArgumentUtils.arg;
import static com.spreadsheet.calc.functions.ArgumentUtils.firstError;
import static com.spreadsheet.calc.functions.ArgumentUtils.truncated;
import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * Text functions. Lengths and positions count Unicode code points, 1-based.
 * The byte-oriented variants (LENB, LEFTB, ...) behave like their character
 * counterparts, as for single-byte text.
 */
final class TextFunctions {

    private static final int MAX_TEXT_LENGTH = 32767;

    private TextFunctions() {
    }

    static void register(FunctionTable table) {
        table.add("LEN", 1, 1, TextFunctions::len)
                .add("LENB", 1, 1, TextFunctions::len)
                .add("LEFT", 1, 2, TextFunctions::left)
                .add("LEFTB", 1, 2, TextFunctions::left)
                .add("RIGHT", 1, 2, TextFunctions::right)
                .add("RIGHTB", 1, 2, TextFunctions::right)
                .add("MID", 3, 3, TextFunctions::mid)
                .add("MIDB", 3, 3, TextFunctions::mid)
                .add("LOWER", 1, 1, (args, ctx) -> mapText(args.get(0), s -> s.toLowerCase(Locale.ROOT)))
                .add("UPPER", 1, 1, (args, ctx) -> mapText(args.get(0), s -> s.toUpperCase(Locale.ROOT)))
                .add("TRIM", 1, 1, (args, ctx) -> mapText(args.get(0), TextFunctions::collapseSpaces))
                .add("PROPER", 1, 1, (args, ctx) -> mapText(args.get(0), TextFunctions::proper))
                .add("CLEAN", 1, 1, (args, ctx) -> mapText(args.get(0), TextFunctions::clean))
                .addVariadic("CONCAT", 1, TextFunctions::concat)
                .addVariadic("CONCATENATE", 1, TextFunctions::concat)
                .add("FIND", 2, 3, (args, ctx) -> find(args, true))
                .add("FINDB", 2, 3, (args, ctx) -> find(args, true))
                .add("SEARCH", 2, 3, (args, ctx) -> find(args, false))
                .add("SEARCHB", 2, 3, (args, ctx) -> find(args, false))
                .add("EXACT", 2, 2, TextFunctions::exact)
                .add("REPT", 2, 2, TextFunctions::rept)
                .add("SUBSTITUTE", 3, 4, TextFunctions::substitute)
                .add("CHAR", 1, 1, TextFunctions::charFunction)
                .add("CODE", 1, 1, TextFunctions::code)
                .add("VALUE", 1, 1, TextFunctions::value)
                .add("T", 1, 1, TextFunctions::t)
                .add("N", 1, 1, TextFunctions::n);
    }

    private static FormulaValue mapText(FormulaValue v, UnaryOperator<String> mapper) {
        if (v.isError()) {
            return v;
        }
        if (v.isArray()) {
            return valueError();
        }
        return FormulaValue.string(mapper.apply(v.asString()));
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    // Substring by code point positions, clamped to the text.
    private static String slice(String s, long start, long count) {
        int len = length(s);
        int from = (int) Math.min(Math.max(start, 0), len);
        int to = from + (int) Math.min(Math.max(count, 0), len - from);
        return s.substring(s.offsetByCodePoints(0, from), s.offsetByCodePoints(0, to));
    }

    private static FormulaValue len(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (v.isArray()) {
            return valueError();
        }
        return FormulaValue.number(length(v.asString()));
    }

    // Character count argument: defaults to 1, negative is #VALUE!.
    private static FormulaValue countArg(List<FormulaValue> args, int index) {
        FormulaValue v = arg(args, index);
        if (v == null) {
            return FormulaValue.number(1);
        }
        if (v.isError()) {
            return v;
        }
        Long n = truncated(v);
        long count = n == null ? 0 : n;
        return count < 0 ? valueError() : FormulaValue.number(count);
    }

    private static FormulaValue left(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue text = args.get(0);
        if (text.isError()) {
            return text;
        }
        if (text.isArray()) {
            return valueError();
        }
        FormulaValue count = countArg(args, 1);
        if (count.isError()) {
            return count;
        }
        return FormulaValue.string(slice(text.asString(), 0, (long) count.getNumber()));
    }

    private static FormulaValue right(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue text = args.get(0);
        if (text.isError()) {
            return text;
        }
        if (text.isArray()) {
            return valueError();
        }
        FormulaValue count = countArg(args, 1);
        if (count.isError()) {
            return count;
        }
        String s = text.asString();
        long n = (long) count.getNumber();
        return FormulaValue.string(slice(s, length(s) - n, n));
    }

    private static FormulaValue mid(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue error = firstError(args);
        if (error != null) {
            return error;
        }
        FormulaValue text = args.get(0);
        if (text.isArray()) {
            return valueError();
        }
        Long start = truncated(args.get(1));
        Long count = truncated(args.get(2));
        long s = start == null ? 0 : start;
        long c = count == null ? 0 : count;
        if (s < 1 || c < 0) {
            return valueError();
        }
        return FormulaValue.string(slice(text.asString(), s - 1, c));
    }

    private static String collapseSpaces(String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? "" : String.join(" ", trimmed.split("\\s+"));
    }

    // First letter of every word upper case, the rest lower case.
    private static String proper(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean capitalizeNext = true;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            if (!Character.isLetterOrDigit(cp)) {
                sb.appendCodePoint(cp);
                capitalizeNext = true;
            } else if (capitalizeNext) {
                sb.appendCodePoint(Character.toUpperCase(cp));
                capitalizeNext = false;
            } else {
                sb.appendCodePoint(Character.toLowerCase(cp));
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    // Drops control characters below 32.
    private static String clean(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 32) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static FormulaValue concat(List<FormulaValue> args, EvaluationContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (FormulaValue arg : args) {
            for (FormulaValue v : ArgumentUtils.flatten(arg)) {
                if (v.isError()) {
                    return v;
                }
                sb.append(v.asString());
            }
        }
        return FormulaValue.string(sb.toString());
    }

    /**
     * FIND (case-sensitive) and SEARCH (case-insensitive). The start position defaults to 1
     * and must lie within the searched text; no match is #VALUE!.
     */
    private static FormulaValue find(List<FormulaValue> args, boolean caseSensitive) {
        FormulaValue needleArg = args.get(0);
        FormulaValue haystackArg = args.get(1);
        if (needleArg.isError()) {
            return needleArg;
        }
        if (haystackArg.isError()) {
            return haystackArg;
        }
        FormulaValue start = ArgumentUtils.number(args, 2, 1);
        if (start.isError()) {
            return start;
        }
        String needle = needleArg.asString();
        String haystack = haystackArg.asString();
        long from = (long) start.getNumber();
        int len = length(haystack);
        if (from < 1 || from > len) {
            return valueError();
        }
        if (!caseSensitive) {
            needle = needle.toLowerCase(Locale.ROOT);
            haystack = haystack.toLowerCase(Locale.ROOT);
        }
        int offset = haystack.offsetByCodePoints(0, (int) from - 1);
        int found = haystack.indexOf(needle, offset);
        if (found < 0) {
            return valueError();
        }
        return FormulaValue.number(haystack.codePointCount(0, found) + 1);
    }

    private static FormulaValue exact(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue error = firstError(args);
        if (error != null) {
            return error;
        }
        return FormulaValue.bool(args.get(0).asString().equals(args.get(1).asString()));
    }

    private static FormulaValue rept(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue text = args.get(0);
        if (text.isError()) {
            return text;
        }
        FormulaValue times = ArgumentUtils.number(args, 1, 0);
        if (times.isError()) {
            return times;
        }
        if (times.getNumber() < 0) {
            return valueError();
        }
        String s = text.asString();
        long n = (long) times.getNumber();
        if (n > MAX_TEXT_LENGTH || (s.length() > 0 && n > MAX_TEXT_LENGTH / s.length())) {
            return valueError();
        }
        if (s.isEmpty()) {
            return FormulaValue.string("");
        }
        StringBuilder sb = new StringBuilder();
        for (long i = 0; i < n; i++) {
            sb.append(s);
        }
        return FormulaValue.string(sb.toString());
    }

    /**
     * SUBSTITUTE(text, old, new, [instance]): replaces every occurrence, or only the
     * n-th one when instance is given. An empty old text leaves the text unchanged.
     */
    private static FormulaValue substitute(List<FormulaValue> args, EvaluationContext ctx) {
        for (int i = 0; i < 3; i++) {
            if (args.get(i).isError()) {
                return args.get(i);
            }
        }
        String text = args.get(0).asString();
        String oldText = args.get(1).asString();
        String newText = args.get(2).asString();

        FormulaValue instanceArg = arg(args, 3);
        Long instance = null;
        if (instanceArg != null && !instanceArg.isEmpty()) {
            if (instanceArg.isError()) {
                return instanceArg;
            }
            if (!instanceArg.isNumber() || instanceArg.getNumber() < 1) {
                return valueError();
            }
            instance = (long) instanceArg.getNumber();
        }

        if (oldText.isEmpty()) {
            return FormulaValue.string(text);
        }
        if (instance == null) {
            return FormulaValue.string(text.replace(oldText, newText));
        }
        int pos = -1;
        for (long occurrence = 0; occurrence < instance; occurrence++) {
            pos = text.indexOf(oldText, pos < 0 ? 0 : pos + oldText.length());
            if (pos < 0) {
                return FormulaValue.string(text);
            }
        }
        return FormulaValue.string(text.substring(0, pos) + newText + text.substring(pos + oldText.length()));
    }

    private static FormulaValue charFunction(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (!v.isNumber()) {
            return valueError();
        }
        long cp = (long) v.getNumber();
        if (cp < 1 || !Character.isValidCodePoint((int) Math.min(cp, Integer.MAX_VALUE))
                || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            return valueError();
        }
        return FormulaValue.string(new String(Character.toChars((int) cp)));
    }

    private static FormulaValue code(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        String s = v.asString();
        if (s.isEmpty()) {
            return valueError();
        }
        return FormulaValue.number(s.codePointAt(0));
    }

    private static FormulaValue value(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isNumber() || v.isError()) {
            return v;
        }
        Double n = NumberText.parse(v.asString().trim());
        return n == null ? valueError() : FormulaValue.number(n);
    }

    private static FormulaValue t(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isString() || v.isError()) {
            return v;
        }
        return FormulaValue.string("");
    }

    private static FormulaValue n(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue v = args.get(0);
        if (v.isNumber() || v.isError()) {
            return v;
        }
        if (v.isBoolean()) {
            return FormulaValue.number(v.getBoolean() ? 1 : 0);
        }
        return FormulaValue.number(0);
    }
}
