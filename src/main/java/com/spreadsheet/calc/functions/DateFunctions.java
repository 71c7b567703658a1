package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CellError;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.ToIntFunction;

import static com.spreadsheet.calc.functions.ArgumentUtils.truncated;
import static com.spreadsheet.calc.functions.ArgumentUtils.valueError;

/**
 * Date functions over spreadsheet serial numbers.
 *
 * Two epochs, chosen per workbook:
 * - 1900 system: serial 1 is 1900-01-01 and serial 60 is the non-existent 1900-02-29,
 *   so every serial from 61 on is one day ahead of the plain day count.
 * - 1904 system: serial 0 is 1904-01-01, no fictitious day.
 */
public final class DateFunctions {

    private static final LocalDate BASE_1900 = LocalDate.of(1899, 12, 31);
    private static final LocalDate FIRST_REAL_MARCH_1900 = LocalDate.of(1900, 3, 1);
    private static final LocalDate BASE_1904 = LocalDate.of(1904, 1, 1);
    // 9999-12-31 in each system
    private static final long MAX_SERIAL_1900 = 2958465;
    private static final long MAX_SERIAL_1904 = 2957003;

    private DateFunctions() {
    }

    static void register(FunctionTable table) {
        table.add("DATE", 3, 3, DateFunctions::date)
                .add("YEAR", 1, 1, (args, ctx) -> datePart(args, ctx, LocalDate::getYear))
                .add("MONTH", 1, 1, (args, ctx) -> datePart(args, ctx, LocalDate::getMonthValue))
                .add("DAY", 1, 1, DateFunctions::day)
                .addVolatile("NOW", 0, 0, DateFunctions::now)
                .addVolatile("TODAY", 0, 0, DateFunctions::today);
    }

    // ------------------------
    // Serial conversions
    // ------------------------

    /**
     * Serial number of a date in the given epoch.
     */
    static long maxSerial(boolean date1904) {
        return date1904 ? MAX_SERIAL_1904 : MAX_SERIAL_1900;
    }

    public static long toSerial(LocalDate date, boolean date1904) {
        if (date1904) {
            return ChronoUnit.DAYS.between(BASE_1904, date);
        }
        long days = ChronoUnit.DAYS.between(BASE_1900, date);
        return date.isBefore(FIRST_REAL_MARCH_1900) ? days : days + 1;
    }

    /**
     * Date of a serial number, or null when it has none (negative or past year 9999).
     * 1900-02-29 has no LocalDate; serial 60 maps to 1900-02-28 here and is special-cased by DAY.
     */
    public static LocalDate fromSerial(long serial, boolean date1904) {
        if (serial < 0 || serial > maxSerial(date1904)) {
            return null;
        }
        if (date1904) {
            return BASE_1904.plusDays(serial);
        }
        if (serial == 60) {
            return LocalDate.of(1900, 2, 28);
        }
        return BASE_1900.plusDays(serial > 60 ? serial - 1 : serial);
    }

    // ------------------------
    // Functions
    // ------------------------

    /**
     * DATE(year, month, day). Years 0..1899 are offset by 1900. Months outside 1..12
     * roll into neighbouring years and days outside the month roll into neighbouring
     * months. In the 1900 system DATE(1900, 2, 29) is serial 60.
     */
    private static FormulaValue date(List<FormulaValue> args, EvaluationContext ctx) {
        for (FormulaValue v : args) {
            if (v.isError()) {
                return v;
            }
            if (v.isArray()) {
                return valueError();
            }
        }
        Long y = truncated(args.get(0));
        Long m = truncated(args.get(1));
        Long d = truncated(args.get(2));
        long year = y == null ? 0 : y;
        long month = m == null ? 0 : m;
        long day = d == null ? 0 : d;

        if (year >= 0 && year < 1900) {
            year += 1900;
        }
        if (year < 0 || year > 9999) {
            return FormulaValue.error(CellError.NUM);
        }

        long totalMonths = year * 12 + (month - 1);
        int normYear = (int) Math.floorDiv(totalMonths, 12L);
        int normMonth = (int) Math.floorMod(totalMonths, 12L) + 1;
        if (normYear < 0 || normYear > 9999) {
            return FormulaValue.error(CellError.NUM);
        }

        // Counting from the first of the month keeps the fictitious 1900-02-29 in the sequence
        long serial = toSerial(LocalDate.of(normYear, normMonth, 1), ctx.isDate1904()) + day - 1;
        if (serial < 0 || serial > maxSerial(ctx.isDate1904())) {
            return FormulaValue.error(CellError.NUM);
        }
        return FormulaValue.number(serial);
    }

    private static FormulaValue serialArg(List<FormulaValue> args) {
        FormulaValue v = args.get(0);
        if (v.isError()) {
            return v;
        }
        if (v.isArray()) {
            return valueError();
        }
        Double n = v.asNumber();
        return n == null ? valueError() : FormulaValue.number(Math.floor(n));
    }

    private static FormulaValue datePart(List<FormulaValue> args, EvaluationContext ctx, ToIntFunction<LocalDate> part) {
        FormulaValue serial = serialArg(args);
        if (serial.isError()) {
            return serial;
        }
        LocalDate date = fromSerial((long) serial.getNumber(), ctx.isDate1904());
        if (date == null) {
            return FormulaValue.error(CellError.NUM);
        }
        return FormulaValue.number(part.applyAsInt(date));
    }

    private static FormulaValue day(List<FormulaValue> args, EvaluationContext ctx) {
        FormulaValue serial = serialArg(args);
        if (serial.isError()) {
            return serial;
        }
        long s = (long) serial.getNumber();
        if (!ctx.isDate1904() && s == 60) {
            return FormulaValue.number(29);
        }
        return datePart(args, ctx, LocalDate::getDayOfMonth);
    }

    // Date serial plus the time of day as a fraction, at second precision.
    private static FormulaValue now(List<FormulaValue> args, EvaluationContext ctx) {
        LocalDateTime now = LocalDateTime.now();
        double fraction = now.toLocalTime().toSecondOfDay() / 86400.0;
        return FormulaValue.number(toSerial(now.toLocalDate(), ctx.isDate1904()) + fraction);
    }

    private static FormulaValue today(List<FormulaValue> args, EvaluationContext ctx) {
        return FormulaValue.number(toSerial(LocalDate.now(), ctx.isDate1904()));
    }
}
