package com.example.grouping.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Coercion of scalar record values to display strings, numbers and dates.
 *
 * <p>All conversions are total: a value that cannot be converted yields an
 * empty optional, never an exception.
 */
public final class Values {

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            LocalDate::parse,
            text -> LocalDateTime.parse(text).toLocalDate(),
            text -> OffsetDateTime.parse(text).toLocalDate(),
            text -> YearMonth.parse(text).atDay(1),
            text -> Year.parse(text).atDay(1)
    );

    private Values() {
    }

    /**
     * Returns whether a value counts as missing: {@code null} or an empty string.
     */
    public static boolean isMissing(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }

    /**
     * Renders a value as a display string.
     *
     * <p>Integral floating-point values lose their trailing {@code .0}
     * ({@code 10.0 -> "10"}), dates render in ISO form. Callers decide how
     * missing values are shown.
     */
    public static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return formatNumber(d);
        }
        if (value instanceof BigDecimal bd) {
            return bd.signum() == 0 ? "0" : bd.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime()).toString();
        }
        return value.toString();
    }

    /**
     * Formats a double without a trailing {@code .0} and without exponent notation.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /**
     * Coerces a value to a finite double.
     *
     * <p>Numbers convert directly; strings are parsed as decimal literals after
     * trimming. Booleans, blank strings, non-finite values and anything else
     * yield an empty result.
     */
    public static OptionalDouble toDouble(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                double d = new BigDecimal(trimmed).doubleValue();
                return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Coerces a value to a calendar date.
     *
     * <p>Accepts {@link LocalDate}, date-times (truncated to their local date),
     * {@link Instant} and {@link Date} (in UTC), and ISO strings of the forms
     * {@code 2024-02-01}, {@code 2024-02-01T10:15:30}, {@code 2024-02-01T10:15:30+01:00},
     * {@code 2024-02} (first of month) and {@code 2024} (first of year).
     */
    public static Optional<LocalDate> toDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof Date date) {
            return Optional.of(Instant.ofEpochMilli(date.getTime()).atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof TemporalAccessor) {
            return Optional.empty();
        }
        if (value instanceof String s) {
            return parseDate(s.trim());
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> parseDate(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(text));
            } catch (DateTimeParseException e) {
                // fall through to the next accepted form
            }
        }
        return Optional.empty();
    }
}
