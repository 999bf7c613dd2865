package com.example.grouping.hierarchy;

import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupKeys;
import com.example.grouping.model.GroupingFunction;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.TimePeriod;
import com.example.grouping.model.Values;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Composite keys of the built-in grouping methods.
 *
 * <p>Every function is total: a missing value becomes {@code N/A}, a value the
 * method cannot read goes to {@code Other} (numeric range) or {@code Unparsed}
 * (time period). When every field of the level is missing the whole key is
 * {@code N/A}.
 */
final class GroupKeyFunctions {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private GroupKeyFunctions() {
    }

    static String key(DataRecord record, GroupingLevel level) {
        return switch (level.method()) {
            case BY_FIELD -> byField(record, level);
            case MULTI_FIELD_COMPOSITE -> composite(record, level);
            case NUMERIC_RANGE -> perField(record, level, value -> rangeBucket(value, level.function()));
            case TIME_PERIOD -> perField(record, level, value -> period(value, level.function().unit()));
            case CUSTOM -> throw new IllegalArgumentException(
                    "Custom grouping on level " + level.level() + " is not key based");
        };
    }

    private static String byField(DataRecord record, GroupingLevel level) {
        List<String> parts = new ArrayList<>(level.fields().size());
        for (String field : level.fields()) {
            parts.add(GroupKeys.part(record.get(field)));
        }
        return GroupKeys.join(parts, level.separator());
    }

    private static String composite(DataRecord record, GroupingLevel level) {
        if (level.template() == null || level.template().isEmpty()) {
            return byField(record, level);
        }
        if (level.fields().stream().allMatch(field -> Values.isMissing(record.get(field)))) {
            return GroupKeys.MISSING;
        }
        Matcher matcher = PLACEHOLDER.matcher(level.template());
        StringBuilder key = new StringBuilder();
        while (matcher.find()) {
            String part = GroupKeys.part(record.get(matcher.group(1).trim()));
            matcher.appendReplacement(key, Matcher.quoteReplacement(part));
        }
        matcher.appendTail(key);
        return key.toString();
    }

    private static String perField(DataRecord record, GroupingLevel level, Function<Object, String> partFunction) {
        List<String> parts = new ArrayList<>(level.fields().size());
        for (String field : level.fields()) {
            Object value = record.get(field);
            parts.add(Values.isMissing(value) ? GroupKeys.MISSING : partFunction.apply(value));
        }
        return GroupKeys.join(parts, level.separator());
    }

    /**
     * {@code floor((value - min) / step) * step + min}, rendered as {@code start-end}.
     */
    static String rangeBucket(Object value, GroupingFunction function) {
        OptionalDouble number = Values.toDouble(value);
        if (number.isEmpty() || number.getAsDouble() < function.min()) {
            return GroupKeys.OTHER;
        }
        BigDecimal min = BigDecimal.valueOf(function.min());
        BigDecimal step = BigDecimal.valueOf(function.step());
        BigDecimal index = BigDecimal.valueOf(number.getAsDouble()).subtract(min).divide(step, 0, RoundingMode.FLOOR);
        BigDecimal start = index.multiply(step).add(min);
        return Values.display(start) + "-" + Values.display(start.add(step));
    }

    static String period(Object value, TimePeriod unit) {
        Optional<LocalDate> parsed = Values.toDate(value);
        if (parsed.isEmpty()) {
            return GroupKeys.UNPARSED;
        }
        LocalDate date = parsed.get();
        return switch (unit) {
            case YEAR -> String.valueOf(date.getYear());
            case QUARTER -> date.getYear() + "-Q" + ((date.getMonthValue() + 2) / 3);
            case MONTH -> String.format(Locale.ROOT, "%d-%02d", date.getYear(), date.getMonthValue());
            case WEEK -> String.format(Locale.ROOT, "%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case DAY -> date.toString();
        };
    }
}
