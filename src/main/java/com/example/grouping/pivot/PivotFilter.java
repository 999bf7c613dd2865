package com.example.grouping.pivot;

import com.example.grouping.condition.RecordCondition;
import com.example.grouping.error.InvalidConditionException;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupKeys;
import com.example.grouping.model.Values;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A record filter applied before the pivot hierarchies are built.
 *
 * <ul>
 *   <li>{@code SELECT}, {@code MULTISELECT}: the value equals one of {@code selectedValues}</li>
 *   <li>{@code RANGE}: numeric value within {@code [min, max]}, either bound optional</li>
 *   <li>{@code DATE_RANGE}: date within {@code [start, end]} (ISO dates), either bound optional</li>
 *   <li>{@code SEARCH}: value contains one of {@code selectedValues}, ignoring case</li>
 * </ul>
 * A filter without any selection or bound lets every record through.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotFilter(
        String field,
        FilterType type,
        List<Object> selectedValues,
        Double min,
        Double max,
        String start,
        String end
) implements RecordCondition {

    public enum FilterType {
        SELECT,
        MULTISELECT,
        RANGE,
        DATE_RANGE,
        SEARCH
    }

    @JsonCreator
    public PivotFilter(
            @JsonProperty("field") String field,
            @JsonProperty("type") FilterType type,
            @JsonProperty("selectedValues") List<Object> selectedValues,
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max,
            @JsonProperty("start") String start,
            @JsonProperty("end") String end
    ) {
        this.field = field;
        this.type = type;
        this.selectedValues = selectedValues != null ? List.copyOf(selectedValues) : List.of();
        this.min = min;
        this.max = max;
        this.start = start;
        this.end = end;
    }

    public static PivotFilter select(String field, Object... values) {
        return new PivotFilter(field, FilterType.MULTISELECT, List.of(values), null, null, null, null);
    }

    public static PivotFilter range(String field, Double min, Double max) {
        return new PivotFilter(field, FilterType.RANGE, null, min, max, null, null);
    }

    public static PivotFilter dateRange(String field, String start, String end) {
        return new PivotFilter(field, FilterType.DATE_RANGE, null, null, null, start, end);
    }

    public static PivotFilter search(String field, String... terms) {
        return new PivotFilter(field, FilterType.SEARCH, List.of((Object[]) terms), null, null, null, null);
    }

    @Override
    public void validate() {
        if (field == null || field.isBlank()) {
            throw new InvalidConditionException("Pivot filter needs a field");
        }
        if (type == null) {
            throw new InvalidConditionException("Pivot filter on '" + field + "' needs a type");
        }
        if (type == FilterType.RANGE && min != null && max != null && min > max) {
            throw new InvalidConditionException(
                    "Range filter on '" + field + "' has min " + min + " above max " + max);
        }
        if (type == FilterType.DATE_RANGE) {
            Optional<LocalDate> from = bound(start);
            Optional<LocalDate> to = bound(end);
            if (from.isPresent() && to.isPresent() && from.get().isAfter(to.get())) {
                throw new InvalidConditionException(
                        "Date range filter on '" + field + "' starts after it ends: " + start + " > " + end);
            }
        }
    }

    @Override
    public boolean test(DataRecord record) {
        Object value = record.get(field);
        return switch (type) {
            case SELECT, MULTISELECT -> selectedValues.isEmpty() || selectedValues.stream()
                    .anyMatch(selected -> GroupKeys.part(selected).equals(GroupKeys.part(value)));
            case RANGE -> {
                if (min == null && max == null) {
                    yield true;
                }
                OptionalDouble number = Values.toDouble(value);
                yield number.isPresent()
                        && (min == null || number.getAsDouble() >= min)
                        && (max == null || number.getAsDouble() <= max);
            }
            case DATE_RANGE -> {
                Optional<LocalDate> from = bound(start);
                Optional<LocalDate> to = bound(end);
                if (from.isEmpty() && to.isEmpty()) {
                    yield true;
                }
                Optional<LocalDate> date = Values.toDate(value);
                yield date.isPresent()
                        && from.map(f -> !date.get().isBefore(f)).orElse(true)
                        && to.map(t -> !date.get().isAfter(t)).orElse(true);
            }
            case SEARCH -> {
                if (selectedValues.isEmpty()) {
                    yield true;
                }
                if (Values.isMissing(value)) {
                    yield false;
                }
                String text = Values.display(value).toLowerCase(Locale.ROOT);
                yield selectedValues.stream()
                        .anyMatch(term -> text.contains(String.valueOf(term).toLowerCase(Locale.ROOT)));
            }
        };
    }

    private Optional<LocalDate> bound(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<LocalDate> date = Values.toDate(text);
        if (date.isEmpty()) {
            throw new InvalidConditionException("Date range filter on '" + field + "' has an invalid bound: " + text);
        }
        return date;
    }
}
