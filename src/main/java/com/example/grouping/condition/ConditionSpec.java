package com.example.grouping.condition;

import com.example.grouping.error.InvalidConditionException;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.Values;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Declarative record condition, usable from JSON configuration.
 *
 * <p>Supported operators:
 * <ul>
 *   <li>{@code eq}, {@code ne}: numeric equality when both sides are numbers,
 *       display-string equality otherwise</li>
 *   <li>{@code gt}, {@code gte}, {@code lt}, {@code lte}: numeric comparison; records
 *       whose value is not numeric never match</li>
 *   <li>{@code in}, {@code not_in}: membership in a list value</li>
 *   <li>{@code contains}: case-insensitive substring of the display value</li>
 *   <li>{@code is_null}, {@code not_null}: missing-value checks</li>
 *   <li>{@code and}, {@code or}: combine nested {@code conditions}</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * {"operator": "and", "conditions": [
 *     {"field": "department", "operator": "eq", "value": "Sales"},
 *     {"field": "amount", "operator": "gte", "value": 1000}
 * ]}
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConditionSpec(
        String field,
        String operator,
        Object value,
        List<ConditionSpec> conditions
) implements RecordCondition {

    enum Operator {
        EQ, NE, GT, GTE, LT, LTE, IN, NOT_IN, CONTAINS, IS_NULL, NOT_NULL, AND, OR;

        static Operator parse(String text) {
            if (text == null || text.isBlank()) {
                throw new InvalidConditionException("Condition operator must not be blank");
            }
            try {
                return valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidConditionException("Unknown condition operator '" + text + "'");
            }
        }
    }

    @JsonCreator
    public ConditionSpec(
            @JsonProperty("field") String field,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") Object value,
            @JsonProperty("conditions") List<ConditionSpec> conditions
    ) {
        this.field = field;
        this.operator = operator;
        this.value = value;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static ConditionSpec eq(String field, Object value) {
        return new ConditionSpec(field, "eq", value, null);
    }

    public static ConditionSpec ne(String field, Object value) {
        return new ConditionSpec(field, "ne", value, null);
    }

    public static ConditionSpec gt(String field, Number value) {
        return new ConditionSpec(field, "gt", value, null);
    }

    public static ConditionSpec gte(String field, Number value) {
        return new ConditionSpec(field, "gte", value, null);
    }

    public static ConditionSpec lt(String field, Number value) {
        return new ConditionSpec(field, "lt", value, null);
    }

    public static ConditionSpec lte(String field, Number value) {
        return new ConditionSpec(field, "lte", value, null);
    }

    public static ConditionSpec in(String field, Object... values) {
        return new ConditionSpec(field, "in", Arrays.asList(values), null);
    }

    public static ConditionSpec contains(String field, String text) {
        return new ConditionSpec(field, "contains", text, null);
    }

    public static ConditionSpec notNull(String field) {
        return new ConditionSpec(field, "not_null", null, null);
    }

    public static ConditionSpec and(ConditionSpec... conditions) {
        return new ConditionSpec(null, "and", null, List.of(conditions));
    }

    public static ConditionSpec or(ConditionSpec... conditions) {
        return new ConditionSpec(null, "or", null, List.of(conditions));
    }

    @Override
    public void validate() {
        Operator op = Operator.parse(operator);
        switch (op) {
            case AND, OR -> {
                if (conditions.isEmpty()) {
                    throw new InvalidConditionException("'" + operator + "' needs at least one nested condition");
                }
                conditions.forEach(ConditionSpec::validate);
            }
            case IS_NULL, NOT_NULL -> requireField(op);
            case EQ, NE, CONTAINS -> {
                requireField(op);
                if (value == null) {
                    throw new InvalidConditionException("'" + operator + "' on '" + field + "' needs a value");
                }
            }
            case GT, GTE, LT, LTE -> {
                requireField(op);
                if (Values.toDouble(value).isEmpty()) {
                    throw new InvalidConditionException(
                            "'" + operator + "' on '" + field + "' needs a numeric value, got " + value);
                }
            }
            case IN, NOT_IN -> {
                requireField(op);
                if (!(value instanceof Collection<?>)) {
                    throw new InvalidConditionException("'" + operator + "' on '" + field + "' needs a list value");
                }
            }
        }
    }

    @Override
    public boolean test(DataRecord record) {
        Operator op = Operator.parse(operator);
        return switch (op) {
            case AND -> conditions.stream().allMatch(c -> c.test(record));
            case OR -> conditions.stream().anyMatch(c -> c.test(record));
            case IS_NULL -> Values.isMissing(record.get(field));
            case NOT_NULL -> !Values.isMissing(record.get(field));
            case EQ -> matches(record.get(field), value);
            case NE -> !matches(record.get(field), value);
            case IN -> containsMatch(record.get(field));
            case NOT_IN -> !containsMatch(record.get(field));
            case CONTAINS -> !Values.isMissing(record.get(field))
                    && Values.display(record.get(field)).toLowerCase(Locale.ROOT)
                    .contains(String.valueOf(value).toLowerCase(Locale.ROOT));
            case GT, GTE, LT, LTE -> compare(op, record.get(field));
        };
    }

    private void requireField(Operator op) {
        if (field == null || field.isBlank()) {
            throw new InvalidConditionException("'" + op.name().toLowerCase(Locale.ROOT) + "' needs a field");
        }
    }

    private boolean compare(Operator op, Object actual) {
        OptionalDouble left = Values.toDouble(actual);
        OptionalDouble right = Values.toDouble(value);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        int cmp = Double.compare(left.getAsDouble(), right.getAsDouble());
        return switch (op) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> throw new IllegalStateException("Not a comparison: " + op);
        };
    }

    private boolean containsMatch(Object actual) {
        if (!(value instanceof Collection<?> candidates)) {
            return false;
        }
        for (Object candidate : candidates) {
            if (matches(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Object actual, Object expected) {
        if (Values.isMissing(actual) || expected == null) {
            return false;
        }
        OptionalDouble left = Values.toDouble(actual);
        OptionalDouble right = Values.toDouble(expected);
        if (left.isPresent() && right.isPresent() && actual instanceof Number && expected instanceof Number) {
            return left.getAsDouble() == right.getAsDouble();
        }
        return Values.display(actual).equals(Values.display(expected));
    }
}
