package com.example.grouping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The grouping function declared for a level, with its parameters.
 *
 * <p>Two declarations on the same level must carry equal functions; record
 * equality is what the resolver compares. Unset parameters are normalised
 * to their defaults so that, for example, {@code numericRange(0, 10)} and a
 * JSON declaration {@code {"method": "NUMERIC_RANGE"}} compare equal.
 *
 * @param method   grouping method, {@link GroupingMethod#BY_FIELD} when unset
 * @param min      lower bound of the first numeric bucket (range only)
 * @param step     width of each numeric bucket (range only)
 * @param unit     truncation unit (time period only)
 * @param customId registered custom group function id (custom only)
 * @param params   parameters passed to the custom group function
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupingFunction(
        GroupingMethod method,
        Double min,
        Double step,
        TimePeriod unit,
        String customId,
        Map<String, Object> params
) {
    public static final double DEFAULT_RANGE_MIN = 0.0;
    public static final double DEFAULT_RANGE_STEP = 10.0;

    @JsonCreator
    public GroupingFunction(
            @JsonProperty("method") GroupingMethod method,
            @JsonProperty("min") Double min,
            @JsonProperty("step") Double step,
            @JsonProperty("unit") TimePeriod unit,
            @JsonProperty("customId") String customId,
            @JsonProperty("params") Map<String, Object> params
    ) {
        this.method = method != null ? method : GroupingMethod.BY_FIELD;
        boolean range = this.method == GroupingMethod.NUMERIC_RANGE;
        this.min = range ? (min != null ? min : DEFAULT_RANGE_MIN) : null;
        this.step = range ? (step != null ? step : DEFAULT_RANGE_STEP) : null;
        this.unit = this.method == GroupingMethod.TIME_PERIOD ? (unit != null ? unit : TimePeriod.MONTH) : null;
        this.customId = this.method == GroupingMethod.CUSTOM ? customId : null;
        this.params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
    }

    public static GroupingFunction byField() {
        return new GroupingFunction(GroupingMethod.BY_FIELD, null, null, null, null, null);
    }

    public static GroupingFunction multiFieldComposite() {
        return new GroupingFunction(GroupingMethod.MULTI_FIELD_COMPOSITE, null, null, null, null, null);
    }

    public static GroupingFunction numericRange(double min, double step) {
        return new GroupingFunction(GroupingMethod.NUMERIC_RANGE, min, step, null, null, null);
    }

    public static GroupingFunction timePeriod(TimePeriod unit) {
        return new GroupingFunction(GroupingMethod.TIME_PERIOD, null, null, unit, null, null);
    }

    public static GroupingFunction custom(String customId) {
        return custom(customId, Map.of());
    }

    public static GroupingFunction custom(String customId, Map<String, Object> params) {
        return new GroupingFunction(GroupingMethod.CUSTOM, null, null, null, customId, params);
    }

    @Override
    public String toString() {
        return switch (method) {
            case NUMERIC_RANGE -> "NumericRange(" + min + ", " + step + ")";
            case TIME_PERIOD -> "TimePeriod(" + unit + ")";
            case CUSTOM -> "Custom(" + customId + ")";
            case MULTI_FIELD_COMPOSITE -> "MultiFieldComposite";
            case BY_FIELD -> "ByField";
        };
    }
}
