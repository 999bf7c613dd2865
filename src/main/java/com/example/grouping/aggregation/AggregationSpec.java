package com.example.grouping.aggregation;

import com.example.grouping.condition.ConditionSpec;
import com.example.grouping.condition.RecordCondition;
import com.example.grouping.format.FormatSpec;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Locale;

/**
 * Declares one aggregate to compute over the group tree.
 *
 * <p>Results are keyed by node path and {@link #displayLabel()}. When several
 * specs resolve to the same label on the same node, the later spec in
 * declaration order replaces the earlier one.
 *
 * <pre>{@code
 * AggregationSpec.sum("amount", 1)
 *     .withLabel("Regional sales")
 *     .withCondition(ConditionSpec.eq("status", "completed"))
 *     .withPosition(DisplayPosition.FOOTER);
 *
 * AggregationSpec.count(0).withScope(AggregationScope.CROSS_ALL_GROUPS); // grand total
 * }</pre>
 *
 * @param type        aggregation function
 * @param customId    registered aggregation function id, for {@link AggregationType#CUSTOM}
 * @param sourceField field whose values are aggregated; not needed for {@link AggregationType#COUNT}
 * @param targetLevel grouping level the value attaches to, {@code 0} for the root
 * @param scope       scoping rule, {@link AggregationScope#EXACT_LEVEL} when unset
 * @param condition   optional per-record filter applied before aggregation
 * @param label       display label, derived from type and field when unset
 * @param position    display position, {@link DisplayPosition#HEADER} when unset
 * @param format      display format, plain when unset
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregationSpec(
        AggregationType type,
        String customId,
        String sourceField,
        Integer targetLevel,
        AggregationScope scope,
        RecordCondition condition,
        String label,
        DisplayPosition position,
        FormatSpec format
) {
    @JsonCreator
    public AggregationSpec(
            @JsonProperty("type") AggregationType type,
            @JsonProperty("customId") String customId,
            @JsonProperty("sourceField") @JsonAlias("field") String sourceField,
            @JsonProperty("targetLevel") Integer targetLevel,
            @JsonProperty("scope") AggregationScope scope,
            @JsonProperty("condition") @JsonDeserialize(as = ConditionSpec.class) RecordCondition condition,
            @JsonProperty("label") String label,
            @JsonProperty("position") DisplayPosition position,
            @JsonProperty("format") FormatSpec format
    ) {
        this.type = type;
        this.customId = customId;
        this.sourceField = sourceField;
        this.targetLevel = targetLevel;
        this.scope = scope != null ? scope : AggregationScope.EXACT_LEVEL;
        this.condition = condition;
        this.label = label;
        this.position = position != null ? position : DisplayPosition.HEADER;
        this.format = format;
    }

    public static AggregationSpec of(AggregationType type, String sourceField, int targetLevel) {
        return new AggregationSpec(type, null, sourceField, targetLevel, null, null, null, null, null);
    }

    public static AggregationSpec sum(String sourceField, int targetLevel) {
        return of(AggregationType.SUM, sourceField, targetLevel);
    }

    public static AggregationSpec count(int targetLevel) {
        return of(AggregationType.COUNT, null, targetLevel);
    }

    public static AggregationSpec avg(String sourceField, int targetLevel) {
        return of(AggregationType.AVG, sourceField, targetLevel);
    }

    public static AggregationSpec min(String sourceField, int targetLevel) {
        return of(AggregationType.MIN, sourceField, targetLevel);
    }

    public static AggregationSpec max(String sourceField, int targetLevel) {
        return of(AggregationType.MAX, sourceField, targetLevel);
    }

    public static AggregationSpec countDistinct(String sourceField, int targetLevel) {
        return of(AggregationType.COUNT_DISTINCT, sourceField, targetLevel);
    }

    public static AggregationSpec custom(String customId, String sourceField, int targetLevel) {
        return new AggregationSpec(AggregationType.CUSTOM, customId, sourceField, targetLevel,
                null, null, null, null, null);
    }

    public AggregationSpec withScope(AggregationScope newScope) {
        return new AggregationSpec(type, customId, sourceField, targetLevel, newScope, condition, label, position, format);
    }

    public AggregationSpec withCondition(RecordCondition newCondition) {
        return new AggregationSpec(type, customId, sourceField, targetLevel, scope, newCondition, label, position, format);
    }

    public AggregationSpec withLabel(String newLabel) {
        return new AggregationSpec(type, customId, sourceField, targetLevel, scope, condition, newLabel, position, format);
    }

    public AggregationSpec withPosition(DisplayPosition newPosition) {
        return new AggregationSpec(type, customId, sourceField, targetLevel, scope, condition, label, newPosition, format);
    }

    public AggregationSpec withFormat(FormatSpec newFormat) {
        return new AggregationSpec(type, customId, sourceField, targetLevel, scope, condition, label, position, newFormat);
    }

    public AggregationSpec withTargetLevel(int newTargetLevel) {
        return new AggregationSpec(type, customId, sourceField, newTargetLevel, scope, condition, label, position, format);
    }

    /**
     * Fills the source field and target level a column-level declaration leaves out.
     *
     * @param columnId     id of the declaring column, used as source field
     * @param defaultLevel level of the declaring column, {@code 0} when it does not group
     */
    public AggregationSpec withColumnDefaults(String columnId, int defaultLevel) {
        String field = sourceField == null && type != null && type.requiresSourceField() ? columnId : sourceField;
        Integer level = targetLevel != null ? targetLevel : defaultLevel;
        return new AggregationSpec(type, customId, field, level, scope, condition, label, position, format);
    }

    /**
     * Returns the label results are keyed by: the declared label, or
     * {@code sum(amount)}, {@code count}, {@code median(amount)} and so on.
     */
    public String displayLabel() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        String name = type == AggregationType.CUSTOM && customId != null
                ? customId
                : (type != null ? type.name().toLowerCase(Locale.ROOT) : "aggregate");
        return sourceField != null && (type == null || type.requiresSourceField())
                ? name + "(" + sourceField + ")"
                : name;
    }
}
