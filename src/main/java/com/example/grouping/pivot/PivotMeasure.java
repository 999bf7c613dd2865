package com.example.grouping.pivot;

import com.example.grouping.aggregation.AggregationSpec;
import com.example.grouping.aggregation.AggregationType;
import com.example.grouping.condition.ConditionSpec;
import com.example.grouping.condition.RecordCondition;
import com.example.grouping.format.FormatSpec;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A value computed for every pivot cell and total.
 *
 * @param id        unique measure id, referenced by cells
 * @param field     field the measure reads; not needed for {@code COUNT}
 * @param label     display label, the id when unset
 * @param type      aggregation function
 * @param customId  registered aggregation function id, for {@code CUSTOM}
 * @param condition optional per-record filter
 * @param format    display format of the cells
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotMeasure(
        String id,
        String field,
        String label,
        AggregationType type,
        String customId,
        RecordCondition condition,
        FormatSpec format
) {
    @JsonCreator
    public PivotMeasure(
            @JsonProperty("id") String id,
            @JsonProperty("field") String field,
            @JsonProperty("label") String label,
            @JsonProperty("type") AggregationType type,
            @JsonProperty("customId") String customId,
            @JsonProperty("condition") @JsonDeserialize(as = ConditionSpec.class) RecordCondition condition,
            @JsonProperty("format") FormatSpec format
    ) {
        this.id = id;
        this.field = field;
        this.label = label != null ? label : id;
        this.type = type;
        this.customId = customId;
        this.condition = condition;
        this.format = format;
    }

    public static PivotMeasure of(String id, AggregationType type, String field) {
        return new PivotMeasure(id, field, null, type, null, null, null);
    }

    public PivotMeasure withFormat(FormatSpec newFormat) {
        return new PivotMeasure(id, field, label, type, customId, condition, newFormat);
    }

    public PivotMeasure withCondition(RecordCondition newCondition) {
        return new PivotMeasure(id, field, label, type, customId, newCondition, format);
    }

    /**
     * Returns the equivalent aggregation spec, labelled by the measure id.
     */
    public AggregationSpec toSpec() {
        return new AggregationSpec(type, customId, field, 0, null, condition, id, null, format);
    }
}
