package com.example.grouping.resolver;

import com.example.grouping.aggregation.AggregationSpec;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Grouping and aggregations declared on one column.
 *
 * <p>Aggregations declared here default their source field to the column id
 * and their target level to the column's grouping level ({@code 0} for a
 * column that does not group).
 *
 * <pre>{@code
 * {"id": "salary",
 *  "aggregations": [{"type": "sum", "targetLevel": 1, "position": "footer"}]}
 * {"id": "department", "grouping": {"level": 1}}
 * }</pre>
 *
 * @param id           column id, also the field it reads
 * @param grouping     optional grouping declaration
 * @param aggregations aggregations declared on the column
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnConfig(
        String id,
        ColumnGrouping grouping,
        List<AggregationSpec> aggregations
) {
    @JsonCreator
    public ColumnConfig(
            @JsonProperty("id") String id,
            @JsonProperty("grouping") ColumnGrouping grouping,
            @JsonProperty("aggregations") List<AggregationSpec> aggregations
    ) {
        this.id = id;
        this.grouping = grouping;
        this.aggregations = aggregations != null ? List.copyOf(aggregations) : List.of();
    }

    public static ColumnConfig grouped(String id, ColumnGrouping grouping, AggregationSpec... aggregations) {
        return new ColumnConfig(id, grouping, Arrays.asList(aggregations));
    }

    public static ColumnConfig aggregated(String id, AggregationSpec... aggregations) {
        return new ColumnConfig(id, null, Arrays.asList(aggregations));
    }

    public int defaultTargetLevel() {
        return grouping != null ? grouping.level() : 0;
    }
}
