package com.example.grouping.resolver;

import com.example.grouping.aggregation.AggregationSpec;
import com.example.grouping.model.GroupingLevel;

import java.util.List;

/**
 * Resolved grouping levels, ascending, and the aggregation specs in declaration order.
 */
public record GroupingPlan(
        List<GroupingLevel> levels,
        List<AggregationSpec> specs
) {
    public GroupingPlan {
        levels = List.copyOf(levels);
        specs = List.copyOf(specs);
    }
}
