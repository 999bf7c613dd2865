package com.example.grouping;

import com.example.grouping.aggregation.AggregationResultMap;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;

import java.util.List;

/**
 * Output of one processing run: the group tree, the levels it was built
 * from and the aggregates attached to its nodes.
 */
public record GroupingResult(
        GroupNode root,
        List<GroupingLevel> levels,
        AggregationResultMap aggregations,
        int recordCount
) {
    public GroupingResult {
        levels = List.copyOf(levels);
    }
}
