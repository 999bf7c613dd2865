package com.example.grouping.aggregation;

/**
 * Which tree nodes an aggregation attaches to.
 */
public enum AggregationScope {
    /** Nodes whose level equals the target level, over their own records. */
    EXACT_LEVEL,
    /**
     * Nodes at the target level, over their records and every descendant's.
     * A node's members already are that union, so the value equals {@link #EXACT_LEVEL}.
     */
    INCLUDE_SUBGROUPS,
    /**
     * Target level {@code 0}: one result over every record, attached to the root.
     * Any other level: a running total across all nodes of that level in tree order.
     */
    CROSS_ALL_GROUPS
}
