package com.example.grouping.aggregation;

/**
 * Aggregation functions available to specs and pivot measures.
 */
public enum AggregationType {
    SUM,
    COUNT,
    AVG,
    MIN,
    MAX,
    COUNT_DISTINCT,
    CUSTOM;

    /**
     * Every type except {@link #COUNT} reads a source field.
     */
    public boolean requiresSourceField() {
        return this != COUNT;
    }
}
