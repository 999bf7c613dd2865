package com.example.grouping.aggregation;

import java.util.List;

/**
 * A recoverable problem met while computing aggregates.
 *
 * <p>The affected result is still produced, with the value {@code 0}.
 */
public record AggregationWarning(
        Code code,
        List<String> path,
        String label,
        String message
) {
    public enum Code {
        /** A custom aggregation id with no registered function. */
        UNREGISTERED_CUSTOM_AGGREGATION,
        /** A registered custom aggregation threw. */
        CUSTOM_AGGREGATION_FAILED
    }

    public AggregationWarning {
        path = List.copyOf(path);
    }
}
