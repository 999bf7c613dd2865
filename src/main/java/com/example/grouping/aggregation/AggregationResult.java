package com.example.grouping.aggregation;

import com.example.grouping.format.FormatSpec;
import com.example.grouping.format.ValueFormatter;

import java.util.List;

/**
 * The value of one aggregation spec at one tree node.
 *
 * @param path        path of the node the value is attached to ({@code []} for the root)
 * @param label       label the value is keyed by
 * @param value       computed value; {@code null} for an undefined result such as the minimum of nothing
 * @param recordCount number of records in the working set after the condition was applied
 * @param position    display position copied from the spec
 * @param format      display format copied from the spec
 * @param spec        the spec that produced the value
 */
public record AggregationResult(
        List<String> path,
        String label,
        Double value,
        int recordCount,
        DisplayPosition position,
        FormatSpec format,
        AggregationSpec spec
) {
    public AggregationResult {
        path = List.copyOf(path);
    }

    public boolean isEmpty() {
        return value == null;
    }

    /**
     * Returns the value rendered with the spec's format.
     */
    public String formatted() {
        return ValueFormatter.format(value, format);
    }
}
