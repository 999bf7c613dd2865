package com.example.grouping.model;

/**
 * How one grouping pass turns a record into a group key.
 */
public enum GroupingMethod {
    /** Field values joined with the level separator. */
    BY_FIELD,
    /** Like {@link #BY_FIELD}, optionally rendered through a {@code {field}} template. */
    MULTI_FIELD_COMPOSITE,
    /** Fixed-width numeric buckets {@code start-end}. */
    NUMERIC_RANGE,
    /** Dates truncated to a {@link TimePeriod}. */
    TIME_PERIOD,
    /** Delegated to a registered custom group function. */
    CUSTOM
}
