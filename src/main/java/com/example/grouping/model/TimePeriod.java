package com.example.grouping.model;

/**
 * Truncation unit for {@link GroupingMethod#TIME_PERIOD} grouping.
 */
public enum TimePeriod {
    YEAR,
    QUARTER,
    MONTH,
    WEEK,
    DAY
}
