package com.example.grouping.aggregation;

/**
 * Count, sum, minimum and maximum of a set of numeric values.
 *
 * <p>The average is derived from sum and count rather than stored, so
 * combining two partial results never averages averages.
 */
public record NumericStats(
        long count,
        double sum,
        double min,
        double max
) {
    /**
     * Combines two partial results.
     *
     * @param other the other stats to combine with
     * @return new NumericStats over both value sets
     */
    public NumericStats combine(NumericStats other) {
        return new NumericStats(
                count + other.count,
                sum + other.sum,
                Math.min(min, other.min),
                Math.max(max, other.max));
    }

    /**
     * Returns the mean, {@code 0} for an empty set.
     */
    public double average() {
        return count > 0 ? sum / count : 0.0;
    }

    /**
     * Returns the minimum, {@code null} for an empty set.
     */
    public Double minOrNull() {
        return count > 0 ? min : null;
    }

    /**
     * Returns the maximum, {@code null} for an empty set.
     */
    public Double maxOrNull() {
        return count > 0 ? max : null;
    }
}
