package com.example.grouping.registry;

import java.util.List;

/**
 * A named aggregation over the numeric values of a group.
 *
 * <p>Implementations must be total: they receive only finite numbers
 * (possibly none) and must return a number.
 */
@FunctionalInterface
public interface CustomAggregationFunction {

    double apply(List<Double> values);
}
