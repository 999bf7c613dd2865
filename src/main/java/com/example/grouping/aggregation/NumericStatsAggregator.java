package com.example.grouping.aggregation;

import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An Aggregator that computes {@link NumericStats} with constant memory.
 *
 * <p>Only running totals are kept: the individual values are never buffered.
 *
 * <pre>{@code
 * NumericStats stats = NumericStatsAggregator.toNumericStats().aggregate(values);
 * double total = stats.sum();
 * double mean = stats.average();
 * }</pre>
 */
public class NumericStatsAggregator implements Aggregator<Double, NumericStatsAggregator.Accumulator, NumericStats> {

    /**
     * Mutable accumulator holding the running totals.
     */
    public static class Accumulator {
        private long count = 0;
        private double sum = 0.0;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        public void accumulate(Double value) {
            count++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        public NumericStats finish() {
            return new NumericStats(count, sum, min, max);
        }
    }

    public static NumericStatsAggregator toNumericStats() {
        return new NumericStatsAggregator();
    }

    @Override
    public Supplier<Accumulator> supplier() {
        return Accumulator::new;
    }

    @Override
    public BiConsumer<Accumulator, Double> accumulator() {
        return Accumulator::accumulate;
    }

    @Override
    public Function<Accumulator, NumericStats> finisher() {
        return Accumulator::finish;
    }
}
