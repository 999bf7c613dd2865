package com.example.grouping.aggregation;

import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Folds a sequence of items into a single result in one pass.
 *
 * <p>The sequential counterpart of {@link java.util.stream.Collector}:
 * <ol>
 *   <li><b>Initialization:</b> create a mutable accumulator via {@link #supplier()}</li>
 *   <li><b>Accumulation:</b> feed each item via {@link #accumulator()}</li>
 *   <li><b>Finishing:</b> turn the accumulator into the result via {@link #finisher()}</li>
 * </ol>
 *
 * <p>Ad-hoc aggregators can be built from lambdas:
 * <pre>{@code
 * Aggregator<DataRecord, long[], Long> count = Aggregator.of(
 *     () -> new long[1],
 *     (acc, record) -> acc[0]++,
 *     acc -> acc[0]
 * );
 * long matching = count.aggregateFiltered(records, condition::test);
 * }</pre>
 *
 * @param <T> the type of input elements
 * @param <A> the mutable accumulator type
 * @param <R> the result type
 */
public interface Aggregator<T, A, R> {

    Supplier<A> supplier();

    BiConsumer<A, T> accumulator();

    Function<A, R> finisher();

    /**
     * Aggregates every item of the given iterable.
     *
     * @param source the items to aggregate
     * @return the aggregation result
     */
    default R aggregate(Iterable<? extends T> source) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            accFn.accept(acc, item);
        }
        return finisher().apply(acc);
    }

    /**
     * Aggregates only the items matching the filter.
     *
     * @param source the items to aggregate
     * @param filter predicate selecting the items to include
     * @return the aggregation result for the matching items
     */
    default R aggregateFiltered(Iterable<? extends T> source, Predicate<? super T> filter) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            if (filter.test(item)) {
                accFn.accept(acc, item);
            }
        }
        return finisher().apply(acc);
    }

    /**
     * Creates an aggregator from functional components.
     *
     * @param supplier creates a new accumulator
     * @param accumulator adds an element to the accumulator
     * @param finisher transforms the accumulator to the result
     * @param <T> the type of input elements
     * @param <A> the mutable accumulator type
     * @param <R> the result type
     * @return a new Aggregator
     */
    static <T, A, R> Aggregator<T, A, R> of(
            Supplier<A> supplier,
            BiConsumer<A, T> accumulator,
            Function<A, R> finisher) {
        return new Aggregator<>() {
            @Override
            public Supplier<A> supplier() {
                return supplier;
            }

            @Override
            public BiConsumer<A, T> accumulator() {
                return accumulator;
            }

            @Override
            public Function<A, R> finisher() {
                return finisher;
            }
        };
    }
}
