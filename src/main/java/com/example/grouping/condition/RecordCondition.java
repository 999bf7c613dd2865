package com.example.grouping.condition;

import com.example.grouping.model.DataRecord;

/**
 * A pure predicate over a single record.
 *
 * <p>Conditions restrict the working set of an aggregation before values are
 * extracted. {@link #validate()} runs before any record is processed;
 * programmatic lambdas are always valid, declarative {@link ConditionSpec}s
 * check their own shape.
 */
@FunctionalInterface
public interface RecordCondition {

    boolean test(DataRecord record);

    /**
     * Checks that the condition is well formed.
     *
     * @throws com.example.grouping.error.InvalidConditionException if it is not
     */
    default void validate() {
    }
}
