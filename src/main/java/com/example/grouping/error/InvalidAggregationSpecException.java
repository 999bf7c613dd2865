package com.example.grouping.error;

/**
 * Thrown when an aggregation spec or pivot measure is incomplete.
 */
public class InvalidAggregationSpecException extends GroupingValidationException {

    public InvalidAggregationSpecException(String message) {
        super(ErrorCode.INVALID_AGGREGATION_SPEC, message);
    }
}
