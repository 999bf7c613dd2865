package com.example.grouping.error;

/**
 * Thrown when a declarative record condition or filter is malformed.
 */
public class InvalidConditionException extends GroupingValidationException {

    public InvalidConditionException(String message) {
        super(ErrorCode.INVALID_CONDITION, message);
    }
}
