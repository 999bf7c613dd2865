package com.example.grouping.error;

/**
 * Structured codes for validation-time failures.
 */
public enum ErrorCode {
    CONFLICTING_GROUP_FUNCTION,
    UNKNOWN_GROUP_FUNCTION,
    INVALID_CONDITION,
    INVALID_AGGREGATION_SPEC,
    INVALID_GROUPING_DECLARATION
}
