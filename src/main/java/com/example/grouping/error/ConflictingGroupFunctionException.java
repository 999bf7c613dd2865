package com.example.grouping.error;

/**
 * Thrown when declarations sharing a level number declare different grouping functions.
 */
public class ConflictingGroupFunctionException extends GroupingValidationException {

    private final int level;

    public ConflictingGroupFunctionException(int level, String message) {
        super(ErrorCode.CONFLICTING_GROUP_FUNCTION, message);
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
