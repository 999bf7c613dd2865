package com.example.grouping.error;

/**
 * Base class for configuration errors detected before any record is processed.
 *
 * <p>All subclasses are deterministic: the same configuration always fails
 * the same way. Callers can branch on {@link #getCode()} instead of the
 * concrete type.
 */
public class GroupingValidationException extends RuntimeException {

    private final ErrorCode code;

    public GroupingValidationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GroupingValidationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
