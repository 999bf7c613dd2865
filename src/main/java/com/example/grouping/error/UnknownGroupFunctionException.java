package com.example.grouping.error;

/**
 * Thrown when a level declares a custom grouping function id that is not registered.
 */
public class UnknownGroupFunctionException extends GroupingValidationException {

    private final String functionId;

    public UnknownGroupFunctionException(String functionId) {
        super(ErrorCode.UNKNOWN_GROUP_FUNCTION, "Group function '" + functionId + "' is not registered");
        this.functionId = functionId;
    }

    public String getFunctionId() {
        return functionId;
    }
}
