package com.example.grouping.error;

public class InvalidGroupingDeclarationException extends GroupingValidationException {

    public InvalidGroupingDeclarationException(String message) {
        super(ErrorCode.INVALID_GROUPING_DECLARATION, message);
    }
}
