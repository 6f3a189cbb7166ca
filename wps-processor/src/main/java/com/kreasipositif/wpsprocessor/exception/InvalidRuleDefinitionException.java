package com.kreasipositif.wpsprocessor.exception;

/** Raised when a validation rule definition references an unknown field or derived check. */
public class InvalidRuleDefinitionException extends WpsException {

    public InvalidRuleDefinitionException(String message) {
        super(message);
    }
}
