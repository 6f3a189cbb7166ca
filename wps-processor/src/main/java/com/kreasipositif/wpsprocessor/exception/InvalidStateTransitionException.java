package com.kreasipositif.wpsprocessor.exception;

public class InvalidStateTransitionException extends WpsException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
