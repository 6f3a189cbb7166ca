package com.kreasipositif.wpsprocessor.exception;

/** Raised when a submission is attempted over a bank connection that is not ACTIVE. */
public class ConnectionNotActiveException extends WpsException {

    public ConnectionNotActiveException(String message) {
        super(message);
    }
}
