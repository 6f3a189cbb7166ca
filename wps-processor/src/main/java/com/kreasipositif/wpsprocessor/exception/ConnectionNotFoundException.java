package com.kreasipositif.wpsprocessor.exception;

public class ConnectionNotFoundException extends WpsException {

    public ConnectionNotFoundException(String message) {
        super(message);
    }
}
