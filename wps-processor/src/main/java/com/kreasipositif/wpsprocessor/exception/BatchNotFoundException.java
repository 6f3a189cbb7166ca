package com.kreasipositif.wpsprocessor.exception;

public class BatchNotFoundException extends WpsException {

    public BatchNotFoundException(String message) {
        super(message);
    }
}
