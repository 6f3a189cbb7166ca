package com.kreasipositif.wpsprocessor.exception;

public class SubmissionNotFoundException extends WpsException {

    public SubmissionNotFoundException(String message) {
        super(message);
    }
}
