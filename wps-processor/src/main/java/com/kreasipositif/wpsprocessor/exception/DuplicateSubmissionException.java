package com.kreasipositif.wpsprocessor.exception;

/**
 * Raised when a NEW submission is requested for a batch/connection pair that already has a
 * live or successful submission.
 */
public class DuplicateSubmissionException extends WpsException {

    public DuplicateSubmissionException(String message) {
        super(message);
    }
}
