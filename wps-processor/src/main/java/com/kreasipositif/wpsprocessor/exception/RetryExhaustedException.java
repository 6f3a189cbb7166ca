package com.kreasipositif.wpsprocessor.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Raised when a submission has used its whole retry budget and moved to FAILED.
 */
@Getter
public class RetryExhaustedException extends WpsException {

    private final String submissionReference;
    private final int retryCount;
    private final String lastError;
    private final Instant createdAt;
    private final Instant failedAt;

    public RetryExhaustedException(String submissionReference, int retryCount, String lastError,
                                   Instant createdAt, Instant failedAt) {
        super("Submission %s failed after %d attempt(s): %s".formatted(submissionReference, retryCount, lastError));
        this.submissionReference = submissionReference;
        this.retryCount = retryCount;
        this.lastError = lastError;
        this.createdAt = createdAt;
        this.failedAt = failedAt;
    }
}
