package com.kreasipositif.wpsprocessor.submission;

import java.time.Instant;

/**
 * One transmission attempt. {@code message} keeps the bank's or transport's text verbatim.
 */
public record SubmissionAttempt(
        int number,
        Instant startedAt,
        Instant finishedAt,
        boolean accepted,
        String responseCode,
        String message) {
}
