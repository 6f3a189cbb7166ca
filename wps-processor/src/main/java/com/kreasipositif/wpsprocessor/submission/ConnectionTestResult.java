package com.kreasipositif.wpsprocessor.submission;

import java.time.Instant;

public record ConnectionTestResult(boolean success, String message, Instant testedAt) {

    public static ConnectionTestResult ok(String message) {
        return new ConnectionTestResult(true, message, Instant.now());
    }

    public static ConnectionTestResult failed(String message) {
        return new ConnectionTestResult(false, message, Instant.now());
    }
}
