package com.kreasipositif.wpsprocessor.submission.connector;

public enum BankStatus {
    PROCESSING,
    SUCCESS,
    REJECTED;

    /** Unknown status words are treated as still processing. */
    public static BankStatus parse(String value) {
        if (value == null) {
            return PROCESSING;
        }
        return switch (value.trim().toUpperCase()) {
            case "SUCCESS", "PROCESSED", "PAID", "COMPLETED" -> SUCCESS;
            case "REJECTED", "FAILED", "ERROR" -> REJECTED;
            default -> PROCESSING;
        };
    }
}
