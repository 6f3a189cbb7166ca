package com.kreasipositif.wpsprocessor.submission.connector;

public record StatusResponse(BankStatus status, String code, String message) {

    public static StatusResponse processing(String message) {
        return new StatusResponse(BankStatus.PROCESSING, null, message);
    }
}
