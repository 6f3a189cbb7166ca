package com.kreasipositif.wpsprocessor.submission.connector;

/**
 * Bank's immediate answer to a transmission.
 *
 * @param accepted      the bank took the file for processing
 * @param bankReference the bank's tracking reference, present when accepted
 */
public record ConnectorResponse(boolean accepted, String bankReference, String responseCode, String responseMessage) {

    public static ConnectorResponse accepted(String bankReference, String code, String message) {
        return new ConnectorResponse(true, bankReference, code, message);
    }

    public static ConnectorResponse rejected(String code, String message) {
        return new ConnectorResponse(false, null, code, message);
    }
}
