package com.kreasipositif.wpsprocessor.exception;

/**
 * Raised by a bank connector when the channel cannot be reached or returns an unusable reply.
 * The orchestrator counts it as one failed attempt.
 */
public class TransmissionException extends WpsException {

    public TransmissionException(String message) {
        super(message);
    }

    public TransmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
