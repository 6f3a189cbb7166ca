package com.kreasipositif.wpsprocessor.exception;

/**
 * Base exception for WPS pipeline errors.
 */
public class WpsException extends RuntimeException {

    public WpsException(String message) {
        super(message);
    }

    public WpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
