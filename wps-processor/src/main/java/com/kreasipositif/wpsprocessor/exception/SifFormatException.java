package com.kreasipositif.wpsprocessor.exception;

/**
 * Raised when a batch cannot be rendered as (or parsed from) a fixed-width SIF file:
 * a required field is missing, a numeric value overflows its column, or an amount
 * has a fractional subunit component.
 */
public class SifFormatException extends WpsException {

    public SifFormatException(String message) {
        super(message);
    }
}
