package com.kreasipositif.wpsprocessor.validation;

/**
 * Only ERROR failures block submission.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
