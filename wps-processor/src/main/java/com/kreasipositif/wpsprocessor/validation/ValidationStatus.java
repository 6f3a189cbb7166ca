package com.kreasipositif.wpsprocessor.validation;

public enum ValidationStatus {
    VALID,
    WARNING,
    INVALID
}
