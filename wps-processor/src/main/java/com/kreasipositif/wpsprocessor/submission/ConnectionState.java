package com.kreasipositif.wpsprocessor.submission;

public enum ConnectionState {
    DRAFT,
    TESTING,
    ACTIVE,
    SUSPENDED
}
