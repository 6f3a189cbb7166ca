package com.kreasipositif.wpsprocessor.domain;

/**
 * Lifecycle of a {@link WpsBatch}.
 */
public enum BatchState {
    DRAFT,
    GENERATED,
    SUBMITTED,
    PROCESSED,
    REJECTED,
    CANCELLED
}
