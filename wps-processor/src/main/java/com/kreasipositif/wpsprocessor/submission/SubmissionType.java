package com.kreasipositif.wpsprocessor.submission;

public enum SubmissionType {
    NEW,
    CORRECTION,
    CANCELLATION
}
