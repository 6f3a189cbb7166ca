package com.kreasipositif.wpsprocessor.submission.connector;

import com.kreasipositif.wpsprocessor.submission.SubmissionType;

/**
 * What a connector sends: the encoded SIF bytes plus the metadata banks ask for alongside it.
 */
public record TransmitRequest(
        String submissionReference,
        String fileName,
        byte[] content,
        String sha256,
        SubmissionType type) {

    public int size() {
        return content.length;
    }
}
