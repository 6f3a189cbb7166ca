package com.kreasipositif.wpsprocessor.dto;

import com.kreasipositif.wpsprocessor.submission.Submission;
import com.kreasipositif.wpsprocessor.submission.SubmissionAttempt;
import com.kreasipositif.wpsprocessor.submission.SubmissionState;
import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Submission without its payload; the file itself is downloaded from the batch.
 */
@Getter
@Builder
@Schema(description = "Transmission of a batch's SIF file to one bank connection")
public class SubmissionResponse {

    @Schema(example = "SUB-2026-00001")
    private final String reference;
    private final String batchReference;
    private final String connectionId;
    private final SubmissionType type;
    private final SubmissionState state;
    private final String fileName;
    private final String payloadHash;
    private final int payloadSize;
    private final String bankReference;
    private final String responseCode;
    private final String responseMessage;
    private final int retryCount;
    private final int maxRetries;
    private final String lastError;
    private final String submittedBy;
    private final Instant createdAt;
    private final Instant submittedAt;
    private final Instant completedAt;
    private final Instant lastStatusCheckAt;
    private final List<SubmissionAttempt> attempts;

    public static SubmissionResponse from(Submission submission) {
        synchronized (submission) {
            return SubmissionResponse.builder()
                    .reference(submission.getReference())
                    .batchReference(submission.getBatchReference())
                    .connectionId(submission.getConnectionId())
                    .type(submission.getType())
                    .state(submission.getState())
                    .fileName(submission.getFileName())
                    .payloadHash(submission.getPayloadHash())
                    .payloadSize(submission.getPayloadSize())
                    .bankReference(submission.getBankReference())
                    .responseCode(submission.getResponseCode())
                    .responseMessage(submission.getResponseMessage())
                    .retryCount(submission.getRetryCount())
                    .maxRetries(submission.getMaxRetries())
                    .lastError(submission.getLastError())
                    .submittedBy(submission.getSubmittedBy())
                    .createdAt(submission.getCreatedAt())
                    .submittedAt(submission.getSubmittedAt())
                    .completedAt(submission.getCompletedAt())
                    .lastStatusCheckAt(submission.getLastStatusCheckAt())
                    .attempts(submission.getAttempts())
                    .build();
        }
    }
}
