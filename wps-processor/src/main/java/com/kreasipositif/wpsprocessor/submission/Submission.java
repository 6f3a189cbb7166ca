package com.kreasipositif.wpsprocessor.submission;

import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One attempt chain to deliver a batch's SIF file to one bank connection.
 *
 * <p>The payload, its SHA-256 and the connection settings are fixed when the submission is
 * created. All transitions are serialised on the instance; the {@code record*} methods return
 * {@code false} instead of failing when the submission was cancelled while a connector call was
 * in flight, so the late outcome can be discarded.
 */
@Getter
public class Submission {

    private final String reference;
    private final String batchReference;
    private final String connectionId;
    private final SubmissionType type;
    private final String fileName;
    private final byte[] payload;
    private final String payloadHash;
    private final int maxRetries;
    private final String submittedBy;
    private final Instant createdAt;

    private final List<SubmissionAttempt> attempts = new ArrayList<>();
    private SubmissionState state = SubmissionState.DRAFT;
    private String bankReference;
    private String responseCode;
    private String responseMessage;
    private int retryCount;
    private String lastError;
    private Instant submittedAt;
    private Instant completedAt;
    private Instant lastStatusCheckAt;
    private Instant updatedAt;

    private boolean rejectedByBank;
    private Instant attemptStartedAt;

    public Submission(String reference, String batchReference, String connectionId, SubmissionType type,
                      String fileName, byte[] payload, String payloadHash, int maxRetries, String submittedBy) {
        this.reference = reference;
        this.batchReference = batchReference;
        this.connectionId = connectionId;
        this.type = type;
        this.fileName = fileName;
        this.payload = payload.clone();
        this.payloadHash = payloadHash;
        this.maxRetries = maxRetries;
        this.submittedBy = submittedBy;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadSize() {
        return payload.length;
    }

    public synchronized SubmissionState getState() {
        return state;
    }

    public synchronized List<SubmissionAttempt> getAttempts() {
        return List.copyOf(attempts);
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    /** SUCCESS, CANCELLED, rejected by the bank, or FAILED with no retries left. */
    public synchronized boolean isTerminal() {
        return state == SubmissionState.SUCCESS
                || state == SubmissionState.CANCELLED
                || isFinallyFailed();
    }

    /** Counts toward the "one live NEW submission per batch and connection" rule. */
    public synchronized boolean isLive() {
        return state != SubmissionState.CANCELLED && !isFinallyFailed();
    }

    public synchronized boolean isRejectedByBank() {
        return rejectedByBank;
    }

    private boolean isFinallyFailed() {
        return state == SubmissionState.FAILED && (rejectedByBank || retryCount >= maxRetries);
    }

    // ─── Transitions ─────────────────────────────────────────────────────────

    public synchronized void markSubmitted() {
        requireState("submit", Set.of(SubmissionState.DRAFT));
        Instant now = Instant.now();
        this.attemptStartedAt = now;
        this.submittedAt = now;
        this.state = SubmissionState.SUBMITTED;
        this.updatedAt = now;
    }

    /**
     * The bank accepted the file for processing.
     *
     * @return {@code false} when the submission was cancelled meanwhile and nothing changed
     */
    public synchronized boolean recordAccepted(String bankReference, String code, String message) {
        if (state == SubmissionState.CANCELLED) {
            return false;
        }
        requireState("accept", Set.of(SubmissionState.SUBMITTED));
        closeAttempt(true, code, message);
        this.bankReference = bankReference;
        this.responseCode = code;
        this.responseMessage = message;
        this.state = SubmissionState.PROCESSING;
        return true;
    }

    /**
     * The attempt failed: increments the retry count and returns to DRAFT while budget remains,
     * otherwise moves to FAILED.
     *
     * @return the new state, or {@code null} when the submission was cancelled meanwhile
     */
    public synchronized SubmissionState recordAttemptFailure(String code, String error) {
        if (state == SubmissionState.CANCELLED) {
            return null;
        }
        requireState("fail", Set.of(SubmissionState.SUBMITTED));
        closeAttempt(false, code, error);
        this.retryCount++;
        this.lastError = error;
        this.responseCode = code;
        this.responseMessage = error;
        if (retryCount < maxRetries) {
            this.state = SubmissionState.DRAFT;
        } else {
            this.state = SubmissionState.FAILED;
            this.completedAt = updatedAt;
        }
        return state;
    }

    public synchronized boolean recordSuccess(String code, String message) {
        if (state == SubmissionState.CANCELLED) {
            return false;
        }
        requireState("complete", Set.of(SubmissionState.PROCESSING));
        this.responseCode = code;
        this.responseMessage = message;
        this.state = SubmissionState.SUCCESS;
        this.completedAt = Instant.now();
        this.updatedAt = completedAt;
        return true;
    }

    /**
     * The bank processed the file and rejected it. The submission is final: the same payload is
     * never sent again, a corrected batch goes out as a new submission.
     */
    public synchronized boolean recordBankRejection(String code, String message) {
        if (state == SubmissionState.CANCELLED) {
            return false;
        }
        requireState("reject", Set.of(SubmissionState.PROCESSING));
        this.responseCode = code;
        this.responseMessage = message;
        this.lastError = message;
        this.rejectedByBank = true;
        this.state = SubmissionState.FAILED;
        this.completedAt = Instant.now();
        this.updatedAt = completedAt;
        return true;
    }

    public synchronized void recordStatusCheck(String code, String message) {
        this.lastStatusCheckAt = Instant.now();
        if (code != null) {
            this.responseCode = code;
            this.responseMessage = message;
        }
        this.updatedAt = lastStatusCheckAt;
    }

    /** FAILED back to DRAFT; only while retries remain and the bank has not rejected the file. */
    public synchronized void resetForRetry() {
        if (state == SubmissionState.DRAFT) {
            return;
        }
        requireState("retry", Set.of(SubmissionState.FAILED));
        if (rejectedByBank) {
            throw new InvalidStateTransitionException(
                    "Submission %s was rejected by the bank; submit the corrected batch again".formatted(reference));
        }
        if (retryCount >= maxRetries) {
            throw new InvalidStateTransitionException(
                    "Submission %s has used all %d attempt(s)".formatted(reference, maxRetries));
        }
        this.completedAt = null;
        this.state = SubmissionState.DRAFT;
        this.updatedAt = Instant.now();
    }

    public synchronized void cancel() {
        if (isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Submission %s is %s and cannot be cancelled".formatted(reference, state));
        }
        if (state == SubmissionState.SUBMITTED && attemptStartedAt != null) {
            closeAttempt(false, "CANCELLED", "Cancelled while in flight");
        }
        this.state = SubmissionState.CANCELLED;
        this.completedAt = Instant.now();
        this.updatedAt = completedAt;
    }

    /**
     * Cancels unless already terminal.
     *
     * @return {@code true} when this call cancelled the submission
     */
    public synchronized boolean cancelIfOpen() {
        if (isTerminal()) {
            return false;
        }
        cancel();
        return true;
    }

    private void closeAttempt(boolean accepted, String code, String message) {
        Instant now = Instant.now();
        attempts.add(new SubmissionAttempt(attempts.size() + 1,
                attemptStartedAt == null ? now : attemptStartedAt, now, accepted, code, message));
        this.attemptStartedAt = null;
        this.updatedAt = now;
    }

    private void requireState(String action, Set<SubmissionState> allowed) {
        if (!allowed.contains(state)) {
            throw new InvalidStateTransitionException(
                    "Cannot %s submission %s in state %s (allowed: %s)".formatted(action, reference, state, allowed));
        }
    }
}
