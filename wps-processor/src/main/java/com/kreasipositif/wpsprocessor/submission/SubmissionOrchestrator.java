package com.kreasipositif.wpsprocessor.submission;

import com.kreasipositif.wpsprocessor.compliance.ComplianceService;
import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.domain.BatchState;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.exception.ConnectionNotActiveException;
import com.kreasipositif.wpsprocessor.exception.DuplicateSubmissionException;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.exception.RetryExhaustedException;
import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.repository.BankConnectionRepository;
import com.kreasipositif.wpsprocessor.repository.ReferenceGenerator;
import com.kreasipositif.wpsprocessor.repository.SubmissionRepository;
import com.kreasipositif.wpsprocessor.repository.WpsBatchRepository;
import com.kreasipositif.wpsprocessor.sif.SifCodec;
import com.kreasipositif.wpsprocessor.submission.connector.BankConnector;
import com.kreasipositif.wpsprocessor.submission.connector.BankConnectorRegistry;
import com.kreasipositif.wpsprocessor.submission.connector.BankStatus;
import com.kreasipositif.wpsprocessor.submission.connector.ConnectorResponse;
import com.kreasipositif.wpsprocessor.submission.connector.StatusResponse;
import com.kreasipositif.wpsprocessor.submission.connector.TransmitRequest;
import com.kreasipositif.wpsprocessor.validation.BatchValidationService;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives a batch's SIF file through a bank connection and tracks the resulting
 * {@link Submission}.
 *
 * <h3>Submitting</h3>
 * <ol>
 *   <li>The connection must be ACTIVE; otherwise nothing is recorded.</li>
 *   <li>The batch is re-validated; an ERROR-severity failure blocks before anything is encoded.</li>
 *   <li>The batch's generated file is reused when present, else encoded now. The payload's
 *       SHA-256 and size are fixed on the submission.</li>
 *   <li>The connector call runs on the connector thread-pool bulkhead under the transmit time
 *       limit. Acceptance moves the submission to PROCESSING and the batch to SUBMITTED.</li>
 *   <li>A refusal, an exception or a timeout is one failed attempt: the retry count goes up and
 *       the submission returns to DRAFT, or becomes FAILED once the budget is spent, which
 *       raises {@link RetryExhaustedException}.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * Submit and retry for the same (batch, connection) pair are serialised by one of a fixed set of
 * striped locks chosen by the pair's hash, so the lock set does not grow with the number of
 * batches; different connections proceed independently unless they happen to share a stripe. A timed-out call is left running; if it
 * completes after the submission was cancelled its outcome is logged and dropped.
 */
@Slf4j
@Service
public class SubmissionOrchestrator {

    private static final Set<BatchState> SUBMITTABLE =
            EnumSet.of(BatchState.DRAFT, BatchState.GENERATED, BatchState.SUBMITTED);

    private final WpsBatchRepository batches;
    private final SubmissionRepository submissions;
    private final BankConnectionRepository connections;
    private final BatchValidationService validationService;
    private final SifCodec sifCodec;
    private final BankConnectorRegistry connectors;
    private final ComplianceService complianceService;
    private final ReferenceGenerator references;
    private final ThreadPoolBulkhead connectorBulkhead;
    private final TimeLimiter connectorTimeLimiter;
    private final int maxRetries;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] pairLocks = new ReentrantLock[LOCK_STRIPES];

    public SubmissionOrchestrator(WpsBatchRepository batches,
                                  SubmissionRepository submissions,
                                  BankConnectionRepository connections,
                                  BatchValidationService validationService,
                                  SifCodec sifCodec,
                                  BankConnectorRegistry connectors,
                                  ComplianceService complianceService,
                                  ReferenceGenerator references,
                                  @Qualifier("bankConnectorThreadPoolBulkhead") ThreadPoolBulkhead connectorBulkhead,
                                  @Qualifier("bankConnectorTimeLimiter") TimeLimiter connectorTimeLimiter,
                                  WpsProperties properties) {
        this.batches = batches;
        this.submissions = submissions;
        this.connections = connections;
        this.validationService = validationService;
        this.sifCodec = sifCodec;
        this.connectors = connectors;
        this.complianceService = complianceService;
        this.references = references;
        this.connectorBulkhead = connectorBulkhead;
        this.connectorTimeLimiter = connectorTimeLimiter;
        this.maxRetries = properties.getSubmission().getMaxRetries();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            pairLocks[i] = new ReentrantLock();
        }
    }

    // ─── Submit ──────────────────────────────────────────────────────────────

    /**
     * @return the submission, PROCESSING when the bank accepted the file, DRAFT when the first
     *         attempt failed and retries remain
     * @throws ConnectionNotActiveException when the connection is not ACTIVE
     * @throws ValidationBlockedException   when validation reports an ERROR
     * @throws DuplicateSubmissionException when a NEW submission for the pair is still live or succeeded
     * @throws RetryExhaustedException      when the attempt failed and no retry is left
     */
    public Submission submit(String batchReference, String connectionId, SubmissionType type, String actor) {
        WpsBatch batch = batches.require(batchReference);
        BankConnection connection = requireActive(connectionId);

        ReentrantLock lock = lockFor(batchReference, connectionId);
        lock.lock();
        try {
            if (type == SubmissionType.NEW) {
                submissions.findByBatchAndConnection(batchReference, connectionId).stream()
                        .filter(Submission::isLive)
                        .findFirst()
                        .ifPresent(existing -> {
                            throw new DuplicateSubmissionException(
                                    "Batch %s already has submission %s (%s) on connection %s"
                                            .formatted(batchReference, existing.getReference(), existing.getState(), connectionId));
                        });
            }
            if (!SUBMITTABLE.contains(batch.getState())) {
                throw new InvalidStateTransitionException(
                        "Batch %s is %s and cannot be submitted".formatted(batchReference, batch.getState()));
            }

            ValidationResult validation = validationService.validate(batch, actor);
            if (!validation.canSubmit()) {
                throw new ValidationBlockedException(batchReference, validation);
            }

            if (!batch.hasGeneratedFile()) {
                batch.markGenerated(sifCodec.fileName(batch), sifCodec.encode(batch));
            }
            byte[] payload = batch.getSifContent();

            Submission submission = new Submission(
                    references.next(ReferenceGenerator.SUBMISSION),
                    batchReference,
                    connectionId,
                    type,
                    batch.getSifFileName(),
                    payload,
                    sha256(payload),
                    maxRetries,
                    actor);
            submissions.save(submission);
            log.info("Submission {} created for batch {} on {} ({}, {} bytes, sha256={})",
                    submission.getReference(), batchReference, connectionId, type, payload.length, submission.getPayloadHash());

            attempt(submission, batch, connection);
            return submission;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-attempts a DRAFT submission, or a FAILED one with retries left, with the same payload.
     *
     * @throws InvalidStateTransitionException when the batch is no longer submittable (cancelled,
     *         rejected, processed), its file changed since the submission was created, or the bank
     *         already rejected the submission
     */
    public Submission retry(String submissionReference, String actor) {
        Submission submission = submissions.require(submissionReference);
        BankConnection connection = requireActive(submission.getConnectionId());
        WpsBatch batch = batches.require(submission.getBatchReference());

        ReentrantLock lock = lockFor(submission.getBatchReference(), submission.getConnectionId());
        lock.lock();
        try {
            requireStillSubmittable(batch, submission);
            submission.resetForRetry();
            log.info("Retrying submission {} (attempt {} of {}) requested by {}",
                    submissionReference, submission.getRetryCount() + 1, submission.getMaxRetries(), actor);
            attempt(submission, batch, connection);
            return submission;
        } finally {
            lock.unlock();
        }
    }

    // ─── Status ──────────────────────────────────────────────────────────────

    /**
     * Asks the bank how a PROCESSING submission is doing. Idempotent; any other state is
     * returned unchanged. A failing status call is transient and leaves the submission as is.
     */
    public Submission checkStatus(String submissionReference) {
        Submission submission = submissions.require(submissionReference);
        if (submission.getState() != SubmissionState.PROCESSING) {
            return submission;
        }
        BankConnection connection = connections.require(submission.getConnectionId());
        BankConnector connector = connectors.forProtocol(connection.protocol());

        StatusResponse status;
        try {
            status = callConnector(() -> connector.checkStatus(
                    connection, submission.getBankReference(), submission.getFileName()));
        } catch (Exception e) {
            log.warn("Status check for submission {} failed, will retry later: {}", submissionReference, describe(e));
            submission.recordStatusCheck(null, null);
            return submission;
        }

        switch (status.status()) {
            case SUCCESS -> completeSuccess(submission, status.code(), status.message());
            case REJECTED -> completeRejection(submission, status.code(), status.message());
            case PROCESSING -> submission.recordStatusCheck(status.code(), status.message());
        }
        return submission;
    }

    /**
     * Records the outcome of a file uploaded by hand on a bank portal.
     */
    public Submission confirmManual(String submissionReference, boolean accepted, String bankReference,
                                    String message, String actor) {
        Submission submission = submissions.require(submissionReference);
        BankConnection connection = connections.require(submission.getConnectionId());
        if (connection.protocol() != BankProtocol.MANUAL_PORTAL) {
            throw new InvalidStateTransitionException(
                    "Submission %s goes through %s and cannot be confirmed by hand"
                            .formatted(submissionReference, connection.protocol()));
        }
        log.info("Manual confirmation of {} by {}: {} (bank ref {})",
                submissionReference, actor, accepted ? "ACCEPTED" : "REJECTED", bankReference);
        String note = message != null ? message : "Confirmed by " + actor;
        if (accepted) {
            completeSuccess(submission, bankReference, note);
        } else {
            completeRejection(submission, "MANUAL", note);
        }
        return submission;
    }

    public Submission cancel(String submissionReference, String actor) {
        Submission submission = submissions.require(submissionReference);
        submission.cancel();
        log.info("Submission {} cancelled by {}", submissionReference, actor);
        return submission;
    }

    // ─── Attempt ─────────────────────────────────────────────────────────────

    private void attempt(Submission submission, WpsBatch batch, BankConnection connection) {
        BankConnector connector = connectors.forProtocol(connection.protocol());
        TransmitRequest request = new TransmitRequest(
                submission.getReference(),
                submission.getFileName(),
                submission.getPayload(),
                submission.getPayloadHash(),
                submission.getType());

        submission.markSubmitted();
        ConnectorResponse response;
        try {
            response = callConnector(() -> connector.transmit(connection, request));
        } catch (Exception e) {
            fail(submission, "ERROR", describe(e));
            return;
        }

        if (!response.accepted()) {
            String error = response.responseCode() == null
                    ? String.valueOf(response.responseMessage())
                    : response.responseCode() + ": " + response.responseMessage();
            fail(submission, response.responseCode(), error);
            return;
        }

        if (!submission.recordAccepted(response.bankReference(), response.responseCode(), response.responseMessage())) {
            log.info("Submission {} was cancelled in flight; discarding bank acceptance {}",
                    submission.getReference(), response.bankReference());
            return;
        }
        if (batch.getState() == BatchState.GENERATED) {
            batch.markSubmitted();
        } else if (batch.getState() != BatchState.SUBMITTED) {
            log.warn("Batch {} is {} while submission {} was accepted; batch state left unchanged",
                    batch.getReference(), batch.getState(), submission.getReference());
        }
        log.info("Submission {} accepted by {} with reference {} ({})",
                submission.getReference(), connection.id(), response.bankReference(), response.responseCode());
    }

    private void fail(Submission submission, String code, String error) {
        SubmissionState outcome = submission.recordAttemptFailure(code, error);
        if (outcome == null) {
            log.info("Submission {} was cancelled in flight; discarding failure: {}", submission.getReference(), error);
            return;
        }
        log.warn("Submission {} attempt {}/{} failed: {}",
                submission.getReference(), submission.getRetryCount(), submission.getMaxRetries(), error);
        if (outcome == SubmissionState.FAILED) {
            throw new RetryExhaustedException(submission.getReference(), submission.getRetryCount(),
                    submission.getLastError(), submission.getCreatedAt(), submission.getCompletedAt());
        }
    }

    private void completeSuccess(Submission submission, String code, String message) {
        if (!submission.recordSuccess(code, message)) {
            log.info("Submission {} was cancelled; ignoring bank success", submission.getReference());
            return;
        }
        WpsBatch batch = batches.require(submission.getBatchReference());
        if (batch.getState() == BatchState.SUBMITTED) {
            batch.markProcessed();
        } else {
            log.warn("Batch {} is {} when submission {} succeeded; batch state left unchanged",
                    batch.getReference(), batch.getState(), submission.getReference());
        }
        complianceService.record(batch, submission);
        log.info("Submission {} processed by the bank ({}: {})", submission.getReference(), code, message);
    }

    private void completeRejection(Submission submission, String code, String message) {
        if (!submission.recordBankRejection(code, message)) {
            log.info("Submission {} was cancelled; ignoring bank rejection", submission.getReference());
            return;
        }
        WpsBatch batch = batches.require(submission.getBatchReference());
        if (batch.getState() == BatchState.SUBMITTED) {
            batch.markRejected();
        }
        log.warn("Submission {} rejected by the bank ({}: {})", submission.getReference(), code, message);
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    /**
     * Runs a connector call on the connector bulkhead, bounded by the time limiter. The limiter
     * does not cancel the running call.
     */
    private <T> T callConnector(Supplier<T> call) throws Exception {
        return connectorTimeLimiter
                .decorateFutureSupplier(() -> connectorBulkhead.executeSupplier(call).toCompletableFuture())
                .call();
    }

    private String describe(Throwable e) {
        if (e instanceof CompletionException && e.getCause() != null) {
            return describe(e.getCause());
        }
        if (e instanceof TimeoutException) {
            return "Transmission timed out after " + connectorTimeLimiter.getTimeLimiterConfig().getTimeoutDuration();
        }
        if (e instanceof BulkheadFullException) {
            return "Connector pool is saturated: " + e.getMessage();
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return "Interrupted while waiting for the bank";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private BankConnection requireActive(String connectionId) {
        BankConnection connection = connections.require(connectionId);
        if (!connection.isActive()) {
            throw new ConnectionNotActiveException(
                    "Connection %s is %s; only ACTIVE connections accept submissions".formatted(connectionId, connection.state()));
        }
        return connection;
    }

    private void requireStillSubmittable(WpsBatch batch, Submission submission) {
        if (!SUBMITTABLE.contains(batch.getState())) {
            throw new InvalidStateTransitionException("Batch %s is %s; submission %s cannot be retried"
                    .formatted(batch.getReference(), batch.getState(), submission.getReference()));
        }
        byte[] current = batch.getSifContent();
        if (!batch.hasGeneratedFile() || current == null || !sha256(current).equals(submission.getPayloadHash())) {
            throw new InvalidStateTransitionException(
                    "Batch %s changed since submission %s was created; submit it again"
                            .formatted(batch.getReference(), submission.getReference()));
        }
    }

    ReentrantLock lockFor(String batchReference, String connectionId) {
        return pairLocks[Math.floorMod((batchReference + "|" + connectionId).hashCode(), LOCK_STRIPES)];
    }

    static String sha256(byte[] payload) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
