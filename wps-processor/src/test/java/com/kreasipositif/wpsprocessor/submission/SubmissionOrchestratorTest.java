package com.kreasipositif.wpsprocessor.submission;

import com.kreasipositif.wpsprocessor.compliance.ComplianceRecord;
import com.kreasipositif.wpsprocessor.compliance.ComplianceService;
import com.kreasipositif.wpsprocessor.compliance.ComplianceStatus;
import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.domain.BatchState;
import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.ConnectionNotActiveException;
import com.kreasipositif.wpsprocessor.exception.DuplicateSubmissionException;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.exception.RetryExhaustedException;
import com.kreasipositif.wpsprocessor.exception.TransmissionException;
import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.repository.BankConnectionRepository;
import com.kreasipositif.wpsprocessor.repository.ComplianceRecordRepository;
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
import com.kreasipositif.wpsprocessor.validation.RuleScope;
import com.kreasipositif.wpsprocessor.validation.RuleType;
import com.kreasipositif.wpsprocessor.validation.Severity;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import com.kreasipositif.wpsprocessor.validation.ValidationResultLine;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Orchestrator behaviour with real repositories, codec and Resilience4j primitives; only the
 * validation gate and the bank connector are mocked.
 */
@ExtendWith(MockitoExtension.class)
class SubmissionOrchestratorTest {

    private static final String CONNECTION_ID = "ENBD-REST";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-10T08:00:00Z"), ZoneOffset.UTC);

    @Mock private BatchValidationService validationService;
    @Mock private BankConnectorRegistry connectorRegistry;
    @Mock private BankConnector connector;

    private final WpsBatchRepository batches = new WpsBatchRepository();
    private final SubmissionRepository submissions = new SubmissionRepository();
    private final BankConnectionRepository connections = new BankConnectionRepository();
    private final ComplianceRecordRepository complianceRecords = new ComplianceRecordRepository();
    private final ReferenceGenerator references = new ReferenceGenerator();
    private final SifCodec codec = new SifCodec();

    private ThreadPoolBulkhead bulkhead;
    private SubmissionOrchestrator orchestrator;
    private WpsBatch batch;

    @BeforeEach
    void setUp() {
        lenient().when(connectorRegistry.forProtocol(any())).thenReturn(connector);
        lenient().when(validationService.validate(any(), anyString()))
                .thenAnswer(inv -> ValidationResult.of(((WpsBatch) inv.getArgument(0)).getReference(), 1, List.of()));

        connections.save(connection(CONNECTION_ID, BankProtocol.REST, ConnectionState.ACTIVE));
        batch = batches.save(batch());
        orchestrator = orchestrator(Duration.ofSeconds(2), 2);
    }

    @AfterEach
    void tearDown() throws Exception {
        bulkhead.close();
    }

    // ─── Submit ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Accepted transmission: submission PROCESSING, batch SUBMITTED, payload hash fixed")
    void submit_accepted() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.accepted("BANK-REF-1", "000", "Received"));

        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        assertThat(submission.getState()).isEqualTo(SubmissionState.PROCESSING);
        assertThat(submission.getBankReference()).isEqualTo("BANK-REF-1");
        assertThat(batch.getState()).isEqualTo(BatchState.SUBMITTED);
        assertThat(submission.getFileName()).isEqualTo("WPS_1000012345_202609.SIF");
        assertThat(submission.getPayloadHash()).isEqualTo(SubmissionOrchestrator.sha256(batch.getSifContent()));

        ArgumentCaptor<TransmitRequest> sent = ArgumentCaptor.forClass(TransmitRequest.class);
        verify(connector).transmit(any(), sent.capture());
        assertThat(sent.getValue().content()).isEqualTo(batch.getSifContent());
        assertThat(sent.getValue().sha256()).isEqualTo(submission.getPayloadHash());
    }

    @Test
    @DisplayName("A refused transmission is a failed attempt: DRAFT with one retry used")
    void submit_refused() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.rejected("E100", "Malformed file"));

        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);
        assertThat(submission.getRetryCount()).isEqualTo(1);
        assertThat(submission.getLastError()).isEqualTo("E100: Malformed file");
        assertThat(batch.getState()).isEqualTo(BatchState.GENERATED);
    }

    @Test
    @DisplayName("Failures past the retry budget end in FAILED and raise RetryExhaustedException")
    void submit_retryExhausted() {
        when(connector.transmit(any(), any())).thenThrow(new TransmissionException("Connection refused"));

        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");
        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);

        assertThatThrownBy(() -> orchestrator.retry(submission.getReference(), "ops"))
                .isInstanceOfSatisfying(RetryExhaustedException.class, ex -> {
                    assertThat(ex.getRetryCount()).isEqualTo(2);
                    assertThat(ex.getLastError()).isEqualTo("Connection refused");
                });
        assertThat(submission.getState()).isEqualTo(SubmissionState.FAILED);
        assertThat(submission.getAttempts()).hasSize(2);
    }

    @Test
    @DisplayName("A connector call exceeding the time limit counts as a failed attempt")
    void submit_timeout() {
        orchestrator = orchestrator(Duration.ofMillis(150), 3);
        when(connector.transmit(any(), any())).thenAnswer(inv -> {
            Thread.sleep(1_000);
            return ConnectorResponse.accepted("TOO-LATE", "000", "Received");
        });

        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);
        assertThat(submission.getRetryCount()).isEqualTo(1);
        assertThat(submission.getLastError()).contains("timed out");
        assertThat(submission.getBankReference()).isNull();
    }

    @Test
    @DisplayName("Cancelling while the bank call is in flight discards the late acceptance")
    void cancelInFlight_discardsResult() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(connector.transmit(any(), any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return ConnectorResponse.accepted("BANK-REF-LATE", "000", "Received");
        });

        CompletableFuture<Submission> inFlight = CompletableFuture.supplyAsync(() ->
                orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops"));

        Submission submitted = awaitState(SubmissionState.SUBMITTED);
        orchestrator.cancel(submitted.getReference(), "ops");
        release.countDown();
        Submission result = inFlight.get(5, TimeUnit.SECONDS);

        assertThat(result.getState()).isEqualTo(SubmissionState.CANCELLED);
        assertThat(result.getBankReference()).isNull();
        assertThat(batch.getState()).isEqualTo(BatchState.GENERATED);
    }

    @Test
    @DisplayName("A second NEW submission for the same batch and connection is refused while the first is live")
    void submit_duplicateRefused() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.accepted("BANK-REF-1", "000", "Received"));
        orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        assertThatThrownBy(() -> orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops"))
                .isInstanceOf(DuplicateSubmissionException.class);
        assertThat(submissions.findByBatch(batch.getReference())).hasSize(1);
    }

    @Test
    @DisplayName("A connection that is not ACTIVE accepts nothing and records nothing")
    void submit_inactiveConnection() {
        connections.save(connection("FAB-SFTP", BankProtocol.SFTP, ConnectionState.SUSPENDED));

        assertThatThrownBy(() -> orchestrator.submit(batch.getReference(), "FAB-SFTP", SubmissionType.NEW, "ops"))
                .isInstanceOf(ConnectionNotActiveException.class);
        assertThat(submissions.findByBatch(batch.getReference())).isEmpty();
        verify(connector, never()).transmit(any(), any());
    }

    @Test
    @DisplayName("A blocking validation result stops the submission before encoding")
    void submit_validationBlocked() {
        ValidationResultLine failure = new ValidationResultLine("ROUTING_KNOWN", "Routing known", RuleType.REFERENCE,
                RuleScope.BANK_ACCOUNT, "bankCode", false, Severity.ERROR, "Unknown bank", null, 0, "EMP-1", null);
        doReturn(ValidationResult.of(batch.getReference(), 1, List.of(failure)))
                .when(validationService).validate(any(), anyString());

        assertThatThrownBy(() -> orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops"))
                .isInstanceOf(ValidationBlockedException.class);
        assertThat(batch.getState()).isEqualTo(BatchState.DRAFT);
        assertThat(submissions.findByBatch(batch.getReference())).isEmpty();
    }

    // ─── Status ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("A failing status call is transient and leaves the submission PROCESSING")
    void checkStatus_transientFailure() {
        Submission submission = acceptedSubmission();
        when(connector.checkStatus(any(), eq("BANK-REF-1"), anyString()))
                .thenThrow(new TransmissionException("502 Bad Gateway"));

        orchestrator.checkStatus(submission.getReference());

        assertThat(submission.getState()).isEqualTo(SubmissionState.PROCESSING);
        assertThat(submission.getLastStatusCheckAt()).isNotNull();
    }

    @Test
    @DisplayName("Bank success completes the submission, processes the batch and records compliance")
    void checkStatus_success() {
        Submission submission = acceptedSubmission();
        when(connector.checkStatus(any(), eq("BANK-REF-1"), anyString()))
                .thenReturn(new StatusResponse(BankStatus.SUCCESS, "000", "Salaries credited"));

        orchestrator.checkStatus(submission.getReference());

        assertThat(submission.getState()).isEqualTo(SubmissionState.SUCCESS);
        assertThat(batch.getState()).isEqualTo(BatchState.PROCESSED);
        List<ComplianceRecord> records = complianceRecords.findByCompany("TAZ-001", new SalaryPeriod(9, 2026));
        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(ComplianceStatus.COMPLIANT);
            assertThat(r.employeesPaid()).isEqualTo(2);
            assertThat(r.onTime()).isTrue();
            assertThat(r.submissionReference()).isEqualTo(submission.getReference());
        });
    }

    @Test
    @DisplayName("Bank rejection fails the submission and rejects the batch without using a retry")
    void checkStatus_rejected() {
        Submission submission = acceptedSubmission();
        when(connector.checkStatus(any(), eq("BANK-REF-1"), anyString()))
                .thenReturn(new StatusResponse(BankStatus.REJECTED, "E101", "Unknown account"));

        orchestrator.checkStatus(submission.getReference());

        assertThat(submission.getState()).isEqualTo(SubmissionState.FAILED);
        assertThat(submission.getRetryCount()).isZero();
        assertThat(submission.isTerminal()).isTrue();
        assertThat(batch.getState()).isEqualTo(BatchState.REJECTED);
    }

    @Test
    @DisplayName("Status checks on non-PROCESSING submissions change nothing")
    void checkStatus_idempotentOutsideProcessing() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.rejected("E100", "Malformed"));
        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        orchestrator.checkStatus(submission.getReference());

        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);
        verify(connector, never()).checkStatus(any(), any(), any());
    }

    @Test
    @DisplayName("Manual confirmation is only accepted for manual-portal connections")
    void confirmManual_onlyForPortal() {
        Submission submission = acceptedSubmission();

        assertThatThrownBy(() -> orchestrator.confirmManual(submission.getReference(), true, "X", null, "ops"))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Manual confirmation completes a portal submission")
    void confirmManual_completesPortalSubmission() {
        connections.save(connection("MOHRE-PORTAL", BankProtocol.MANUAL_PORTAL, ConnectionState.ACTIVE));
        when(connector.transmit(any(), any()))
                .thenReturn(ConnectorResponse.accepted("MANUAL-SUB", "PENDING", "Upload the file on the portal"));
        Submission submission = orchestrator.submit(batch.getReference(), "MOHRE-PORTAL", SubmissionType.NEW, "ops");

        orchestrator.confirmManual(submission.getReference(), true, "MOHRE-778812", null, "ops");

        assertThat(submission.getState()).isEqualTo(SubmissionState.SUCCESS);
        assertThat(batch.getState()).isEqualTo(BatchState.PROCESSED);
    }

    // ─── Retry ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("A submission rejected by the bank is never sent again, nor revived by a later status")
    void retry_refusedAfterBankRejection() {
        Submission submission = acceptedSubmission();
        when(connector.checkStatus(any(), eq("BANK-REF-1"), anyString()))
                .thenReturn(new StatusResponse(BankStatus.REJECTED, "E101", "Unknown account"));
        orchestrator.checkStatus(submission.getReference());

        assertThatThrownBy(() -> orchestrator.retry(submission.getReference(), "ops"))
                .isInstanceOf(InvalidStateTransitionException.class);
        orchestrator.checkStatus(submission.getReference());

        verify(connector, times(1)).transmit(any(), any());
        verify(connector, times(1)).checkStatus(any(), any(), any());
        assertThat(submission.getState()).isEqualTo(SubmissionState.FAILED);
        assertThat(submission.getAttempts()).hasSize(1);
        assertThat(batch.getState()).isEqualTo(BatchState.REJECTED);
        assertThat(complianceRecords.findByCompany("TAZ-001", new SalaryPeriod(9, 2026))).isEmpty();
    }

    @Test
    @DisplayName("A DRAFT submission of a cancelled batch cannot be retried")
    void retry_refusedWhenBatchCancelled() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.rejected("E100", "Malformed file"));
        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");
        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);

        batch.cancel();

        assertThatThrownBy(() -> orchestrator.retry(submission.getReference(), "ops"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("CANCELLED");
        verify(connector, times(1)).transmit(any(), any());
        assertThat(submission.getState()).isEqualTo(SubmissionState.DRAFT);
        assertThat(submission.getBankReference()).isNull();
    }

    @Test
    @DisplayName("A retry is refused once the batch's file no longer matches the submitted payload")
    void retry_refusedWhenBatchFileChanged() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.rejected("E100", "Malformed file"));
        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        batch.replaceLines(List.of(line("EMP-1", "784198512345671", "9000")));

        assertThatThrownBy(() -> orchestrator.retry(submission.getReference(), "ops"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("changed since");
        verify(connector, times(1)).transmit(any(), any());
    }

    @Test
    @DisplayName("A retry of a live batch resends the same payload")
    void retry_resendsSamePayload() {
        when(connector.transmit(any(), any()))
                .thenReturn(ConnectorResponse.rejected("E100", "Busy"))
                .thenReturn(ConnectorResponse.accepted("BANK-REF-2", "000", "Received"));
        Submission submission = orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");

        orchestrator.retry(submission.getReference(), "ops");

        assertThat(submission.getState()).isEqualTo(SubmissionState.PROCESSING);
        assertThat(submission.getBankReference()).isEqualTo("BANK-REF-2");
        ArgumentCaptor<TransmitRequest> sent = ArgumentCaptor.forClass(TransmitRequest.class);
        verify(connector, times(2)).transmit(any(), sent.capture());
        assertThat(sent.getAllValues()).extracting(TransmitRequest::sha256)
                .containsOnly(submission.getPayloadHash());
    }

    // ─── Locking ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Per-pair locks are stable and bounded however many batches pass through")
    void pairLocks_areBounded() {
        Set<ReentrantLock> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            seen.add(orchestrator.lockFor("WPS-2026-%05d".formatted(i), CONNECTION_ID));
        }

        assertThat(seen).hasSizeLessThanOrEqualTo(SubmissionOrchestrator.LOCK_STRIPES);
        assertThat(orchestrator.lockFor("WPS-2026-00042", CONNECTION_ID))
                .isSameAs(orchestrator.lockFor("WPS-2026-00042", CONNECTION_ID));
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    private SubmissionOrchestrator orchestrator(Duration timeout, int maxRetries) {
        if (bulkhead != null) {
            try {
                bulkhead.close();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        bulkhead = ThreadPoolBulkhead.ofDefaults("test-connector-pool");
        TimeLimiter limiter = TimeLimiter.of("test-time-limiter", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build());
        WpsProperties properties = new WpsProperties();
        properties.getSubmission().setMaxRetries(maxRetries);
        ComplianceService compliance = new ComplianceService(complianceRecords, references, CLOCK);
        return new SubmissionOrchestrator(batches, submissions, connections, validationService, codec,
                connectorRegistry, compliance, references, bulkhead, limiter, properties);
    }

    private Submission acceptedSubmission() {
        when(connector.transmit(any(), any())).thenReturn(ConnectorResponse.accepted("BANK-REF-1", "000", "Received"));
        return orchestrator.submit(batch.getReference(), CONNECTION_ID, SubmissionType.NEW, "ops");
    }

    private Submission awaitState(SubmissionState state) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            List<Submission> found = submissions.findByBatch(batch.getReference());
            if (!found.isEmpty() && found.get(0).getState() == state) {
                return found.get(0);
            }
            Thread.sleep(20);
        }
        throw new AssertionError("No submission reached " + state);
    }

    private static BankConnection connection(String id, BankProtocol protocol, ConnectionState state) {
        return new BankConnection(id, id, protocol, "http://localhost:8082", "1000012345", "302620122",
                new ConnectionCredentials("sandbox-key-001", "wps", "secret", null, null, "/inbound", "/outbound"),
                state, null);
    }

    private static WpsBatch batch() {
        return WpsBatch.builder()
                .reference("WPS-2026-00001")
                .companyId("TAZ-001")
                .employerId("1000012345")
                .employerBankCode("302620122")
                .employerAccount("AE070260001012345678901")
                .period(new SalaryPeriod(9, 2026))
                .salaryDate(LocalDate.of(2026, 9, 28))
                .lines(List.of(line("EMP-1", "784198512345671", "8000"), line("EMP-2", "784199023456782", "6000")))
                .build();
    }

    private static WpsLine line(String ref, String emiratesId, String basic) {
        WpsLine line = WpsLine.builder()
                .employeeRef(ref)
                .emiratesId(emiratesId)
                .bankCode("302620122")
                .accountNumber("1012345678901")
                .basicSalary(new BigDecimal(basic))
                .housingAllowance(new BigDecimal("2000"))
                .build();
        line.setNetSalary(line.expectedNetSalary());
        return line;
    }
}
