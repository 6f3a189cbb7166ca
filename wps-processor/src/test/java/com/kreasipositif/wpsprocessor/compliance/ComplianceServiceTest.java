package com.kreasipositif.wpsprocessor.compliance;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.repository.ComplianceRecordRepository;
import com.kreasipositif.wpsprocessor.repository.ReferenceGenerator;
import com.kreasipositif.wpsprocessor.submission.Submission;
import com.kreasipositif.wpsprocessor.submission.SubmissionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplianceServiceTest {

    private static final SalaryPeriod SEPTEMBER = new SalaryPeriod(9, 2026);

    private final ComplianceRecordRepository repository = new ComplianceRecordRepository();
    private final ReferenceGenerator references = new ReferenceGenerator();

    // ─── Rate ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Rate is paid over eligible employees, rounded to two decimals")
    void complianceRate_roundsHalfUp() {
        assertThat(ComplianceService.complianceRate(2, 3, 0)).isEqualByComparingTo("66.67");
        assertThat(ComplianceService.complianceRate(4, 5, 1)).isEqualByComparingTo("100.00");
        assertThat(ComplianceService.complianceRate(0, 0, 0)).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("Status thresholds: 100 compliant, 80 partial, below non-compliant")
    void status_thresholds() {
        assertThat(ComplianceStatus.forRate(new BigDecimal("100.00"))).isEqualTo(ComplianceStatus.COMPLIANT);
        assertThat(ComplianceStatus.forRate(new BigDecimal("80.00"))).isEqualTo(ComplianceStatus.PARTIAL);
        assertThat(ComplianceStatus.forRate(new BigDecimal("79.99"))).isEqualTo(ComplianceStatus.NON_COMPLIANT);
    }

    // ─── Record ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Employees with zero net pay count as not paid")
    void record_countsUnpaidEmployees() {
        ComplianceService service = service("2026-10-10T09:00:00Z");
        WpsBatch batch = batch(5, 1);

        ComplianceRecord record = service.record(batch, successful(batch));

        assertThat(record.employeesTotal()).isEqualTo(5);
        assertThat(record.employeesPaid()).isEqualTo(4);
        assertThat(record.employeesNotPaid()).isEqualTo(1);
        assertThat(record.complianceRate()).isEqualByComparingTo("80.00");
        assertThat(record.status()).isEqualTo(ComplianceStatus.PARTIAL);
        assertThat(record.salaryPaid()).isEqualByComparingTo("20000");
    }

    @Test
    @DisplayName("Processing after the 15th of the following month is late")
    void record_lateAfterDeadline() {
        ComplianceService service = service("2026-10-16T06:00:00Z");
        WpsBatch batch = batch(2, 0);

        ComplianceRecord record = service.record(batch, successful(batch));

        assertThat(record.submissionDeadline()).isEqualTo(LocalDate.of(2026, 10, 15));
        assertThat(record.processedOn()).isEqualTo(LocalDate.of(2026, 10, 16));
        assertThat(record.onTime()).isFalse();
    }

    @Test
    @DisplayName("A second successful submission for the period replaces the record and keeps its reference")
    void record_upsertsPerCompanyAndPeriod() {
        ComplianceService service = service("2026-10-10T09:00:00Z");
        WpsBatch first = batch(5, 2);
        ComplianceRecord initial = service.record(first, successful(first));

        WpsBatch correction = batch(5, 0);
        ComplianceRecord updated = service.record(correction, successful(correction));

        assertThat(updated.reference()).isEqualTo(initial.reference());
        assertThat(service.find("TAZ-001", SEPTEMBER)).singleElement()
                .satisfies(r -> assertThat(r.status()).isEqualTo(ComplianceStatus.COMPLIANT));
    }

    @Test
    @DisplayName("Only successful submissions produce a record")
    void record_requiresSuccess() {
        ComplianceService service = service("2026-10-10T09:00:00Z");
        WpsBatch batch = batch(1, 0);
        Submission pending = new Submission("SUB-1", batch.getReference(), "ENBD-REST", SubmissionType.NEW,
                "f.SIF", new byte[]{1}, "h", 3, "ops");

        assertThatThrownBy(() -> service.record(batch, pending))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(service.find("TAZ-001", SEPTEMBER)).isEmpty();
    }

    private ComplianceService service(String now) {
        return new ComplianceService(repository, references, Clock.fixed(Instant.parse(now), ZoneOffset.UTC));
    }

    private static WpsBatch batch(int employees, int unpaid) {
        List<WpsLine> lines = new ArrayList<>();
        for (int i = 0; i < employees; i++) {
            boolean paid = i >= unpaid;
            lines.add(WpsLine.builder()
                    .employeeRef("EMP-" + i)
                    .basicSalary(new BigDecimal("5000"))
                    .netSalary(paid ? new BigDecimal("5000") : BigDecimal.ZERO)
                    .build());
        }
        return WpsBatch.builder()
                .reference("WPS-2026-0000" + employees + unpaid)
                .companyId("TAZ-001")
                .employerId("1000012345")
                .employerAccount("AE070260001012345678901")
                .period(SEPTEMBER)
                .salaryDate(LocalDate.of(2026, 9, 28))
                .lines(lines)
                .build();
    }

    private static Submission successful(WpsBatch batch) {
        Submission submission = new Submission("SUB-" + batch.getReference(), batch.getReference(), "ENBD-REST",
                SubmissionType.NEW, "f.SIF", new byte[]{1}, "h", 3, "ops");
        submission.markSubmitted();
        submission.recordAccepted("BANK-1", "000", "Received");
        submission.recordSuccess("000", "Credited");
        return submission;
    }
}
