package com.kreasipositif.wpsprocessor.compliance;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.InvalidStateTransitionException;
import com.kreasipositif.wpsprocessor.repository.ComplianceRecordRepository;
import com.kreasipositif.wpsprocessor.repository.ReferenceGenerator;
import com.kreasipositif.wpsprocessor.submission.Submission;
import com.kreasipositif.wpsprocessor.submission.SubmissionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes one compliance record per employer and salary period. A later successful submission
 * for the same period (e.g. a correction) replaces the figures and keeps the reference.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ComplianceRecordRepository repository;
    private final ReferenceGenerator references;
    private final Clock clock;

    public ComplianceRecord record(WpsBatch batch, Submission submission) {
        if (submission.getState() != SubmissionState.SUCCESS) {
            throw new InvalidStateTransitionException(
                    "Compliance is only recorded for successful submissions; %s is %s"
                            .formatted(submission.getReference(), submission.getState()));
        }
        List<WpsLine> lines = batch.getLines();
        int total = lines.size();
        int exempt = 0;
        List<WpsLine> paidLines = lines.stream()
                .filter(l -> l.getNetSalary() != null && l.getNetSalary().signum() > 0)
                .toList();
        int paid = paidLines.size();
        BigDecimal salaryDue = lines.stream().map(WpsLine::expectedNetSalary).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal salaryPaid = paidLines.stream().map(WpsLine::getNetSalary).reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal rate = complianceRate(paid, total, exempt);
        SalaryPeriod period = batch.getPeriod();
        LocalDate processedOn = LocalDate.now(clock);
        LocalDate deadline = period.submissionDeadline();

        String reference = repository.findByCompany(batch.getCompanyId(), period).stream()
                .findFirst()
                .map(ComplianceRecord::reference)
                .orElseGet(() -> references.next(ReferenceGenerator.COMPLIANCE));

        ComplianceRecord record = new ComplianceRecord(
                reference,
                batch.getCompanyId(),
                batch.getEmployerId(),
                period,
                batch.getReference(),
                submission.getReference(),
                total,
                paid,
                exempt,
                total - exempt - paid,
                salaryDue,
                salaryPaid,
                rate,
                ComplianceStatus.forRate(rate),
                deadline,
                processedOn,
                !processedOn.isAfter(deadline),
                Instant.now(clock));
        repository.save(record);
        log.info("Compliance {} for company {} period {}: {}/{} paid, rate {}% → {}{}",
                reference, batch.getCompanyId(), period, paid, total - exempt, rate, record.status(),
                record.onTime() ? "" : " (late)");
        return record;
    }

    public List<ComplianceRecord> find(String companyId, SalaryPeriod period) {
        return repository.findByCompany(companyId, period);
    }

    /** {@code paid / (total - exempt) * 100}; 100 when nobody is eligible. */
    static BigDecimal complianceRate(int paid, int total, int exempt) {
        int eligible = total - exempt;
        if (eligible <= 0) {
            return HUNDRED.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(paid)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(eligible), 2, RoundingMode.HALF_UP);
    }
}
