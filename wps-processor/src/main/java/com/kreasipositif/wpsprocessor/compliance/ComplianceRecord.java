package com.kreasipositif.wpsprocessor.compliance;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Monthly WPS compliance evidence for one employer, written when a submission succeeds.
 *
 * @param employeesExempt employees outside WPS (e.g. domestic workers); excluded from the rate
 * @param complianceRate  {@code paid / (total - exempt) * 100}, two decimals
 * @param onTime          processed on or before {@link #submissionDeadline}
 */
public record ComplianceRecord(
        String reference,
        String companyId,
        String employerId,
        SalaryPeriod period,
        String batchReference,
        String submissionReference,
        int employeesTotal,
        int employeesPaid,
        int employeesExempt,
        int employeesNotPaid,
        BigDecimal salaryDue,
        BigDecimal salaryPaid,
        BigDecimal complianceRate,
        ComplianceStatus status,
        LocalDate submissionDeadline,
        LocalDate processedOn,
        boolean onTime,
        Instant createdAt) {

    public BigDecimal salaryVariance() {
        return salaryDue.subtract(salaryPaid);
    }
}
