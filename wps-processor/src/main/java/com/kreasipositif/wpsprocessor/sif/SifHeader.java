package com.kreasipositif.wpsprocessor.sif;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;

import java.math.BigDecimal;

/**
 * Decoded Employer Detail Record.
 */
public record SifHeader(
        String employerId,
        String bankCode,
        String account,
        SalaryPeriod period,
        int recordCount,
        BigDecimal totalNetSalary) {
}
