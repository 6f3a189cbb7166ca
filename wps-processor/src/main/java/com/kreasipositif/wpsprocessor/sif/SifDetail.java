package com.kreasipositif.wpsprocessor.sif;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Decoded Salary Detail Record. {@code otherAllowance} is the combined column
 * (transport + other + overtime + leave salary).
 */
public record SifDetail(
        String employeeId,
        String bankCode,
        String account,
        LocalDate salaryDate,
        int daysWorked,
        BigDecimal netSalary,
        BigDecimal basicSalary,
        BigDecimal housingAllowance,
        BigDecimal otherAllowance,
        BigDecimal deductions) {
}
