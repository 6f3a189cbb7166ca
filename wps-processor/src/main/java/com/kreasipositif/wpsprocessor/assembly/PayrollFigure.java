package com.kreasipositif.wpsprocessor.assembly;

import java.math.BigDecimal;

/**
 * Salary components of one employee for one month. Any component may be {@code null}
 * when the payroll run did not produce it.
 */
public record PayrollFigure(
        Integer daysWorked,
        BigDecimal basicSalary,
        BigDecimal housingAllowance,
        BigDecimal transportAllowance,
        BigDecimal otherAllowance,
        BigDecimal overtime,
        BigDecimal leaveSalary,
        BigDecimal deductions) {
}
