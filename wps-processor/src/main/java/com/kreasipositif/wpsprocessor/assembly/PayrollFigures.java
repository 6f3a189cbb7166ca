package com.kreasipositif.wpsprocessor.assembly;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;

import java.util.Optional;

/**
 * Finalised payroll amounts per employee and month.
 */
public interface PayrollFigures {

    Optional<PayrollFigure> figuresFor(String employeeRef, SalaryPeriod period);
}
