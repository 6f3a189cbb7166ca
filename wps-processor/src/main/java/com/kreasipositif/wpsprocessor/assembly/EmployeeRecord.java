package com.kreasipositif.wpsprocessor.assembly;

/**
 * Employee master data the line assembler needs.
 *
 * @param contractActive whether the employee has a running employment contract
 * @param bankAccount    salary account, {@code null} when none is on file
 */
public record EmployeeRecord(
        String employeeRef,
        String name,
        String companyId,
        String emiratesId,
        String labourCardNo,
        boolean contractActive,
        BankAccountRecord bankAccount) {
}
