package com.kreasipositif.wpsprocessor.assembly;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the payroll register CSV: an employee's master data and salary figures for one month.
 *
 * <p>CSV column order:
 * <pre>
 *   Company ID, Employee Ref, Employee Name, Emirates ID, Labour Card No, Contract State,
 *   Account Number, IBAN, Routing Code, SWIFT Code, Period (YYYY-MM), Days Worked,
 *   Basic, Housing, Transport, Other, Overtime, Leave Salary, Deductions
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollRegisterRow {

    private String companyId;

    private String employeeRef;

    private String employeeName;

    private String emiratesId;

    private String labourCardNo;

    /** {@code OPEN} for a running contract; anything else makes the employee ineligible. */
    private String contractState;

    private String accountNumber;

    private String iban;

    private String routingCode;

    private String swiftCode;

    /** Salary month as {@code YYYY-MM}. */
    private String period;

    /** Blank when not recorded. */
    private Integer daysWorked;

    private BigDecimal basicSalary;

    private BigDecimal housingAllowance;

    private BigDecimal transportAllowance;

    private BigDecimal otherAllowance;

    private BigDecimal overtime;

    private BigDecimal leaveSalary;

    private BigDecimal deductions;
}
