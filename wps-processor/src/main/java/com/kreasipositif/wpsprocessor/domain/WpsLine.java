package com.kreasipositif.wpsprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One employee's salary entry in a WPS batch; becomes one SDR in the SIF file.
 *
 * <p>All salary components default to zero so that optional allowances never need to be
 * null-checked downstream. {@code netSalary} is computed once by the line assembler (or supplied by
 * the caller) and is afterwards only validated against {@link #expectedNetSalary()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WpsLine {

    /** Internal employee reference (e.g. EMP-0001). */
    private String employeeRef;

    /** Employee full name, carried for reporting only. */
    private String employeeName;

    /** Emirates ID; preferred as the SDR employee identifier. */
    private String emiratesId;

    /** MOHRE labour card number; used when no Emirates ID is recorded. */
    private String labourCardNo;

    /** WPS routing code of the employee's bank (agent ID). */
    private String bankCode;

    /** Local account number at the employee's bank. */
    private String accountNumber;

    /** IBAN; used when no local account number is recorded. */
    private String iban;

    @Builder.Default
    private int daysWorked = 30;

    @Builder.Default
    private BigDecimal basicSalary = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal housingAllowance = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal transportAllowance = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal otherAllowance = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal overtime = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal leaveSalary = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal deductions = BigDecimal.ZERO;

    /** Amount actually credited to the employee. */
    @Builder.Default
    private BigDecimal netSalary = BigDecimal.ZERO;

    // ─── Derived values ──────────────────────────────────────────────────────

    /** Emirates ID, or the labour card number when the former is blank. */
    public String employeeIdentifier() {
        return hasText(emiratesId) ? emiratesId : labourCardNo;
    }

    /** Account number, or the IBAN when the former is blank. */
    public String accountIdentifier() {
        return hasText(accountNumber) ? accountNumber : iban;
    }

    public BigDecimal grossSalary() {
        return nz(basicSalary)
                .add(nz(housingAllowance))
                .add(nz(transportAllowance))
                .add(nz(otherAllowance))
                .add(nz(overtime))
                .add(nz(leaveSalary));
    }

    /** {@code gross - deductions}; what {@link #netSalary} must equal. */
    public BigDecimal expectedNetSalary() {
        return grossSalary().subtract(nz(deductions));
    }

    /** Value of the SDR "other allowance" column: transport + other + overtime + leave. */
    public BigDecimal sifOtherAllowance() {
        return nz(transportAllowance)
                .add(nz(otherAllowance))
                .add(nz(overtime))
                .add(nz(leaveSalary));
    }

    /**
     * Strips the dashes and spaces people write Emirates IDs with, so {@code 784-1985-1234567-1}
     * becomes the 15-digit {@code 784198512345671} that fits the SIF employee ID column.
     * Anything else is kept so that validation can still report it.
     */
    public static String normalizeEmiratesId(String raw) {
        if (raw == null) {
            return null;
        }
        String compact = raw.replaceAll("[\\s-]", "");
        return compact.isEmpty() ? null : compact;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
