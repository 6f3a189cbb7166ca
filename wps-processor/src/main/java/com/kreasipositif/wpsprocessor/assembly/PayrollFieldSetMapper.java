package com.kreasipositif.wpsprocessor.assembly;

import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.stereotype.Component;
import org.springframework.validation.BindException;

import java.math.BigDecimal;

/**
 * Maps a parsed payroll register {@link FieldSet} to a {@link PayrollRegisterRow}.
 *
 * <p>Amount columns may be blank; a blank amount is read as {@code null} and resolved to zero
 * by the line assembler. A malformed amount is an error, not a zero.
 */
@Component
public class PayrollFieldSetMapper implements FieldSetMapper<PayrollRegisterRow> {

    static final String[] COLUMNS = {
            "companyId", "employeeRef", "employeeName", "emiratesId", "labourCardNo", "contractState",
            "accountNumber", "iban", "routingCode", "swiftCode", "period", "daysWorked",
            "basicSalary", "housingAllowance", "transportAllowance", "otherAllowance",
            "overtime", "leaveSalary", "deductions"
    };

    @Override
    public PayrollRegisterRow mapFieldSet(FieldSet fieldSet) throws BindException {
        String rawDays = text(fieldSet, "daysWorked");
        return PayrollRegisterRow.builder()
                .companyId(text(fieldSet, "companyId"))
                .employeeRef(text(fieldSet, "employeeRef"))
                .employeeName(text(fieldSet, "employeeName"))
                .emiratesId(text(fieldSet, "emiratesId"))
                .labourCardNo(text(fieldSet, "labourCardNo"))
                .contractState(text(fieldSet, "contractState"))
                .accountNumber(text(fieldSet, "accountNumber"))
                .iban(text(fieldSet, "iban"))
                .routingCode(text(fieldSet, "routingCode"))
                .swiftCode(text(fieldSet, "swiftCode"))
                .period(text(fieldSet, "period"))
                .daysWorked(rawDays.isEmpty() ? null : Integer.valueOf(rawDays))
                .basicSalary(amount(fieldSet, "basicSalary"))
                .housingAllowance(amount(fieldSet, "housingAllowance"))
                .transportAllowance(amount(fieldSet, "transportAllowance"))
                .otherAllowance(amount(fieldSet, "otherAllowance"))
                .overtime(amount(fieldSet, "overtime"))
                .leaveSalary(amount(fieldSet, "leaveSalary"))
                .deductions(amount(fieldSet, "deductions"))
                .build();
    }

    private static String text(FieldSet fieldSet, String name) {
        String value = fieldSet.readRawString(name);
        return value == null ? "" : value.trim();
    }

    private static BigDecimal amount(FieldSet fieldSet, String name) {
        String raw = text(fieldSet, name);
        return raw.isEmpty() ? null : new BigDecimal(raw);
    }
}
