package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.InvalidRuleDefinitionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Names of the fields a rule may target, and how each is read. Rule definitions are checked
 * against these tables when they are built, so an evaluation never meets an unknown field.
 */
public final class RuleFields {

    private static final Map<String, Function<WpsLine, Object>> LINE = new LinkedHashMap<>();
    private static final Map<String, Function<WpsBatch, Object>> FILE = new LinkedHashMap<>();

    static {
        LINE.put("employeeRef", WpsLine::getEmployeeRef);
        LINE.put("employeeName", WpsLine::getEmployeeName);
        LINE.put("emiratesId", WpsLine::getEmiratesId);
        LINE.put("labourCardNo", WpsLine::getLabourCardNo);
        LINE.put("employeeId", WpsLine::employeeIdentifier);
        LINE.put("bankCode", WpsLine::getBankCode);
        LINE.put("accountNumber", WpsLine::getAccountNumber);
        LINE.put("iban", WpsLine::getIban);
        LINE.put("account", WpsLine::accountIdentifier);
        LINE.put("daysWorked", WpsLine::getDaysWorked);
        LINE.put("basicSalary", WpsLine::getBasicSalary);
        LINE.put("housingAllowance", WpsLine::getHousingAllowance);
        LINE.put("transportAllowance", WpsLine::getTransportAllowance);
        LINE.put("otherAllowance", WpsLine::getOtherAllowance);
        LINE.put("overtime", WpsLine::getOvertime);
        LINE.put("leaveSalary", WpsLine::getLeaveSalary);
        LINE.put("deductions", WpsLine::getDeductions);
        LINE.put("netSalary", WpsLine::getNetSalary);
        LINE.put("grossSalary", WpsLine::grossSalary);

        FILE.put("reference", WpsBatch::getReference);
        FILE.put("companyId", WpsBatch::getCompanyId);
        FILE.put("employerId", WpsBatch::getEmployerId);
        FILE.put("employerBankCode", WpsBatch::getEmployerBankCode);
        FILE.put("employerAccount", WpsBatch::getEmployerAccount);
        FILE.put("period", b -> b.getPeriod() == null ? null : b.getPeriod().toString());
        FILE.put("month", b -> b.getPeriod() == null ? null : b.getPeriod().month());
        FILE.put("year", b -> b.getPeriod() == null ? null : b.getPeriod().year());
        FILE.put("salaryDate", WpsBatch::getSalaryDate);
        FILE.put("fileType", b -> b.getFileType().name());
        FILE.put("employeeCount", WpsBatch::employeeCount);
        FILE.put("totalNetSalary", WpsBatch::totalNetSalary);
    }

    private RuleFields() {
    }

    public static Set<String> lineFields() {
        return LINE.keySet();
    }

    public static Set<String> fileFields() {
        return FILE.keySet();
    }

    public static void requireKnown(RuleScope scope, String field) {
        Set<String> known = scope.isPerLine() ? lineFields() : fileFields();
        if (field == null || !known.contains(field)) {
            throw new InvalidRuleDefinitionException(
                    "Unknown %s field '%s' (known: %s)".formatted(scope.isPerLine() ? "line" : "file", field, known));
        }
    }

    static Object readLine(WpsLine line, String field) {
        return LINE.get(field).apply(line);
    }

    static Object readFile(WpsBatch batch, String field) {
        return FILE.get(field).apply(batch);
    }
}
