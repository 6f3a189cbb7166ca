package com.kreasipositif.wpsprocessor.assembly;

import com.kreasipositif.wpsprocessor.client.BankDirectory;
import com.kreasipositif.wpsprocessor.domain.EmployerScope;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.NoEligibleEmployeesException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Builds one {@link WpsLine} per eligible employee of an employer scope.
 *
 * <p>Eligible means: inside the scope and holding an active contract. Banking identifiers come
 * from the employee's salary account; an employee without one still gets a line, with empty
 * bank fields, so that validation reports the gap. The routing code is the account's own, else
 * the registry routing code for the account's SWIFT code, else the SWIFT code itself.
 *
 * <p>Missing salary components become zero here, and net salary is computed once
 * ({@code gross - deductions}). Assembly is a pure function of its inputs: running it again
 * yields the same lines.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LineAssembler {

    static final int DEFAULT_DAYS_WORKED = 30;

    private final EmployeeDirectory employeeDirectory;
    private final PayrollFigures payrollFigures;
    private final BankDirectory bankDirectory;

    public List<WpsLine> assemble(EmployerScope scope) {
        List<EmployeeRecord> eligible = employeeDirectory.findEmployees(scope.companyId()).stream()
                .filter(EmployeeRecord::contractActive)
                .filter(e -> scope.includes(e.employeeRef()))
                .toList();

        if (eligible.isEmpty()) {
            throw new NoEligibleEmployeesException(
                    "No employees with an active contract found for company %s in %s"
                            .formatted(scope.companyId(), scope.period()));
        }

        List<WpsLine> lines = eligible.stream().map(e -> toLine(e, scope)).toList();
        log.info("Assembled {} line(s) for company {} period {}", lines.size(), scope.companyId(), scope.period());
        return lines;
    }

    private WpsLine toLine(EmployeeRecord employee, EmployerScope scope) {
        PayrollFigure figure = payrollFigures.figuresFor(employee.employeeRef(), scope.period())
                .orElseGet(() -> {
                    log.warn("No payroll figures for employee {} in {}; amounts default to zero",
                            employee.employeeRef(), scope.period());
                    return new PayrollFigure(null, null, null, null, null, null, null, null);
                });

        WpsLine line = WpsLine.builder()
                .employeeRef(employee.employeeRef())
                .employeeName(employee.name())
                .emiratesId(WpsLine.normalizeEmiratesId(employee.emiratesId()))
                .labourCardNo(employee.labourCardNo())
                .daysWorked(figure.daysWorked() != null ? figure.daysWorked() : DEFAULT_DAYS_WORKED)
                .basicSalary(nz(figure.basicSalary()))
                .housingAllowance(nz(figure.housingAllowance()))
                .transportAllowance(nz(figure.transportAllowance()))
                .otherAllowance(nz(figure.otherAllowance()))
                .overtime(nz(figure.overtime()))
                .leaveSalary(nz(figure.leaveSalary()))
                .deductions(nz(figure.deductions()))
                .build();

        BankAccountRecord account = employee.bankAccount();
        if (account != null) {
            line.setAccountNumber(account.accountNumber());
            line.setIban(account.iban());
            line.setBankCode(resolveRoutingCode(account));
        } else {
            log.debug("Employee {} has no salary account on file", employee.employeeRef());
        }

        line.setNetSalary(line.expectedNetSalary());
        return line;
    }

    private String resolveRoutingCode(BankAccountRecord account) {
        if (hasText(account.routingCode())) {
            return account.routingCode();
        }
        if (!hasText(account.swiftCode())) {
            return null;
        }
        return bankDirectory.routingCodeForSwift(account.swiftCode()).orElse(account.swiftCode());
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
