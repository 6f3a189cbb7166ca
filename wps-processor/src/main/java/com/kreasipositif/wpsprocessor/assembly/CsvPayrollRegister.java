package com.kreasipositif.wpsprocessor.assembly;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.exception.WpsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link EmployeeDirectory} and {@link PayrollFigures} backed by a payroll register CSV exported
 * from the HR/payroll system ({@code wps.payroll-register}).
 *
 * <p>The file is read once, on first access, with a Spring Batch {@link FlatFileItemReader}.
 * An employee appears on one row per salary month; master data is taken from the last row.
 */
@Slf4j
@Component
public class CsvPayrollRegister implements EmployeeDirectory, PayrollFigures {

    private static final String OPEN_CONTRACT = "OPEN";

    private final ResourceLoader resourceLoader;
    private final PayrollFieldSetMapper fieldSetMapper;
    private final String location;

    private volatile List<PayrollRegisterRow> rows;

    public CsvPayrollRegister(ResourceLoader resourceLoader, PayrollFieldSetMapper fieldSetMapper,
                              WpsProperties properties) {
        this.resourceLoader = resourceLoader;
        this.fieldSetMapper = fieldSetMapper;
        this.location = properties.getPayrollRegister();
    }

    @Override
    public List<EmployeeRecord> findEmployees(String companyId) {
        Map<String, PayrollRegisterRow> latest = new LinkedHashMap<>();
        for (PayrollRegisterRow row : getRows()) {
            if (row.getCompanyId().equals(companyId)) {
                latest.put(row.getEmployeeRef(), row);
            }
        }
        return latest.values().stream().map(CsvPayrollRegister::toEmployee).toList();
    }

    @Override
    public Optional<PayrollFigure> figuresFor(String employeeRef, SalaryPeriod period) {
        String key = period.toString();
        return getRows().stream()
                .filter(r -> r.getEmployeeRef().equals(employeeRef) && key.equals(r.getPeriod()))
                .reduce((first, second) -> second)
                .map(r -> new PayrollFigure(
                        r.getDaysWorked(),
                        r.getBasicSalary(),
                        r.getHousingAllowance(),
                        r.getTransportAllowance(),
                        r.getOtherAllowance(),
                        r.getOvertime(),
                        r.getLeaveSalary(),
                        r.getDeductions()));
    }

    // ─── Internal helpers ────────────────────────────────────────────────────

    private static EmployeeRecord toEmployee(PayrollRegisterRow row) {
        boolean hasAccount = !row.getAccountNumber().isEmpty() || !row.getIban().isEmpty();
        BankAccountRecord account = hasAccount
                ? new BankAccountRecord(row.getAccountNumber(), row.getIban(), row.getRoutingCode(), row.getSwiftCode())
                : null;
        return new EmployeeRecord(
                row.getEmployeeRef(),
                row.getEmployeeName(),
                row.getCompanyId(),
                row.getEmiratesId(),
                row.getLabourCardNo(),
                OPEN_CONTRACT.equalsIgnoreCase(row.getContractState()),
                account);
    }

    /**
     * Returns (and lazily loads) the register rows.
     * Double-checked locking ensures the file is read only once even under concurrent access.
     */
    private List<PayrollRegisterRow> getRows() {
        if (rows == null) {
            synchronized (this) {
                if (rows == null) {
                    rows = load();
                    log.info("Payroll register '{}' loaded with {} rows", location, rows.size());
                }
            }
        }
        return rows;
    }

    private List<PayrollRegisterRow> load() {
        Resource resource = resourceLoader.getResource(location);
        FlatFileItemReader<PayrollRegisterRow> reader = new FlatFileItemReaderBuilder<PayrollRegisterRow>()
                .name("payrollRegisterReader")
                .resource(resource)
                .linesToSkip(1)
                .delimited()
                .delimiter(",")
                .names(PayrollFieldSetMapper.COLUMNS)
                .fieldSetMapper(fieldSetMapper)
                .build();

        List<PayrollRegisterRow> loaded = new ArrayList<>();
        try {
            reader.open(new ExecutionContext());
            PayrollRegisterRow row;
            while ((row = reader.read()) != null) {
                loaded.add(row);
            }
        } catch (Exception e) {
            throw new WpsException("Cannot read payroll register '%s': %s".formatted(location, e.getMessage()), e);
        } finally {
            reader.close();
        }
        return List.copyOf(loaded);
    }
}
