package com.kreasipositif.wpsprocessor.domain;

import java.util.Set;

/**
 * Which employees a line assembly run covers.
 *
 * @param companyId    employer whose workforce is assembled
 * @param period       salary month being paid
 * @param employeeRefs explicit subset of employee references; empty means the whole workforce
 */
public record EmployerScope(String companyId, SalaryPeriod period, Set<String> employeeRefs) {

    public EmployerScope {
        employeeRefs = employeeRefs == null ? Set.of() : Set.copyOf(employeeRefs);
    }

    public static EmployerScope wholeCompany(String companyId, SalaryPeriod period) {
        return new EmployerScope(companyId, period, Set.of());
    }

    public boolean includes(String employeeRef) {
        return employeeRefs.isEmpty() || employeeRefs.contains(employeeRef);
    }
}
