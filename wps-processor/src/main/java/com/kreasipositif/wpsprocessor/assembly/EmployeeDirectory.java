package com.kreasipositif.wpsprocessor.assembly;

import java.util.List;

/**
 * Employee master data of a company.
 */
public interface EmployeeDirectory {

    /** Every employee on file for the company, whatever their contract state. */
    List<EmployeeRecord> findEmployees(String companyId);
}
