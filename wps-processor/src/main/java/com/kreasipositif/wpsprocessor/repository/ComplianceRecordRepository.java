package com.kreasipositif.wpsprocessor.repository;

import com.kreasipositif.wpsprocessor.compliance.ComplianceRecord;
import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ComplianceRecordRepository {

    private final Map<String, ComplianceRecord> records = new ConcurrentHashMap<>();

    public ComplianceRecord save(ComplianceRecord record) {
        records.put(record.reference(), record);
        return record;
    }

    /**
     * @param period optional; {@code null} returns every period
     */
    public List<ComplianceRecord> findByCompany(String companyId, SalaryPeriod period) {
        return records.values().stream()
                .filter(r -> companyId == null || companyId.equals(r.companyId()))
                .filter(r -> period == null || period.equals(r.period()))
                .sorted(Comparator.comparing(ComplianceRecord::createdAt))
                .toList();
    }
}
