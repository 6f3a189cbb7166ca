package com.kreasipositif.wpsprocessor.repository;

import com.kreasipositif.wpsprocessor.domain.BatchState;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.exception.BatchNotFoundException;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class WpsBatchRepository {

    private final Map<String, WpsBatch> batches = new ConcurrentHashMap<>();

    public WpsBatch save(WpsBatch batch) {
        batches.put(batch.getReference(), batch);
        return batch;
    }

    public Optional<WpsBatch> findByReference(String reference) {
        return Optional.ofNullable(batches.get(reference));
    }

    public WpsBatch require(String reference) {
        return findByReference(reference)
                .orElseThrow(() -> new BatchNotFoundException("Batch not found: " + reference));
    }

    public List<WpsBatch> findAll() {
        return batches.values().stream()
                .sorted(Comparator.comparing(WpsBatch::getCreatedAt))
                .toList();
    }

    public List<WpsBatch> findByCompany(String companyId) {
        return findAll().stream()
                .filter(b -> b.getCompanyId() != null && b.getCompanyId().equals(companyId))
                .toList();
    }

    /** Other non-cancelled batches of the same company; the scope of file-level uniqueness rules. */
    public List<WpsBatch> findPeers(WpsBatch batch) {
        return findByCompany(batch.getCompanyId()).stream()
                .filter(b -> !b.getReference().equals(batch.getReference()))
                .filter(b -> b.getState() != BatchState.CANCELLED)
                .toList();
    }
}
