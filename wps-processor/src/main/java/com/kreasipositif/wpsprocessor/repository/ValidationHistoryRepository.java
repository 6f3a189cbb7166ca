package com.kreasipositif.wpsprocessor.repository;

import com.kreasipositif.wpsprocessor.validation.ValidationRecord;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Append-only audit trail of validation runs, per batch, oldest first. */
@Repository
public class ValidationHistoryRepository {

    private final Map<String, List<ValidationRecord>> history = new ConcurrentHashMap<>();

    public void append(ValidationRecord record) {
        history.computeIfAbsent(record.batchReference(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    public List<ValidationRecord> findByBatch(String batchReference) {
        return List.copyOf(history.getOrDefault(batchReference, List.of()));
    }
}
