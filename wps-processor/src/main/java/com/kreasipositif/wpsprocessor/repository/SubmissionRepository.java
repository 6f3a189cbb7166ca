package com.kreasipositif.wpsprocessor.repository;

import com.kreasipositif.wpsprocessor.exception.SubmissionNotFoundException;
import com.kreasipositif.wpsprocessor.submission.Submission;
import com.kreasipositif.wpsprocessor.submission.SubmissionState;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class SubmissionRepository {

    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();

    public Submission save(Submission submission) {
        submissions.put(submission.getReference(), submission);
        return submission;
    }

    public Optional<Submission> findByReference(String reference) {
        return Optional.ofNullable(submissions.get(reference));
    }

    public Submission require(String reference) {
        return findByReference(reference)
                .orElseThrow(() -> new SubmissionNotFoundException("Submission not found: " + reference));
    }

    public List<Submission> findByBatch(String batchReference) {
        return submissions.values().stream()
                .filter(s -> s.getBatchReference().equals(batchReference))
                .sorted(Comparator.comparing(Submission::getCreatedAt))
                .toList();
    }

    public List<Submission> findByBatchAndConnection(String batchReference, String connectionId) {
        return findByBatch(batchReference).stream()
                .filter(s -> s.getConnectionId().equals(connectionId))
                .toList();
    }

    public List<Submission> findByState(SubmissionState state) {
        return submissions.values().stream()
                .filter(s -> s.getState() == state)
                .sorted(Comparator.comparing(Submission::getCreatedAt))
                .toList();
    }
}
