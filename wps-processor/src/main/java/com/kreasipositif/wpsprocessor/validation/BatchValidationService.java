package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.repository.ValidationHistoryRepository;
import com.kreasipositif.wpsprocessor.repository.WpsBatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs the configured rule set against a stored batch and keeps the outcome in the batch's
 * validation history. Peer batches of the same company feed file-level uniqueness rules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchValidationService {

    private final ValidationEngine engine;
    private final ValidationRuleRepository rules;
    private final ReferenceData referenceData;
    private final WpsBatchRepository batches;
    private final ValidationHistoryRepository history;
    private final Clock clock;

    public ValidationResult validate(WpsBatch batch, String actor) {
        RuleContext context = new RuleContext(
                batch.getLines(), batches.findPeers(batch), referenceData, LocalDate.now(clock));
        ValidationResult result = engine.evaluate(batch, rules.listActiveRules(), context);
        history.append(new ValidationRecord(batch.getReference(), Instant.now(clock), actor, result));
        return result;
    }

    public List<ValidationRecord> history(String batchReference) {
        return history.findByBatch(batchReference);
    }
}
