package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only view a rule may consult besides its own record.
 *
 * @param lines         snapshot of every line in the batch, in order
 * @param peerBatches   other live batches of the same employer, for file-level uniqueness
 * @param referenceData lookup collections for REFERENCE rules
 * @param asOf          reference date for time-dependent compliance checks
 */
public record RuleContext(List<WpsLine> lines, List<WpsBatch> peerBatches,
                          ReferenceData referenceData, LocalDate asOf) {

    public RuleContext {
        lines = List.copyOf(lines);
        peerBatches = peerBatches == null ? List.of() : List.copyOf(peerBatches);
    }
}
