package com.kreasipositif.wpsprocessor.validation;

import java.time.Instant;

/**
 * Audit entry for one validation run.
 */
public record ValidationRecord(String batchReference, Instant validatedAt, String actor, ValidationResult result) {
}
