package com.kreasipositif.wpsprocessor.exception;

import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import lombok.Getter;

/**
 * Raised when a batch fails at least one error-severity validation rule and therefore may not
 * be encoded or transmitted. The full result is attached so callers can report every failure.
 */
@Getter
public class ValidationBlockedException extends WpsException {

    private final String batchReference;
    private final ValidationResult result;

    public ValidationBlockedException(String batchReference, ValidationResult result) {
        super("Batch %s failed %d blocking validation rule(s)".formatted(batchReference, result.failedErrorCount()));
        this.batchReference = batchReference;
        this.result = result;
    }
}
