package com.kreasipositif.wpsprocessor.validation;

/**
 * Kind of check a {@link ValidationRule} performs. The last three delegate to a named
 * {@link com.kreasipositif.wpsprocessor.validation.derived.DerivedCheck}.
 */
public enum RuleType {
    FORMAT,
    RANGE,
    REQUIRED,
    UNIQUE,
    REFERENCE,
    CALCULATION,
    BUSINESS,
    COMPLIANCE;

    public boolean isDerived() {
        return this == CALCULATION || this == BUSINESS || this == COMPLIANCE;
    }
}
