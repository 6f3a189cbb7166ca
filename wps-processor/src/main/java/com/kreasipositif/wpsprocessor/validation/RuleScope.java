package com.kreasipositif.wpsprocessor.validation;

/**
 * What a rule is evaluated against. FILE rules run once against the batch header;
 * the other scopes run once per line.
 */
public enum RuleScope {
    FILE,
    LINE,
    EMPLOYEE,
    BANK_ACCOUNT;

    public boolean isPerLine() {
        return this != FILE;
    }
}
