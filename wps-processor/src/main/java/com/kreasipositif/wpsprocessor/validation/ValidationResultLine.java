package com.kreasipositif.wpsprocessor.validation;

/**
 * Outcome of one rule against one record.
 *
 * @param recordIndex 0-based line index, {@code -1} for the batch header
 * @param detail      exception text when the check itself failed to run, otherwise {@code null}
 */
public record ValidationResultLine(
        String ruleCode,
        String ruleName,
        RuleType ruleType,
        RuleScope scope,
        String fieldName,
        boolean passed,
        Severity severity,
        String message,
        String helpText,
        int recordIndex,
        String recordName,
        String detail) {

    public boolean failedWith(Severity level) {
        return !passed && severity == level;
    }
}
