package com.kreasipositif.wpsprocessor.validation;

import java.util.List;

/**
 * Outcome of evaluating every active rule against one batch.
 *
 * <p>File-scoped rules contribute a line whether they pass or fail; line-scoped rules only
 * contribute their failures. {@code canSubmit} is {@code true} exactly when no ERROR-severity
 * rule failed. Contains no timestamps, so two evaluations of an unchanged batch are equal.
 */
public record ValidationResult(
        String batchReference,
        int totalChecks,
        int passedChecks,
        int failedErrorCount,
        int warningCount,
        int infoCount,
        ValidationStatus status,
        boolean canSubmit,
        List<ValidationResultLine> lines) {

    public ValidationResult {
        lines = List.copyOf(lines);
    }

    public static ValidationResult of(String batchReference, int totalChecks, List<ValidationResultLine> lines) {
        int errors = count(lines, Severity.ERROR);
        int warnings = count(lines, Severity.WARNING);
        int infos = count(lines, Severity.INFO);
        ValidationStatus status = errors > 0 ? ValidationStatus.INVALID
                : warnings > 0 ? ValidationStatus.WARNING
                : ValidationStatus.VALID;
        return new ValidationResult(batchReference, totalChecks, totalChecks - errors - warnings - infos,
                errors, warnings, infos, status, errors == 0, lines);
    }

    public List<ValidationResultLine> failures() {
        return lines.stream().filter(l -> !l.passed()).toList();
    }

    private static int count(List<ValidationResultLine> lines, Severity severity) {
        return (int) lines.stream().filter(l -> l.failedWith(severity)).count();
    }
}
