package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;

/**
 * The record a rule is evaluated against: the batch header, or one of its lines.
 *
 * @param batch     owning batch (always present)
 * @param line      line under check, {@code null} for file-scoped rules
 * @param lineIndex 0-based position of {@code line}, {@code -1} for file-scoped rules
 */
public record RuleTarget(WpsBatch batch, WpsLine line, int lineIndex) {

    public static RuleTarget file(WpsBatch batch) {
        return new RuleTarget(batch, null, -1);
    }

    public static RuleTarget line(WpsBatch batch, WpsLine line, int lineIndex) {
        return new RuleTarget(batch, line, lineIndex);
    }

    public boolean isLine() {
        return line != null;
    }

    /** Reads a named field through {@link RuleFields}. */
    public Object field(String name) {
        return isLine() ? RuleFields.readLine(line, name) : RuleFields.readFile(batch, name);
    }

    public String displayName() {
        if (!isLine()) {
            return batch.getReference();
        }
        return line.getEmployeeName() != null ? line.getEmployeeName() : line.getEmployeeRef();
    }
}
