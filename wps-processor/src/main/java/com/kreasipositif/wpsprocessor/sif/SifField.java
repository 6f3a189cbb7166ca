package com.kreasipositif.wpsprocessor.sif;

import org.springframework.batch.item.file.transform.Range;

/**
 * One fixed-width column of a SIF record.
 *
 * @param name    column name, used as the {@code FieldSet} key when decoding
 * @param start   1-based start position
 * @param width   column width in bytes
 * @param kind    how the value is padded
 * @param literal fixed content for {@link Kind#LITERAL} columns, otherwise {@code null}
 */
public record SifField(String name, int start, int width, Kind kind, String literal) {

    public enum Kind {
        /** Left-justified, space-padded, truncated on overflow. */
        TEXT,
        /** Right-justified, zero-padded; overflow is an error. */
        NUMERIC,
        /** Constant value such as the record type or currency code. */
        LITERAL
    }

    public int end() {
        return start + width - 1;
    }

    public Range range() {
        return new Range(start, end());
    }
}
