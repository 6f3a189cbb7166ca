package com.kreasipositif.wpsprocessor.compliance;

import java.math.BigDecimal;

public enum ComplianceStatus {
    COMPLIANT,
    PARTIAL,
    NON_COMPLIANT;

    private static final BigDecimal FULL = BigDecimal.valueOf(100);
    private static final BigDecimal PARTIAL_THRESHOLD = BigDecimal.valueOf(80);

    /** 100% and above is compliant, 80% and above partial, anything lower non-compliant. */
    public static ComplianceStatus forRate(BigDecimal rate) {
        if (rate.compareTo(FULL) >= 0) {
            return COMPLIANT;
        }
        return rate.compareTo(PARTIAL_THRESHOLD) >= 0 ? PARTIAL : NON_COMPLIANT;
    }
}
