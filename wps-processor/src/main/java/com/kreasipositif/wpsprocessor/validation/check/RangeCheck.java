package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

import java.math.BigDecimal;

/**
 * Fails when the numeric field lies outside {@code [min, max]}. A {@code null} bound is not applied;
 * a {@code null} value passes. Non-numeric values raise {@link NumberFormatException}, which the
 * engine records as a failure.
 */
public record RangeCheck(String field, BigDecimal min, BigDecimal max) implements RuleCheck {

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        Object raw = target.field(field);
        if (raw == null) {
            return true;
        }
        BigDecimal value = Values.asDecimal(raw);
        if (min != null && value.compareTo(min) < 0) {
            return false;
        }
        return max == null || value.compareTo(max) <= 0;
    }
}
