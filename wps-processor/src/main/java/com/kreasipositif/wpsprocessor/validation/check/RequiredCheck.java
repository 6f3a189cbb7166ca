package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

/**
 * Fails when the field is null, blank or zero.
 */
public record RequiredCheck(String field) implements RuleCheck {

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        return !Values.isEmpty(target.field(field));
    }
}
