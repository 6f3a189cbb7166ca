package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

/**
 * Fails when a non-empty field does not resolve in the named {@link com.kreasipositif.wpsprocessor.validation.ReferenceData}
 * collection.
 */
public record ReferenceCheck(String field, String collection) implements RuleCheck {

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        Object value = target.field(field);
        if (Values.isEmpty(value)) {
            return true;
        }
        return context.referenceData().contains(collection, Values.asText(value).trim());
    }
}
