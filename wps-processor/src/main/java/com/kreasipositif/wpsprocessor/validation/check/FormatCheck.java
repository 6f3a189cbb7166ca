package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fails when a non-empty field does not match {@code pattern} at its start, or is outside
 * {@code allowedValues} when that set is configured. Empty values pass.
 */
public record FormatCheck(String field, Pattern pattern, Set<String> allowedValues) implements RuleCheck {

    public FormatCheck {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        Object value = target.field(field);
        if (Values.isEmpty(value)) {
            return true;
        }
        String text = Values.asText(value);
        if (pattern != null && !pattern.matcher(text).lookingAt()) {
            return false;
        }
        return allowedValues.isEmpty() || allowedValues.contains(text);
    }
}
