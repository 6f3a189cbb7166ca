package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import com.kreasipositif.wpsprocessor.validation.derived.DerivedCheck;

import java.util.Map;

/**
 * Binds a named {@link DerivedCheck} to the parameters of one rule.
 */
public record DerivedRuleCheck(DerivedCheck check, Map<String, String> params) implements RuleCheck {

    public DerivedRuleCheck {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        return check.test(target, context, params);
    }
}
