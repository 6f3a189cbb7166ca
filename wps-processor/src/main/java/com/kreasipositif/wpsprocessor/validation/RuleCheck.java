package com.kreasipositif.wpsprocessor.validation;

/**
 * Parameters and logic of one rule type. Implementations are immutable and never modify
 * the record they inspect.
 */
public interface RuleCheck {

    /**
     * @return {@code true} if the target passes
     */
    boolean test(RuleTarget target, RuleContext context);
}
