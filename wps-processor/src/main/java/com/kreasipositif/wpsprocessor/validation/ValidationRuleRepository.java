package com.kreasipositif.wpsprocessor.validation;

import java.util.List;

/**
 * Source of validation rules. Callers receive an immutable snapshot ordered by sequence,
 * so a rule change never affects an evaluation already in progress.
 */
public interface ValidationRuleRepository {

    List<ValidationRule> listActiveRules(RuleScope scope);

    /** Active rules of every scope. */
    List<ValidationRule> listActiveRules();
}
