package com.kreasipositif.wpsprocessor.validation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A reusable declarative check. Built by {@link ValidationRuleFactory} from a
 * {@link ValidationRuleDefinition}; immutable once built.
 */
@Getter
@Builder
@ToString(exclude = "check")
public class ValidationRule {

    private final String code;
    private final String name;
    private final int sequence;
    private final RuleType type;
    private final RuleScope scope;
    /** Target field; {@code null} for derived checks that read several fields. */
    private final String fieldName;
    private final RuleCheck check;
    private final Severity severity;
    private final String message;
    private final String helpText;
    private final boolean active;
}
