package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.exception.InvalidRuleDefinitionException;
import com.kreasipositif.wpsprocessor.validation.check.DerivedRuleCheck;
import com.kreasipositif.wpsprocessor.validation.check.FormatCheck;
import com.kreasipositif.wpsprocessor.validation.check.RangeCheck;
import com.kreasipositif.wpsprocessor.validation.check.ReferenceCheck;
import com.kreasipositif.wpsprocessor.validation.check.RequiredCheck;
import com.kreasipositif.wpsprocessor.validation.check.UniqueCheck;
import com.kreasipositif.wpsprocessor.validation.derived.DerivedCheck;
import com.kreasipositif.wpsprocessor.validation.derived.DerivedCheckRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns {@link ValidationRuleDefinition}s into executable {@link ValidationRule}s, rejecting
 * definitions that name unknown fields or checks, or lack the parameters their type needs.
 */
@Component
@RequiredArgsConstructor
public class ValidationRuleFactory {

    private final DerivedCheckRegistry derivedChecks;

    public List<ValidationRule> build(List<ValidationRuleDefinition> definitions) {
        Set<String> codes = new HashSet<>();
        for (ValidationRuleDefinition definition : definitions) {
            if (!codes.add(definition.getCode())) {
                throw new InvalidRuleDefinitionException("Duplicate rule code '%s'".formatted(definition.getCode()));
            }
        }
        return definitions.stream().map(this::build).toList();
    }

    public ValidationRule build(ValidationRuleDefinition d) {
        if (d.getCode() == null || d.getCode().isBlank()) {
            throw new InvalidRuleDefinitionException("Rule code is required");
        }
        if (d.getType() == null || d.getScope() == null) {
            throw new InvalidRuleDefinitionException("Rule '%s' needs a type and a scope".formatted(d.getCode()));
        }

        RuleCheck check = d.getType().isDerived() ? derived(d) : fieldCheck(d);

        return ValidationRule.builder()
                .code(d.getCode())
                .name(d.getName() != null ? d.getName() : d.getCode())
                .sequence(d.getSequence())
                .type(d.getType())
                .scope(d.getScope())
                .fieldName(d.getField())
                .check(check)
                .severity(d.getSeverity())
                .message(d.getMessage() != null ? d.getMessage() : "Rule %s failed".formatted(d.getCode()))
                .helpText(d.getHelpText())
                .active(d.isActive())
                .build();
    }

    private RuleCheck fieldCheck(ValidationRuleDefinition d) {
        RuleFields.requireKnown(d.getScope(), d.getField());
        String field = d.getField();
        return switch (d.getType()) {
            case REQUIRED -> new RequiredCheck(field);
            case UNIQUE -> new UniqueCheck(field);
            case FORMAT -> {
                boolean hasAllowed = d.getAllowedValues() != null && !d.getAllowedValues().isEmpty();
                if (d.getPattern() == null && !hasAllowed) {
                    throw invalid(d, "a FORMAT rule needs a pattern or allowed values");
                }
                yield new FormatCheck(field, compile(d), hasAllowed ? Set.copyOf(d.getAllowedValues()) : Set.of());
            }
            case RANGE -> {
                if (d.getMin() == null && d.getMax() == null) {
                    throw invalid(d, "a RANGE rule needs a min or a max");
                }
                if (d.getMin() != null && d.getMax() != null && d.getMin().compareTo(d.getMax()) > 0) {
                    throw invalid(d, "min is greater than max");
                }
                yield new RangeCheck(field, d.getMin(), d.getMax());
            }
            case REFERENCE -> {
                if (d.getReferenceCollection() == null || d.getReferenceCollection().isBlank()) {
                    throw invalid(d, "a REFERENCE rule needs a reference collection");
                }
                yield new ReferenceCheck(field, d.getReferenceCollection());
            }
            default -> throw invalid(d, "unsupported field rule type " + d.getType());
        };
    }

    private RuleCheck derived(ValidationRuleDefinition d) {
        if (d.getCheck() == null || d.getCheck().isBlank()) {
            throw invalid(d, "a %s rule needs a derived check name".formatted(d.getType()));
        }
        DerivedCheck check = derivedChecks.require(d.getCheck());
        if (check.lineLevel() != d.getScope().isPerLine()) {
            throw invalid(d, "check '%s' does not apply to scope %s".formatted(check.name(), d.getScope()));
        }
        return new DerivedRuleCheck(check, d.getParams());
    }

    private static Pattern compile(ValidationRuleDefinition d) {
        if (d.getPattern() == null) {
            return null;
        }
        try {
            return Pattern.compile(d.getPattern());
        } catch (PatternSyntaxException e) {
            throw invalid(d, "invalid pattern: " + e.getDescription());
        }
    }

    private static InvalidRuleDefinitionException invalid(ValidationRuleDefinition d, String reason) {
        return new InvalidRuleDefinitionException("Rule '%s': %s".formatted(d.getCode(), reason));
    }
}
