package com.kreasipositif.wpsprocessor.validation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative form of a rule, as bound from {@code wps.validation.rules} in application.yml or
 * received on the rules API.
 *
 * <p>Which parameters apply depends on {@link #type}:
 * <pre>
 *   FORMAT     field, pattern and/or allowedValues
 *   RANGE      field, min and/or max
 *   REQUIRED   field
 *   UNIQUE     field
 *   REFERENCE  field, referenceCollection
 *   CALCULATION / BUSINESS / COMPLIANCE   check (+ params)
 * </pre>
 */
@Getter
@Setter
@NoArgsConstructor
public class ValidationRuleDefinition {

    @NotBlank
    private String code;

    @NotBlank
    private String name;

    private int sequence = 10;

    @NotNull
    private RuleType type;

    @NotNull
    private RuleScope scope;

    private String field;

    private String pattern;

    private BigDecimal min;

    private BigDecimal max;

    private List<String> allowedValues;

    private String referenceCollection;

    /** Name of the derived check for CALCULATION, BUSINESS and COMPLIANCE rules. */
    private String check;

    private Map<String, String> params = new LinkedHashMap<>();

    private Severity severity = Severity.ERROR;

    @NotBlank
    private String message;

    private String helpText;

    private boolean active = true;
}
