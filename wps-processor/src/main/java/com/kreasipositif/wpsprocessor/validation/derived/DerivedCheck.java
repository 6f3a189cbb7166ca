package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

import java.util.Map;

/**
 * A named calculation, business or compliance check that needs more than one field, sibling
 * lines or a reference date. Referenced from rule definitions by {@link #name()}.
 */
public interface DerivedCheck {

    String name();

    /** {@code true} for checks that inspect a line, {@code false} for checks on the batch header. */
    boolean lineLevel();

    boolean test(RuleTarget target, RuleContext context, Map<String, String> params);
}
