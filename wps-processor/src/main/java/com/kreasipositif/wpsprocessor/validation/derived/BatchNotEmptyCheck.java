package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class BatchNotEmptyCheck implements DerivedCheck {

    @Override
    public String name() {
        return "batch-not-empty";
    }

    @Override
    public boolean lineLevel() {
        return false;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        return !context.lines().isEmpty();
    }
}
