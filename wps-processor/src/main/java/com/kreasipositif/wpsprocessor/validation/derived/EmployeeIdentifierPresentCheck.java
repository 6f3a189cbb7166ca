package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Either an Emirates ID or a labour card number must be recorded. */
@Component
public class EmployeeIdentifierPresentCheck implements DerivedCheck {

    @Override
    public String name() {
        return "employee-identifier-present";
    }

    @Override
    public boolean lineLevel() {
        return true;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        String id = target.line().employeeIdentifier();
        return id != null && !id.isBlank();
    }
}
