package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PositiveNetSalaryCheck implements DerivedCheck {

    @Override
    public String name() {
        return "positive-net-salary";
    }

    @Override
    public boolean lineLevel() {
        return true;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        return target.line().getNetSalary() != null && target.line().getNetSalary().signum() > 0;
    }
}
