package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * net = basic + housing + transport + other + overtime + leave - deductions, within an optional
 * {@code tolerance} (default exact).
 */
@Component
public class NetSalaryReconciliationCheck implements DerivedCheck {

    @Override
    public String name() {
        return "net-salary-reconciliation";
    }

    @Override
    public boolean lineLevel() {
        return true;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        BigDecimal tolerance = Params.decimal(params, "tolerance", BigDecimal.ZERO);
        BigDecimal net = target.line().getNetSalary() == null ? BigDecimal.ZERO : target.line().getNetSalary();
        return net.subtract(target.line().expectedNetSalary()).abs().compareTo(tolerance) <= 0;
    }
}
