package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Basic salary must reach the {@code minimum} parameter, pro-rated by days worked over
 * {@code month-days} (default 30) when {@code pro-rate=true}.
 */
@Component
public class MinimumBasicSalaryCheck implements DerivedCheck {

    @Override
    public String name() {
        return "minimum-basic-salary";
    }

    @Override
    public boolean lineLevel() {
        return true;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        BigDecimal minimum = Params.requiredDecimal(params, "minimum");
        if (Boolean.parseBoolean(params.getOrDefault("pro-rate", "false"))) {
            int monthDays = Params.integer(params, "month-days", 30);
            minimum = minimum.multiply(BigDecimal.valueOf(target.line().getDaysWorked()))
                    .divide(BigDecimal.valueOf(monthDays), 2, RoundingMode.HALF_UP);
        }
        BigDecimal basic = target.line().getBasicSalary() == null ? BigDecimal.ZERO : target.line().getBasicSalary();
        return basic.compareTo(minimum) >= 0;
    }
}
