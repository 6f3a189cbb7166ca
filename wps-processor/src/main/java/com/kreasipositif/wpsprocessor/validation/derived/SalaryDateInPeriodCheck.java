package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * The salary date must fall inside the salary month, or at most {@code grace-days} after it.
 */
@Component
public class SalaryDateInPeriodCheck implements DerivedCheck {

    @Override
    public String name() {
        return "salary-date-in-period";
    }

    @Override
    public boolean lineLevel() {
        return false;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        SalaryPeriod period = target.batch().getPeriod();
        LocalDate salaryDate = target.batch().getSalaryDate();
        if (period == null || salaryDate == null) {
            return false;
        }
        LocalDate latest = period.lastDay().plusDays(Params.integer(params, "grace-days", 0));
        return !salaryDate.isBefore(period.firstDay()) && !salaryDate.isAfter(latest);
    }
}
