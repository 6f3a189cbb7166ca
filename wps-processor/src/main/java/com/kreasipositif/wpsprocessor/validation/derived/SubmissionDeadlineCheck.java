package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * The batch is validated no later than the 15th of the month after its salary period.
 * The reference date comes from the {@code as-of} parameter, else the context, else today.
 */
@Component
public class SubmissionDeadlineCheck implements DerivedCheck {

    @Override
    public String name() {
        return "submission-deadline";
    }

    @Override
    public boolean lineLevel() {
        return false;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        if (target.batch().getPeriod() == null) {
            return false;
        }
        String asOfParam = params.get("as-of");
        LocalDate asOf = asOfParam != null ? LocalDate.parse(asOfParam)
                : context.asOf() != null ? context.asOf() : LocalDate.now();
        return !asOf.isAfter(target.batch().getPeriod().submissionDeadline());
    }
}
