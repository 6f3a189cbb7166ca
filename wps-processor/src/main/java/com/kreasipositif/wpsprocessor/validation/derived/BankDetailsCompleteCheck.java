package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Routing code and an account number or IBAN must both be present. */
@Component
public class BankDetailsCompleteCheck implements DerivedCheck {

    @Override
    public String name() {
        return "bank-details-complete";
    }

    @Override
    public boolean lineLevel() {
        return true;
    }

    @Override
    public boolean test(RuleTarget target, RuleContext context, Map<String, String> params) {
        String bankCode = target.line().getBankCode();
        String account = target.line().accountIdentifier();
        return bankCode != null && !bankCode.isBlank() && account != null && !account.isBlank();
    }
}
