package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import org.springframework.stereotype.Component;

@Component
public class AccountAvailabilityCheck implements AdmissionCheck {

    @Override
    public GateCondition condition() {
        return GateCondition.ACCOUNT_AVAILABILITY;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        int available = context.getSelectedAccounts().size();
        int required = context.getPair().getRequiredAccounts();
        if (available < required) {
            return CheckResult.fail(
                    "Only " + available + " of " + required + " required accounts are available for "
                            + context.getPair().getBaseAmount());
        }
        return CheckResult.pass();
    }
}
