package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.model.Account;
import org.springframework.stereotype.Component;

/**
 * Fails when any of the pair's eligible accounts is locked. A locked account means a risk
 * halt or a failed unwind that needs an operator, so the whole pair waits.
 */
@Component
public class NoLockedAccountsCheck implements AdmissionCheck {

    @Override
    public GateCondition condition() {
        return GateCondition.NO_LOCKED_ACCOUNTS;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        return context.getEligibleAccounts().stream()
                .filter(Account::isLocked)
                .findFirst()
                .map(account -> CheckResult.fail(
                        "Account " + account.getAddress() + " is locked: " + account.getLockReason()))
                .orElseGet(CheckResult::pass);
    }
}
