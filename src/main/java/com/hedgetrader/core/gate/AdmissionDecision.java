package com.hedgetrader.core.gate;

import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.model.Account;
import java.util.List;

/**
 * Result of the admission gate. When admitted, {@code selectedAccounts} holds exactly the
 * accounts to reserve, in leg order. When denied, {@code failedCondition} names the first
 * condition that failed.
 */
public record AdmissionDecision(
        boolean admitted, GateCondition failedCondition, String reason, List<Account> selectedAccounts) {

    public static AdmissionDecision admit(List<Account> selectedAccounts) {
        return new AdmissionDecision(true, null, null, List.copyOf(selectedAccounts));
    }

    public static AdmissionDecision deny(GateCondition condition, String reason) {
        return new AdmissionDecision(false, condition, reason, List.of());
    }
}
