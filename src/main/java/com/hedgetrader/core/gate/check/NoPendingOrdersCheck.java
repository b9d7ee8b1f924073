package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.Leg;
import org.springframework.stereotype.Component;

/** Fails while any eligible account has an entry or exit order working for this pair. */
@Component
public class NoPendingOrdersCheck implements AdmissionCheck {

    @Override
    public GateCondition condition() {
        return GateCondition.NO_PENDING_ORDERS;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        for (Hedge hedge : context.getPairHedges()) {
            for (Leg leg : hedge.getLegs()) {
                if (leg.hasPendingOrder() && context.getPair().isEligible(leg.getAccountAddress())) {
                    return CheckResult.fail("Account " + leg.getAccountAddress() + " has a pending order on hedge "
                            + hedge.getId());
                }
            }
        }
        return CheckResult.pass();
    }
}
