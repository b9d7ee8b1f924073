package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.enums.HedgeStatus;
import com.hedgetrader.domain.model.Hedge;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class NoOpeningHedgeCheck implements AdmissionCheck {

    @Override
    public GateCondition condition() {
        return GateCondition.NO_OPENING_HEDGE;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        Optional<Hedge> opening = context.getPairHedges().stream()
                .filter(hedge -> hedge.getStatus() == HedgeStatus.OPENING)
                .findFirst();
        return opening.map(hedge -> CheckResult.fail("Hedge " + hedge.getId() + " is still opening"))
                .orElseGet(CheckResult::pass);
    }
}
