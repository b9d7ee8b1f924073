package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import org.springframework.stereotype.Component;

@Component
public class PositionCapacityCheck implements AdmissionCheck {

    @Override
    public GateCondition condition() {
        return GateCondition.POSITION_CAPACITY;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        long active = context.getPairHedges().stream()
                .filter(hedge -> hedge.getStatus().countsAgainstCapacity())
                .count();
        int max = context.getPair().getMaxPositions();
        if (active >= max) {
            return CheckResult.fail(active + " of " + max + " positions in use");
        }
        return CheckResult.pass();
    }
}
