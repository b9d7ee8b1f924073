package com.hedgetrader.core.gate.check;

import com.hedgetrader.cooldown.CooldownTracker;
import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import org.springframework.stereotype.Component;

@Component
public class NoCooldownCheck implements AdmissionCheck {

    private final CooldownTracker cooldownTracker;

    public NoCooldownCheck(CooldownTracker cooldownTracker) {
        this.cooldownTracker = cooldownTracker;
    }

    @Override
    public GateCondition condition() {
        return GateCondition.NO_COOLDOWN;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        return cooldownTracker.getActiveWindow(context.getPair().getId())
                .map(window -> CheckResult.fail("Cooldown until " + window.expiresAt() + " (" + window.reason() + ")"))
                .orElseGet(CheckResult::pass);
    }
}
