package com.hedgetrader.core.gate;

import com.hedgetrader.domain.enums.GateCondition;

/**
 * One named condition of the admission gate.
 *
 * <p>Implementations must be read-only: evaluating a check never changes engine state, so
 * re-running the gate on unchanged inputs gives the same decision.
 */
public interface AdmissionCheck {

    /** The condition this check implements. Determines its position in the gate. */
    GateCondition condition();

    CheckResult check(AdmissionContext context);
}
