package com.hedgetrader.domain.enums;

/** Why an account is locked. Only the matching operation releases a lock of a given cause. */
public enum LockCause {
    RISK_HALT,
    EMERGENCY_STOP,
    UNWIND_FAILED,
    MANUAL
}
