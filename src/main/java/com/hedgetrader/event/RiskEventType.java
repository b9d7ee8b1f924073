package com.hedgetrader.event;

public enum RiskEventType {
    // Global
    GLOBAL_DAILY_LOSS_WARNING,
    GLOBAL_DAILY_LOSS_BREACH,
    EMERGENCY_STOP,
    EMERGENCY_STOP_CLEARED,

    // Pair
    PAIR_DAILY_LOSS_WARNING,
    PAIR_DAILY_LOSS_BREACH,
    PAIR_HALTED,
    PAIR_RESUMED,

    // Account
    ACCOUNT_DAILY_LOSS_WARNING,
    ACCOUNT_DAILY_LOSS_BREACH,
    ACCOUNT_MIN_BALANCE_BREACH,
    ACCOUNT_HALTED,
    UNWIND_FAILED
}
