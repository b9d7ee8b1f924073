package com.hedgetrader.domain.enums;

/** Control action that accompanies a risk event. */
public enum RiskAction {
    WARN,
    HALT_PAIR,
    HALT_ACCOUNT,
    EMERGENCY_STOP_ALL
}
