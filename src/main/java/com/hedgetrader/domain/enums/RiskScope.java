package com.hedgetrader.domain.enums;

public enum RiskScope {
    GLOBAL,
    PAIR,
    ACCOUNT
}
