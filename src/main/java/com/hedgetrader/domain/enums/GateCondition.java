package com.hedgetrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The admission conditions a pair must satisfy before a new hedge may open, in evaluation
 * order. Evaluation short-circuits on the first failing condition.
 */
@Getter
@RequiredArgsConstructor
public enum GateCondition {
    NO_OPENING_HEDGE(1, "No hedge for the pair is opening"),
    NO_PENDING_ORDERS(2, "No participating account has a pending order for the pair"),
    NO_LOCKED_ACCOUNTS(3, "No participating account is locked"),
    POSITION_CAPACITY(4, "Open hedges below the pair's max positions"),
    ACCOUNT_AVAILABILITY(5, "Enough unlocked, funded, unreserved accounts"),
    RISK_CLEAR(6, "No global, pair or account risk halt"),
    NO_COOLDOWN(7, "No active cooldown window for the pair"),
    MARKET_CONDITIONS(8, "Market open with fresh, liquid, tight pricing");

    private final int order;
    private final String description;
}
