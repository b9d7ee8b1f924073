package com.hedgetrader.domain.enums;

/** Fill state of a leg's entry order. */
public enum LegStatus {
    PENDING,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isFailed() {
        return this == REJECTED || this == CANCELLED;
    }
}
