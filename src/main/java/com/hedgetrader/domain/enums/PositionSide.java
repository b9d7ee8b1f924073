package com.hedgetrader.domain.enums;

/** Direction of a leg. Half the legs of one hedge are LONG and half SHORT, so the set is delta-neutral. */
public enum PositionSide {
    LONG,
    SHORT;

    /** Returns the opposite side: LONG -> SHORT, SHORT -> LONG. Used for exit and unwind orders. */
    public PositionSide opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
