package com.hedgetrader.risk;

import java.math.BigDecimal;

/** Position of a running counter against its limit. Ordered by severity. */
public enum LimitStatus {
    OK,
    WARNING,
    BREACHED;

    public boolean isWorseThan(LimitStatus other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Classifies {@code value} against {@code limit}. A null limit is always OK; a null
     * warning threshold disables the WARNING band.
     */
    public static LimitStatus of(BigDecimal value, BigDecimal limit, BigDecimal warningThreshold) {
        if (limit == null) {
            return OK;
        }
        if (value.compareTo(limit) >= 0) {
            return BREACHED;
        }
        if (warningThreshold != null && value.compareTo(limit.multiply(warningThreshold)) >= 0) {
            return WARNING;
        }
        return OK;
    }
}
