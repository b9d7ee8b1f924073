package com.hedgetrader.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a hedge (a coordinated set of offsetting legs across accounts).
 *
 * <p>Allowed transitions:
 * <pre>
 * PENDING -> OPENING | FAILED
 * OPENING -> OPEN | CLOSING | FAILED
 * OPEN    -> CLOSING
 * CLOSING -> CLOSED | FAILED
 * </pre>
 * CLOSED and FAILED are terminal and retained for audit.
 */
public enum HedgeStatus {
    PENDING,
    OPENING,
    OPEN,
    CLOSING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    /** OPEN and OPENING hedges count against the pair's position capacity. */
    public boolean countsAgainstCapacity() {
        return this == OPEN || this == OPENING;
    }

    public boolean canTransitionTo(HedgeStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<HedgeStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(OPENING, FAILED);
            case OPENING:
                return EnumSet.of(OPEN, CLOSING, FAILED);
            case OPEN:
                return EnumSet.of(CLOSING);
            case CLOSING:
                return EnumSet.of(CLOSED, FAILED);
            default:
                return EnumSet.noneOf(HedgeStatus.class);
        }
    }
}
