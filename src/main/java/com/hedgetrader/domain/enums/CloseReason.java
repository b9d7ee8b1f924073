package com.hedgetrader.domain.enums;

public enum CloseReason {
    /** Price moved the configured distance from the entry price. */
    TARGET_HIT,
    /** One or more legs failed to fill; filled legs are unwound. */
    PARTIAL_FAILURE,
    /** Single hedge closed on request. */
    MANUAL,
    /** Engine stopped with position closing requested. */
    OPERATOR_STOP
}
