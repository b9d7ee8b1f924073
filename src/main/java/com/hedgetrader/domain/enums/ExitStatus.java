package com.hedgetrader.domain.enums;

/** State of the closing (exit) order of a filled leg. NONE until an exit is requested. */
public enum ExitStatus {
    NONE,
    PENDING,
    CLOSED,
    FAILED
}
