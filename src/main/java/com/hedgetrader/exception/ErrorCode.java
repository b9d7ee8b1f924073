package com.hedgetrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIG_INVALID("CONFIG_INVALID", true),
    RESERVATION_FAILED("RESERVATION_FAILED", false),
    ORDER_REJECTED("ORDER_REJECTED", false),
    ORDER_TIMEOUT("ORDER_TIMEOUT", false),
    UNWIND_FAILED("UNWIND_FAILED", false),
    EXCHANGE_ERROR("EXCHANGE_ERROR", false),
    NOT_FOUND("NOT_FOUND", false),
    INVALID_STATE("INVALID_STATE", false);

    private final String code;

    /** Fatal codes stop the process at startup; all others are local to a pair or account. */
    private final boolean fatal;
}
