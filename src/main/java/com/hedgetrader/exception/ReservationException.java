package com.hedgetrader.exception;

import java.util.Map;

/**
 * An account could not be reserved for a hedge (locked, already reserved, or short of
 * balance). Local to one admission attempt; the pair is retried on the next tick.
 */
public class ReservationException extends BaseException {

    public ReservationException(String accountAddress, String message) {
        super(ErrorCode.RESERVATION_FAILED, message, Map.of("account", accountAddress));
    }
}
