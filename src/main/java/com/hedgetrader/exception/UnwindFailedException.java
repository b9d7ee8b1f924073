package com.hedgetrader.exception;

import java.util.Map;

/**
 * Closing orders for a filled leg could not be completed after every allowed attempt.
 * The affected account is locked for manual intervention; other pairs keep trading.
 */
public class UnwindFailedException extends BaseException {

    public UnwindFailedException(String hedgeId, String accountAddress, int attempts) {
        super(ErrorCode.UNWIND_FAILED,
                "Unwind failed for hedge " + hedgeId + " on account " + accountAddress + " after " + attempts
                        + " attempts",
                Map.of("hedgeId", hedgeId, "account", accountAddress, "attempts", attempts));
    }
}
