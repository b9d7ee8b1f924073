package com.hedgetrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single reason a hedge may not be admitted, found during risk validation.
 *
 * <p>Codes are machine-readable: EMERGENCY_STOP, PAIR_HALTED, PAIR_DAILY_LOSS_LIMIT,
 * POSITION_SIZE_EXCEEDED, ACCOUNT_LOCKED, ACCOUNT_DAILY_LOSS_LIMIT, ACCOUNT_MIN_BALANCE.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
