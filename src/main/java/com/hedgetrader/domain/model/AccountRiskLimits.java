package com.hedgetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** Per-account limits. A null limit disables that check. */
@Getter
@Builder
public class AccountRiskLimits {

    /** Daily realized loss (positive amount) at which the account is halted. */
    private final BigDecimal maxDailyLoss;

    /** Balance below which the account is halted. */
    private final BigDecimal minBalance;

    public static AccountRiskLimits none() {
        return AccountRiskLimits.builder().build();
    }
}
