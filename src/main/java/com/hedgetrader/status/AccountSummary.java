package com.hedgetrader.status;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AccountSummary {

    private final String address;
    private final int index;
    private final BigDecimal balance;
    private final BigDecimal availableBalance;
    private final boolean locked;
    private final String lockReason;
    private final String reservedByHedgeId;
    private final int activeOrders;
    private final BigDecimal dailyLoss;
    private final int dailyTrades;
    private final int maxDailyTrades;
}
