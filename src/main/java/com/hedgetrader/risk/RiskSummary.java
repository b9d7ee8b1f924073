package com.hedgetrader.risk;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of all three risk tiers. */
@Getter
@Builder
public class RiskSummary {

    private final boolean emergencyStop;
    private final String emergencyReason;
    private final BigDecimal totalDailyLoss;
    private final BigDecimal globalMaxDailyLoss;
    private final Set<String> haltedPairs;
    private final Map<String, BigDecimal> pairDailyLosses;
    private final Map<String, BigDecimal> accountDailyLosses;
    private final int eventsLastHour;
}
