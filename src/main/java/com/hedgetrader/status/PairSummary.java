package com.hedgetrader.status;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PairSummary {

    private final String id;
    private final String name;
    private final String marketId;
    private final boolean enabled;
    private final boolean halted;
    private final int activeHedges;
    private final int maxPositions;
    private final Duration cooldownRemaining;
    private final BigDecimal dailyLoss;
}
