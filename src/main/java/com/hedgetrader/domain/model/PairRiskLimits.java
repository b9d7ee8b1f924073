package com.hedgetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** Per-pair limits. A null limit disables that check. */
@Getter
@Builder
public class PairRiskLimits {

    /** Daily realized loss (positive amount) attributable to the pair at which it is halted. */
    private final BigDecimal maxDailyLoss;

    /** Largest leg size the pair may place. */
    private final BigDecimal maxPositionSize;

    public static PairRiskLimits none() {
        return PairRiskLimits.builder().build();
    }
}
