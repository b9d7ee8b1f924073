package com.hedgetrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Engine-wide risk limits. Pair and account limits live on their domain objects.
 *
 * <p>Null values mean the check is disabled.
 */
@Data
@Builder
public class RiskLimits {

    /** Sum of all accounts' daily losses at which every admission is stopped. */
    private BigDecimal globalMaxDailyLoss;

    /** Fraction of a daily loss limit at which a WARN event is emitted (e.g., 0.8 = 80%). */
    private BigDecimal dailyLossWarningThreshold;
}
