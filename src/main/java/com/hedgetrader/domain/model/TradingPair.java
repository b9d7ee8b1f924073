package com.hedgetrader.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * A configured market that is traded as hedges across a fixed set of accounts.
 *
 * <p>Immutable after load. The eligible account list keeps its configured order, which is
 * the first key of the account selection policy.
 */
@Getter
@Builder
public class TradingPair {

    private final String id;
    private final String name;
    private final String marketId;

    /** Size of every leg, in quote currency. */
    private final BigDecimal baseAmount;

    /** Max hedges in OPEN or OPENING at once. Zero disables admission for the pair. */
    private final int maxPositions;

    private final int cooldownMinutes;

    /** Eligible account addresses in configured order, at least two. */
    private final List<String> accountAddresses;

    @Builder.Default
    private final int requiredAccounts = 2;

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final PairRiskLimits riskLimits = PairRiskLimits.none();

    @Builder.Default
    private final PriceConditions priceConditions = PriceConditions.defaults();

    /**
     * Fractional price move from the average entry price that closes an open hedge.
     * Null disables the price-based close policy.
     */
    private final BigDecimal stopTakeDistancePercent;

    public Duration getCooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    public boolean isEligible(String accountAddress) {
        return accountAddresses.contains(accountAddress);
    }
}
