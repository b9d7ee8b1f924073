package com.hedgetrader.domain.model;

import com.hedgetrader.domain.enums.LockCause;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-account trading state.
 *
 * <p>Instances inside {@code AccountRegistry} are mutated only within its critical sections.
 * Every instance handed out by the registry is a detached copy, so callers can read it
 * freely but changes never flow back.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String address;
    private int index;

    private BigDecimal balance;

    /** Amount committed to the in-flight hedge that reserved this account. */
    @Builder.Default
    private BigDecimal reserved = BigDecimal.ZERO;

    private boolean locked;
    private LockCause lockCause;
    private String lockReason;

    private String reservedByHedgeId;
    private String reservedForPairId;

    private int activeOrders;

    /** Realized losses today, as a positive amount. */
    @Builder.Default
    private BigDecimal dailyLoss = BigDecimal.ZERO;

    private int dailyTrades;

    @Builder.Default
    private int maxDailyTrades = 100;

    private LocalDate lastResetDate;

    @Builder.Default
    private AccountRiskLimits riskLimits = AccountRiskLimits.none();

    public BigDecimal getAvailableBalance() {
        return balance.subtract(reserved);
    }

    public boolean isReserved() {
        return reservedByHedgeId != null;
    }

    public boolean hasTradesRemaining() {
        return dailyTrades < maxDailyTrades;
    }

    public Account copy() {
        return toBuilder().build();
    }
}
