package com.hedgetrader.domain.model;

import com.hedgetrader.domain.enums.CloseReason;
import com.hedgetrader.domain.enums.ExitStatus;
import com.hedgetrader.domain.enums.HedgeStatus;
import com.hedgetrader.domain.enums.LegStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Setter;

/**
 * A coordinated set of offsetting legs across two or more accounts for one trading pair.
 *
 * <p>State changes go through {@link #transitionTo(HedgeStatus, Instant)}, which rejects
 * transitions outside the lifecycle in {@link HedgeStatus} and refuses OPEN unless every
 * leg is filled. Mutated only under the pair lock held by the position coordinator.
 */
@Getter
public class Hedge {

    private final String id;
    private final String pairId;
    private final String marketId;
    private final List<Leg> legs;
    private final Instant createdAt;

    private HedgeStatus status = HedgeStatus.PENDING;
    private Instant openedAt;
    private Instant closedAt;

    @Setter
    private CloseReason closeReason;

    @Setter
    private String failureReason;

    @Setter
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Set when the hedge is closing because it never became fully open. */
    @Setter
    private boolean unwinding;

    public Hedge(String id, String pairId, String marketId, List<Leg> legs, Instant createdAt) {
        this.id = id;
        this.pairId = pairId;
        this.marketId = marketId;
        this.legs = new ArrayList<>(legs);
        this.createdAt = createdAt;
    }

    public void transitionTo(HedgeStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Hedge " + id + " cannot move from " + status + " to " + target);
        }
        if (target == HedgeStatus.OPEN && !allLegsFilled()) {
            throw new IllegalStateException("Hedge " + id + " cannot open with unfilled legs");
        }
        this.status = target;
        if (target == HedgeStatus.OPEN) {
            this.openedAt = at;
        } else if (target.isTerminal()) {
            this.closedAt = at;
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean allLegsFilled() {
        return !legs.isEmpty() && legs.stream().allMatch(leg -> leg.getStatus() == LegStatus.FILLED);
    }

    public boolean anyLegFailed() {
        return legs.stream().anyMatch(leg -> leg.getStatus().isFailed());
    }

    public boolean hasPendingOrders() {
        return legs.stream().anyMatch(Leg::hasPendingOrder);
    }

    public boolean hasFailedExit() {
        return legs.stream().anyMatch(leg -> leg.getExitStatus() == ExitStatus.FAILED);
    }

    public Optional<Leg> findLeg(String legId) {
        return legs.stream().filter(leg -> leg.getId().equals(legId)).findFirst();
    }

    public List<String> getAccountAddresses() {
        return legs.stream().map(Leg::getAccountAddress).collect(Collectors.toList());
    }

    /** Mean entry price over filled legs, or null when nothing has filled. */
    public BigDecimal averageEntryPrice() {
        List<BigDecimal> prices = legs.stream()
                .filter(leg -> leg.getStatus() == LegStatus.FILLED && leg.getEntryPrice() != null)
                .map(Leg::getEntryPrice)
                .collect(Collectors.toList());
        if (prices.isEmpty()) {
            return null;
        }
        BigDecimal sum = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(prices.size()), 10, RoundingMode.HALF_UP);
    }

    /** Detached deep copy for read-only consumers outside the pair lock. */
    public Hedge copy() {
        Hedge copy = new Hedge(id, pairId, marketId, legs.stream().map(Leg::copy).collect(Collectors.toList()),
                createdAt);
        copy.status = status;
        copy.openedAt = openedAt;
        copy.closedAt = closedAt;
        copy.closeReason = closeReason;
        copy.failureReason = failureReason;
        copy.realizedPnl = realizedPnl;
        copy.unwinding = unwinding;
        return copy;
    }
}
