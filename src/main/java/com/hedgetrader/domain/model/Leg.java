package com.hedgetrader.domain.model;

import com.hedgetrader.domain.enums.ExitStatus;
import com.hedgetrader.domain.enums.LegStatus;
import com.hedgetrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One account's position within a hedge: the entry order and, once filled, its exit order.
 *
 * <p>Owned exclusively by its parent {@link Hedge} and mutated only under the pair lock of
 * that hedge's trading pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Leg {

    private String id;
    private String accountAddress;
    private PositionSide side;
    private BigDecimal requestedSize;

    // Entry
    private String orderRef;

    @Builder.Default
    private LegStatus status = LegStatus.PENDING;

    private BigDecimal filledSize;
    private BigDecimal entryPrice;
    private Instant placedAt;
    private String rejectReason;

    // Exit
    private String exitOrderRef;

    @Builder.Default
    private ExitStatus exitStatus = ExitStatus.NONE;

    private int exitAttempts;
    private Instant exitPlacedAt;

    /** Set while a failed exit placement waits for its retry. */
    private Instant exitRetryAt;

    private BigDecimal exitPrice;
    private String exitFailureReason;

    public void markFilled(BigDecimal size, BigDecimal price) {
        this.status = LegStatus.FILLED;
        this.filledSize = size;
        this.entryPrice = price;
    }

    public void markRejected(String reason) {
        this.status = LegStatus.REJECTED;
        this.rejectReason = reason;
    }

    public void markCancelled(String reason) {
        this.status = LegStatus.CANCELLED;
        this.rejectReason = reason;
    }

    public boolean isEntryPending() {
        return status == LegStatus.PENDING && orderRef != null;
    }

    public boolean isExitPending() {
        return exitStatus == ExitStatus.PENDING;
    }

    public boolean isExitRetryScheduled() {
        return status == LegStatus.FILLED && exitStatus == ExitStatus.NONE && exitRetryAt != null;
    }

    public boolean isExitRetryDue(Instant now) {
        return isExitRetryScheduled() && !now.isBefore(exitRetryAt);
    }

    /** An open order, or an exit waiting to be placed again. Either keeps the hedge unfinished. */
    public boolean hasPendingOrder() {
        return isEntryPending() || isExitPending() || isExitRetryScheduled();
    }

    /** A filled leg whose exposure has not been closed or given up on, with no retry scheduled. */
    public boolean needsExit() {
        return status == LegStatus.FILLED && exitStatus == ExitStatus.NONE && exitRetryAt == null;
    }

    public boolean isEntryTimedOut(Instant now, Duration timeout) {
        return isEntryPending() && placedAt != null && !now.isBefore(placedAt.plus(timeout));
    }

    public boolean isExitTimedOut(Instant now, Duration timeout) {
        return isExitPending() && exitPlacedAt != null && !now.isBefore(exitPlacedAt.plus(timeout));
    }

    /**
     * Realized P&L of a closed leg: size * (exit - entry) / entry, negated for SHORT.
     * Zero while the leg has no confirmed exit.
     */
    public BigDecimal realizedPnl() {
        if (exitStatus != ExitStatus.CLOSED || entryPrice == null || exitPrice == null
                || entryPrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = exitPrice.subtract(entryPrice).divide(entryPrice, 10, RoundingMode.HALF_UP);
        BigDecimal pnl = filledSize.multiply(move).setScale(8, RoundingMode.HALF_UP);
        return side == PositionSide.LONG ? pnl : pnl.negate();
    }

    public Leg copy() {
        return toBuilder().build();
    }
}
