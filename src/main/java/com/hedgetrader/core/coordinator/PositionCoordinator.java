package com.hedgetrader.core.coordinator;

import com.hedgetrader.account.AccountRegistry;
import com.hedgetrader.broker.OrderExecutor;
import com.hedgetrader.broker.OrderUpdate;
import com.hedgetrader.broker.OrderUpdateType;
import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.cooldown.CooldownTracker;
import com.hedgetrader.core.gate.AccountSelector;
import com.hedgetrader.core.gate.AdmissionDecision;
import com.hedgetrader.core.gate.AdmissionGate;
import com.hedgetrader.domain.enums.CloseReason;
import com.hedgetrader.domain.enums.ExitStatus;
import com.hedgetrader.domain.enums.HedgeStatus;
import com.hedgetrader.domain.enums.LegStatus;
import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.enums.PositionSide;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.Leg;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.event.EventPublisherHelper;
import com.hedgetrader.event.HedgeEventType;
import com.hedgetrader.event.OrderUpdateEvent;
import com.hedgetrader.event.RiskEventType;
import com.hedgetrader.exception.ExchangeException;
import com.hedgetrader.exception.OrderRejectedException;
import com.hedgetrader.exception.OrderTimeoutException;
import com.hedgetrader.exception.ReservationException;
import com.hedgetrader.exception.ResourceNotFoundException;
import com.hedgetrader.exception.UnwindFailedException;
import com.hedgetrader.market.MarketSnapshot;
import com.hedgetrader.market.MarketSnapshotProvider;
import com.hedgetrader.risk.RiskManager;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drives the hedge lifecycle for every trading pair: admission, leg placement, fill
 * reconciliation, unwinding of partial failures, and closing.
 *
 * <p><b>Admission:</b> the {@link AdmissionGate} decides whether the pair may open a hedge
 * and which accounts take part. The accounts are then reserved in one atomic
 * {@link AccountRegistry#reserveAll} call; a lost race is a {@link ReservationException}
 * and the pair simply tries again next tick. The hedge goes PENDING -> OPENING and one
 * entry order per account is placed, half LONG and half SHORT, all of equal size.
 *
 * <p><b>Reconciliation:</b> order updates are matched to legs through the
 * {@link HedgeBook} order index, never by arrival order.
 * <ul>
 *   <li>All legs filled with LONG and SHORT totals within {@code hedgeSizeTolerance}:
 *       OPENING -> OPEN. Fills outside the tolerance are unwound as a partial failure.</li>
 *   <li>Any leg rejected, cancelled or timed out: the hedge moves to CLOSING as an unwind.
 *       Pending entries are cancelled and every filled leg gets an opposite-side exit order.
 *       Once all exits confirm, the hedge is FAILED and the pair enters cooldown.</li>
 *   <li>An exit that cannot be placed or filled within {@code unwindMaxAttempts} marks the
 *       hedge FAILED and locks the account for manual intervention.</li>
 * </ul>
 *
 * <p><b>Closing:</b> target-hit, manual and operator closes use the same CLOSING path. A
 * closed hedge books its realized P&L per account and per pair, releases its accounts and
 * opens the pair's cooldown window.
 *
 * <p><b>Thread safety:</b> every read or change of a pair's hedges happens under that
 * pair's {@link ReentrantLock}. Locks are never nested across pairs. While holding a pair
 * lock the coordinator may call the account registry, risk manager and hedge book, which
 * each serialize internally and never call back into the coordinator.
 */
@Component
public class PositionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PositionCoordinator.class);

    private final TradingConfiguration tradingConfiguration;
    private final HedgeBook hedgeBook;
    private final AdmissionGate admissionGate;
    private final AccountSelector accountSelector;
    private final AccountRegistry accountRegistry;
    private final RiskManager riskManager;
    private final CooldownTracker cooldownTracker;
    private final HedgeClosePolicy hedgeClosePolicy;
    private final OrderExecutor orderExecutor;
    private final MarketSnapshotProvider marketSnapshotProvider;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();

    public PositionCoordinator(
            TradingConfiguration tradingConfiguration,
            HedgeBook hedgeBook,
            AdmissionGate admissionGate,
            AccountSelector accountSelector,
            AccountRegistry accountRegistry,
            RiskManager riskManager,
            CooldownTracker cooldownTracker,
            HedgeClosePolicy hedgeClosePolicy,
            OrderExecutor orderExecutor,
            MarketSnapshotProvider marketSnapshotProvider,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            Clock clock) {
        this.tradingConfiguration = tradingConfiguration;
        this.hedgeBook = hedgeBook;
        this.admissionGate = admissionGate;
        this.accountSelector = accountSelector;
        this.accountRegistry = accountRegistry;
        this.riskManager = riskManager;
        this.cooldownTracker = cooldownTracker;
        this.hedgeClosePolicy = hedgeClosePolicy;
        this.orderExecutor = orderExecutor;
        this.marketSnapshotProvider = marketSnapshotProvider;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ========================
    // PER-TICK EVALUATION
    // ========================

    /**
     * One monitoring pass for a pair: applies the close policy to its open hedges, then tries
     * to admit a new hedge. Both share a single market snapshot.
     *
     * @return the hedge opened on this pass, if any
     */
    public Optional<Hedge> evaluatePair(TradingPair pair) {
        return withPairLock(pair.getId(), () -> {
            Supplier<MarketSnapshot> snapshot = snapshotOnce(pair.getMarketId());
            applyClosePolicy(pair, snapshot);
            return openIfAdmitted(pair, snapshot);
        });
    }

    /** Runs the admission gate for the pair and opens a hedge if it passes. */
    public Optional<Hedge> tryOpenHedge(TradingPair pair) {
        return withPairLock(pair.getId(), () -> openIfAdmitted(pair, snapshotOnce(pair.getMarketId())));
    }

    private Optional<Hedge> openIfAdmitted(TradingPair pair, Supplier<MarketSnapshot> snapshot) {
        AdmissionDecision decision = admissionGate.evaluate(pair, hedgeBook.getHedgesForPair(pair.getId()), snapshot);
        if (!decision.admitted()) {
            return Optional.empty();
        }

        String hedgeId = UUID.randomUUID().toString();
        List<Account> accounts = decision.selectedAccounts();
        List<String> addresses = accounts.stream().map(Account::getAddress).collect(Collectors.toList());
        List<PositionSide> sides = accountSelector.assignSides(pair.getId(), addresses);

        try {
            accountRegistry.reserveAll(addresses, hedgeId, pair.getId(), pair.getBaseAmount());
        } catch (ReservationException e) {
            log.debug("Reservation for pair {} lost, retrying next tick: {}", pair.getId(), e.getMessage());
            return Optional.empty();
        }
        accountSelector.recordSides(pair.getId(), addresses, sides);

        Instant now = clock.instant();
        List<Leg> legs = new ArrayList<>();
        for (int i = 0; i < addresses.size(); i++) {
            legs.add(Leg.builder()
                    .id(hedgeId + "-L" + (i + 1))
                    .accountAddress(addresses.get(i))
                    .side(sides.get(i))
                    .requestedSize(pair.getBaseAmount())
                    .build());
        }

        Hedge hedge = new Hedge(hedgeId, pair.getId(), pair.getMarketId(), legs, now);
        hedgeBook.add(hedge);
        hedge.transitionTo(HedgeStatus.OPENING, now);
        log.info("Opening hedge {} on pair {}: {} x {} on {}", hedgeId, pair.getId(), legs.size(),
                pair.getBaseAmount(), addresses);
        eventPublisherHelper.publishHedge(this, hedge, HedgeEventType.OPENING);

        placeEntries(hedge, accounts);
        reconcile(hedge);
        return Optional.of(hedge);
    }

    private void placeEntries(Hedge hedge, List<Account> accounts) {
        List<Leg> legs = hedge.getLegs();
        for (int i = 0; i < legs.size(); i++) {
            Leg leg = legs.get(i);
            if (hedge.anyLegFailed()) {
                leg.markCancelled("Not placed: an earlier leg failed");
                continue;
            }
            try {
                String orderRef = orderExecutor.placeOrder(
                        accounts.get(i), hedge.getMarketId(), leg.getSide(), leg.getRequestedSize());
                leg.setOrderRef(orderRef);
                leg.setPlacedAt(clock.instant());
                accountRegistry.incrementActiveOrders(leg.getAccountAddress());
                log.info("Placed {} entry {} for leg {} on {}", leg.getSide(), orderRef, leg.getId(),
                        leg.getAccountAddress());
                hedgeBook.index(orderRef, new OrderLink(hedge, leg.getId(), OrderRole.ENTRY))
                        .ifPresent(update -> applyEntryUpdate(hedge, leg, update));
            } catch (OrderRejectedException | ExchangeException e) {
                log.warn("Entry order for leg {} of hedge {} failed: {}", leg.getId(), hedge.getId(), e.getMessage());
                leg.markRejected(e.getMessage());
            }
        }
    }

    private void applyClosePolicy(TradingPair pair, Supplier<MarketSnapshot> snapshot) {
        if (!hedgeClosePolicy.isEnabled(pair)) {
            return;
        }
        List<Hedge> open = hedgeBook.getHedgesForPair(pair.getId()).stream()
                .filter(hedge -> hedge.getStatus() == HedgeStatus.OPEN)
                .collect(Collectors.toList());
        if (open.isEmpty()) {
            return;
        }

        MarketSnapshot current;
        try {
            current = snapshot.get();
        } catch (ExchangeException e) {
            log.warn("Close policy skipped for pair {}: {}", pair.getId(), e.getMessage());
            return;
        }
        for (Hedge hedge : open) {
            hedgeClosePolicy.evaluate(hedge, pair, current)
                    .ifPresent(reason -> beginClosing(hedge, CloseReason.TARGET_HIT, reason));
        }
    }

    // ========================
    // ORDER UPDATES
    // ========================

    @EventListener
    public void onOrderUpdate(OrderUpdateEvent event) {
        handleUpdate(event.getUpdate());
    }

    public void onFill(String orderRef, BigDecimal filledSize, BigDecimal averagePrice) {
        handleUpdate(OrderUpdate.filled(orderRef, filledSize, averagePrice));
    }

    public void onReject(String orderRef, String reason) {
        handleUpdate(OrderUpdate.rejected(orderRef, reason));
    }

    private void handleUpdate(OrderUpdate update) {
        Optional<OrderLink> resolved = hedgeBook.resolveOrBuffer(update, clock.instant());
        if (resolved.isEmpty()) {
            log.debug("Buffered {} update for unindexed order {}", update.type(), update.orderRef());
            return;
        }
        OrderLink link = resolved.get();
        Hedge hedge = link.hedge();
        withPairLock(hedge.getPairId(), () -> {
            Leg leg = hedge.findLeg(link.legId())
                    .orElseThrow(() -> new IllegalStateException("Leg " + link.legId() + " missing from hedge "
                            + hedge.getId()));
            if (link.role() == OrderRole.ENTRY) {
                applyEntryUpdate(hedge, leg, update);
            } else {
                applyExitUpdate(hedge, leg, update);
            }
            reconcile(hedge);
            return null;
        });
    }

    private void applyEntryUpdate(Hedge hedge, Leg leg, OrderUpdate update) {
        if (!update.orderRef().equals(leg.getOrderRef())) {
            log.debug("Ignoring update for superseded entry order {}", update.orderRef());
            return;
        }

        if (update.type() == OrderUpdateType.FILLED) {
            LegStatus previous = leg.getStatus();
            if (previous == LegStatus.FILLED) {
                log.debug("Duplicate fill for order {}", update.orderRef());
                return;
            }
            BigDecimal size = update.filledSize() != null ? update.filledSize() : leg.getRequestedSize();
            leg.markFilled(size, update.averagePrice());
            if (previous == LegStatus.PENDING) {
                accountRegistry.decrementActiveOrders(leg.getAccountAddress());
                log.info("Leg {} of hedge {} filled: {} @ {}", leg.getId(), hedge.getId(), size,
                        update.averagePrice());
            } else {
                log.warn("Late fill on {} leg {} of hedge {}: {} @ {}", previous, leg.getId(), hedge.getId(), size,
                        update.averagePrice());
                if (hedge.isTerminal()) {
                    haltForOrphanedFill(hedge, leg);
                }
            }
            return;
        }

        if (leg.getStatus() != LegStatus.PENDING) {
            log.debug("Ignoring rejection of {} leg {}", leg.getStatus(), leg.getId());
            return;
        }
        leg.markRejected(update.reason());
        accountRegistry.decrementActiveOrders(leg.getAccountAddress());
        log.warn("Leg {} of hedge {} rejected: {}", leg.getId(), hedge.getId(), update.reason());
    }

    private void applyExitUpdate(Hedge hedge, Leg leg, OrderUpdate update) {
        if (!update.orderRef().equals(leg.getExitOrderRef()) || leg.getExitStatus() != ExitStatus.PENDING) {
            log.debug("Ignoring update for superseded exit order {}", update.orderRef());
            return;
        }
        accountRegistry.decrementActiveOrders(leg.getAccountAddress());

        if (update.type() == OrderUpdateType.FILLED) {
            leg.setExitStatus(ExitStatus.CLOSED);
            leg.setExitPrice(update.averagePrice());
            log.info("Exit of leg {} of hedge {} filled @ {}", leg.getId(), hedge.getId(), update.averagePrice());
        } else {
            log.warn("Exit {} of leg {} rejected (attempt {}): {}", update.orderRef(), leg.getId(),
                    leg.getExitAttempts(), update.reason());
            retryExit(hedge, leg, "rejected: " + update.reason());
        }
    }

    /**
     * A fill on a leg whose hedge already finished leaves an unhedged position that no hedge
     * tracks any more. The account is locked so an operator closes it.
     */
    private void haltForOrphanedFill(Hedge hedge, Leg leg) {
        riskManager.haltAccount(
                leg.getAccountAddress(),
                LockCause.UNWIND_FAILED,
                RiskEventType.UNWIND_FAILED,
                "Late fill on leg " + leg.getId() + " after hedge " + hedge.getId() + " finished as "
                        + hedge.getStatus() + "; position must be closed manually",
                Map.of("hedgeId", hedge.getId(), "legId", leg.getId()));
    }

    // ========================
    // STATE MACHINE
    // ========================

    private void reconcile(Hedge hedge) {
        switch (hedge.getStatus()) {
            case OPENING:
                if (hedge.allLegsFilled()) {
                    Optional<String> imbalance = fillImbalance(hedge);
                    if (imbalance.isPresent()) {
                        beginClosing(hedge, CloseReason.PARTIAL_FAILURE, imbalance.get());
                        break;
                    }
                    hedge.transitionTo(HedgeStatus.OPEN, clock.instant());
                    log.info("Hedge {} on pair {} is OPEN", hedge.getId(), hedge.getPairId());
                    eventPublisherHelper.publishHedge(this, hedge, HedgeEventType.OPENED);
                    riskManager.evaluate();
                } else if (hedge.anyLegFailed()) {
                    String reason = hedge.getLegs().stream()
                            .filter(leg -> leg.getStatus().isFailed())
                            .map(leg -> leg.getId() + " " + leg.getStatus() + ": " + leg.getRejectReason())
                            .collect(Collectors.joining("; "));
                    beginClosing(hedge, CloseReason.PARTIAL_FAILURE, reason);
                }
                break;
            case CLOSING:
                driveClosing(hedge);
                break;
            default:
                break;
        }
    }

    /**
     * Compares the filled LONG and SHORT totals. A relative difference above
     * {@code hedgeSizeTolerance} leaves the hedge directional and is reported as the reason.
     */
    private Optional<String> fillImbalance(Hedge hedge) {
        BigDecimal longSize = BigDecimal.ZERO;
        BigDecimal shortSize = BigDecimal.ZERO;
        for (Leg leg : hedge.getLegs()) {
            if (leg.getSide() == PositionSide.LONG) {
                longSize = longSize.add(leg.getFilledSize());
            } else {
                shortSize = shortSize.add(leg.getFilledSize());
            }
        }
        BigDecimal larger = longSize.max(shortSize);
        if (larger.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal difference = longSize.subtract(shortSize).abs().divide(larger, 10, RoundingMode.HALF_UP);
        if (difference.compareTo(engineProperties.getHedgeSizeTolerance()) <= 0) {
            return Optional.empty();
        }
        return Optional.of("Fill imbalance: LONG " + longSize.stripTrailingZeros().toPlainString() + " vs SHORT "
                + shortSize.stripTrailingZeros().toPlainString() + " exceeds tolerance "
                + engineProperties.getHedgeSizeTolerance());
    }

    private void beginClosing(Hedge hedge, CloseReason reason, String detail) {
        boolean unwinding = hedge.getStatus() == HedgeStatus.OPENING;
        hedge.transitionTo(HedgeStatus.CLOSING, clock.instant());
        hedge.setCloseReason(reason);
        hedge.setUnwinding(unwinding);
        if (reason == CloseReason.PARTIAL_FAILURE) {
            hedge.setFailureReason(detail);
        }
        if (unwinding) {
            log.warn("Unwinding hedge {} on pair {} ({}): {}", hedge.getId(), hedge.getPairId(), reason, detail);
        } else {
            log.info("Closing hedge {} on pair {} ({}): {}", hedge.getId(), hedge.getPairId(), reason, detail);
        }
        eventPublisherHelper.publishHedge(this, hedge, HedgeEventType.CLOSING);
        driveClosing(hedge);
    }

    private void driveClosing(Hedge hedge) {
        for (Leg leg : hedge.getLegs()) {
            if (leg.isEntryPending()) {
                cancelEntry(leg, "Hedge closing");
            }
        }
        Instant now = clock.instant();
        for (Leg leg : hedge.getLegs()) {
            if (leg.needsExit() || leg.isExitRetryDue(now)) {
                placeExit(hedge, leg);
            }
        }
        if (!hedge.hasPendingOrders()) {
            finish(hedge);
        }
    }

    private void finish(Hedge hedge) {
        Instant now = clock.instant();
        TradingPair pair = tradingConfiguration.getPair(hedge.getPairId());

        BigDecimal pnl = BigDecimal.ZERO;
        for (Leg leg : hedge.getLegs()) {
            if (leg.getExitStatus() == ExitStatus.CLOSED) {
                BigDecimal legPnl = leg.realizedPnl();
                accountRegistry.recordFill(leg.getAccountAddress(), legPnl);
                pnl = pnl.add(legPnl);
            }
        }
        hedge.setRealizedPnl(pnl);
        riskManager.recordHedgePnl(hedge.getPairId(), pnl);
        accountRegistry.releaseAll(hedge.getId());

        if (hedge.hasFailedExit()) {
            hedge.transitionTo(HedgeStatus.FAILED, now);
            for (Leg leg : hedge.getLegs()) {
                if (leg.getExitStatus() == ExitStatus.FAILED) {
                    lockForFailedUnwind(hedge, leg);
                }
            }
            hedge.setFailureReason("Unwind failed: " + hedge.getLegs().stream()
                    .filter(leg -> leg.getExitStatus() == ExitStatus.FAILED)
                    .map(leg -> leg.getAccountAddress() + " (" + leg.getExitFailureReason() + ")")
                    .collect(Collectors.joining(", ")));
        } else if (hedge.getCloseReason() == CloseReason.PARTIAL_FAILURE) {
            hedge.transitionTo(HedgeStatus.FAILED, now);
        } else {
            hedge.transitionTo(HedgeStatus.CLOSED, now);
        }

        Duration cooldown = cooldownFor(pair, hedge.getStatus());
        if (!cooldown.isZero()) {
            cooldownTracker.startCooldown(pair.getId(), cooldown, "Hedge " + hedge.getId() + " " + hedge.getStatus());
        }

        if (hedge.getStatus() == HedgeStatus.FAILED) {
            log.warn("Hedge {} on pair {} FAILED: {} (pnl {})", hedge.getId(), hedge.getPairId(),
                    hedge.getFailureReason(), pnl);
            eventPublisherHelper.publishHedge(this, hedge, HedgeEventType.FAILED);
        } else {
            log.info("Hedge {} on pair {} CLOSED ({}), pnl {}", hedge.getId(), hedge.getPairId(),
                    hedge.getCloseReason(), pnl);
            eventPublisherHelper.publishHedge(this, hedge, HedgeEventType.CLOSED);
        }

        riskManager.evaluate();
    }

    private Duration cooldownFor(TradingPair pair, HedgeStatus outcome) {
        if (pair.getCooldownMinutes() > 0) {
            return pair.getCooldown();
        }
        return outcome == HedgeStatus.FAILED ? engineProperties.getFailureCooldown() : Duration.ZERO;
    }

    private void lockForFailedUnwind(Hedge hedge, Leg leg) {
        UnwindFailedException failure =
                new UnwindFailedException(hedge.getId(), leg.getAccountAddress(), leg.getExitAttempts());
        log.error("Manual intervention required: {} (last error: {})", failure.getMessage(),
                leg.getExitFailureReason(), failure);
        riskManager.haltAccount(
                leg.getAccountAddress(), LockCause.UNWIND_FAILED, RiskEventType.UNWIND_FAILED,
                failure.getMessage(), failure.getDetails());
    }

    // ========================
    // ORDERS
    // ========================

    private void cancelEntry(Leg leg, String reason) {
        try {
            orderExecutor.cancelOrder(leg.getOrderRef());
        } catch (ExchangeException e) {
            log.warn("Cancel of entry {} failed, a late fill will be unwound: {}", leg.getOrderRef(), e.getMessage());
        }
        leg.markCancelled(reason);
        accountRegistry.decrementActiveOrders(leg.getAccountAddress());
    }

    /**
     * Places the opposite-side exit order for a filled leg. With a zero
     * {@code unwindRetryDelay} immediate failures are retried at once; otherwise the retry is
     * left to the next timeout sweep so the pair lock is never held while waiting. Exhausting
     * {@code unwindMaxAttempts} marks the exit FAILED.
     */
    private void placeExit(Hedge hedge, Leg leg) {
        int maxAttempts = engineProperties.getUnwindMaxAttempts();
        Duration retryDelay = engineProperties.getUnwindRetryDelay();
        Account account = accountRegistry.getAccount(leg.getAccountAddress());
        String lastError = "no attempts left";
        leg.setExitRetryAt(null);

        while (leg.getExitAttempts() < maxAttempts) {
            leg.setExitAttempts(leg.getExitAttempts() + 1);
            try {
                String orderRef = orderExecutor.placeOrder(
                        account, hedge.getMarketId(), leg.getSide().opposite(), leg.getFilledSize());
                leg.setExitOrderRef(orderRef);
                leg.setExitStatus(ExitStatus.PENDING);
                leg.setExitPlacedAt(clock.instant());
                accountRegistry.incrementActiveOrders(leg.getAccountAddress());
                log.info("Placed {} exit {} for leg {} of hedge {} (attempt {}/{})", leg.getSide().opposite(),
                        orderRef, leg.getId(), hedge.getId(), leg.getExitAttempts(), maxAttempts);
                hedgeBook.index(orderRef, new OrderLink(hedge, leg.getId(), OrderRole.EXIT))
                        .ifPresent(update -> applyExitUpdate(hedge, leg, update));
                return;
            } catch (OrderRejectedException | ExchangeException e) {
                lastError = e.getMessage();
                log.warn("Exit attempt {}/{} for leg {} of hedge {} failed: {}", leg.getExitAttempts(), maxAttempts,
                        leg.getId(), hedge.getId(), lastError);
                if (leg.getExitAttempts() < maxAttempts && !retryDelay.isZero()) {
                    leg.setExitFailureReason(lastError);
                    leg.setExitRetryAt(clock.instant().plus(retryDelay));
                    return;
                }
            }
        }
        markExitFailed(leg, lastError);
    }

    private void retryExit(Hedge hedge, Leg leg, String reason) {
        leg.setExitStatus(ExitStatus.NONE);
        if (leg.getExitAttempts() < engineProperties.getUnwindMaxAttempts()) {
            placeExit(hedge, leg);
        } else {
            markExitFailed(leg, reason);
        }
    }

    private void markExitFailed(Leg leg, String reason) {
        leg.setExitStatus(ExitStatus.FAILED);
        leg.setExitFailureReason(reason);
        log.error("Exit for leg {} on {} failed after {} attempts: {}", leg.getId(), leg.getAccountAddress(),
                leg.getExitAttempts(), reason);
    }

    // ========================
    // TIMEOUTS
    // ========================

    /**
     * Cancels legs whose entry or exit order has been pending for at least the order
     * timeout. A timed-out entry is handled exactly like a rejection; a timed-out exit
     * counts as a failed attempt. Exit retries whose delay has passed are placed. Also drops
     * stale buffered updates.
     *
     * @return the number of orders expired or retried
     */
    public int expireStaleLegs(Instant now) {
        int expired = 0;
        for (Hedge hedge : hedgeBook.getActiveHedges()) {
            expired += withPairLock(hedge.getPairId(), () -> expireLegs(hedge, now));
        }
        hedgeBook.purgeUnmatched(now.minus(engineProperties.getUnmatchedUpdateTtl()));
        return expired;
    }

    private int expireLegs(Hedge hedge, Instant now) {
        if (hedge.isTerminal()) {
            return 0;
        }
        Duration timeout = engineProperties.getOrderTimeout();
        int expired = 0;

        for (Leg leg : hedge.getLegs()) {
            if (leg.isEntryTimedOut(now, timeout)) {
                OrderTimeoutException timeoutError =
                        new OrderTimeoutException(leg.getOrderRef(), Duration.between(leg.getPlacedAt(), now));
                log.warn("Leg {} of hedge {} timed out: {}", leg.getId(), hedge.getId(), timeoutError.getMessage());
                cancelEntry(leg, timeoutError.getMessage());
                expired++;
            } else if (leg.isExitTimedOut(now, timeout)) {
                OrderTimeoutException timeoutError =
                        new OrderTimeoutException(leg.getExitOrderRef(), Duration.between(leg.getExitPlacedAt(), now));
                log.warn("Exit of leg {} of hedge {} timed out: {}", leg.getId(), hedge.getId(),
                        timeoutError.getMessage());
                try {
                    orderExecutor.cancelOrder(leg.getExitOrderRef());
                } catch (ExchangeException e) {
                    log.warn("Cancel of exit {} failed: {}", leg.getExitOrderRef(), e.getMessage());
                }
                accountRegistry.decrementActiveOrders(leg.getAccountAddress());
                retryExit(hedge, leg, timeoutError.getMessage());
                expired++;
            } else if (leg.isExitRetryDue(now)) {
                log.info("Retrying exit for leg {} of hedge {} after: {}", leg.getId(), hedge.getId(),
                        leg.getExitFailureReason());
                placeExit(hedge, leg);
                expired++;
            }
        }

        if (expired > 0) {
            reconcile(hedge);
        }
        return expired;
    }

    // ========================
    // CLOSE REQUESTS
    // ========================

    /**
     * Closes one hedge. An OPEN hedge exits all legs; an OPENING hedge is unwound the same way
     * a partial failure would be, but ends CLOSED.
     *
     * @return true if the hedge started closing
     * @throws ResourceNotFoundException if no such hedge exists
     */
    public boolean requestClose(String hedgeId, CloseReason reason) {
        Hedge hedge = hedgeBook.get(hedgeId).orElseThrow(() -> new ResourceNotFoundException("Hedge", hedgeId));
        return withPairLock(hedge.getPairId(), () -> {
            if (hedge.getStatus() != HedgeStatus.OPEN && hedge.getStatus() != HedgeStatus.OPENING) {
                log.debug("Close of hedge {} ignored in state {}", hedgeId, hedge.getStatus());
                return false;
            }
            beginClosing(hedge, reason, "Close requested");
            return true;
        });
    }

    /** Drives every OPEN and OPENING hedge to closing. Returns the number affected. */
    public int closeAll(CloseReason reason) {
        int closing = 0;
        for (Hedge hedge : hedgeBook.getActiveHedges()) {
            if (requestClose(hedge.getId(), reason)) {
                closing++;
            }
        }
        log.info("Close-all ({}): {} hedges closing", reason, closing);
        return closing;
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<Hedge> getHedge(String hedgeId) {
        return hedgeBook.get(hedgeId).map(hedge -> withPairLock(hedge.getPairId(), hedge::copy));
    }

    /** Detached copies of every hedge, terminal ones included, in creation order. */
    public List<Hedge> getHedges() {
        return hedgeBook.getHedges().stream()
                .map(hedge -> withPairLock(hedge.getPairId(), hedge::copy))
                .collect(Collectors.toList());
    }

    public List<Hedge> getActiveHedges() {
        return getHedges().stream().filter(hedge -> !hedge.isTerminal()).collect(Collectors.toList());
    }

    // ========================
    // HELPERS
    // ========================

    private <T> T withPairLock(String pairId, Supplier<T> action) {
        ReentrantLock lock = pairLocks.computeIfAbsent(pairId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Supplier<MarketSnapshot> snapshotOnce(String marketId) {
        MarketSnapshot[] cached = new MarketSnapshot[1];
        boolean[] loaded = new boolean[1];
        return () -> {
            if (!loaded[0]) {
                cached[0] = marketSnapshotProvider.getSnapshot(marketId);
                loaded[0] = true;
            }
            return cached[0];
        };
    }
}
