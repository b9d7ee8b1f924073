package com.hedgetrader.status;

import com.hedgetrader.account.AccountRegistry;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.cooldown.CooldownTracker;
import com.hedgetrader.core.coordinator.PositionCoordinator;
import com.hedgetrader.core.engine.HedgeTradingEngine;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.risk.RiskManager;
import com.hedgetrader.risk.RiskSummary;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Builds read-only status snapshots for the external status API. Nothing here changes
 * engine state.
 */
@Service
public class EngineStatusService {

    private static final int RECENT_EVENT_LIMIT = 50;

    private final HedgeTradingEngine hedgeTradingEngine;
    private final PositionCoordinator positionCoordinator;
    private final AccountRegistry accountRegistry;
    private final RiskManager riskManager;
    private final CooldownTracker cooldownTracker;
    private final TradingConfiguration tradingConfiguration;
    private final Clock clock;

    public EngineStatusService(
            HedgeTradingEngine hedgeTradingEngine,
            PositionCoordinator positionCoordinator,
            AccountRegistry accountRegistry,
            RiskManager riskManager,
            CooldownTracker cooldownTracker,
            TradingConfiguration tradingConfiguration,
            Clock clock) {
        this.hedgeTradingEngine = hedgeTradingEngine;
        this.positionCoordinator = positionCoordinator;
        this.accountRegistry = accountRegistry;
        this.riskManager = riskManager;
        this.cooldownTracker = cooldownTracker;
        this.tradingConfiguration = tradingConfiguration;
        this.clock = clock;
    }

    public EngineStatus snapshot() {
        List<Hedge> active = positionCoordinator.getActiveHedges();
        RiskSummary risk = riskManager.getSummary();

        List<RiskEventSummary> events = riskManager.getEvents().stream()
                .map(RiskEventSummary::of)
                .collect(Collectors.toList());
        List<RiskEventSummary> recent = events.subList(Math.max(0, events.size() - RECENT_EVENT_LIMIT), events.size());

        return EngineStatus.builder()
                .running(hedgeTradingEngine.isRunning())
                .emergencyStop(risk.isEmergencyStop())
                .emergencyReason(risk.getEmergencyReason())
                .tickCount(hedgeTradingEngine.getTickCount())
                .lastTickAt(hedgeTradingEngine.getLastTickAt())
                .generatedAt(clock.instant())
                .activeHedges(active.stream().map(this::toSummary).collect(Collectors.toList()))
                .accounts(accountRegistry.getAccounts().stream().map(this::toSummary).collect(Collectors.toList()))
                .pairs(tradingConfiguration.getPairs().stream()
                        .map(pair -> toSummary(pair, active, risk))
                        .collect(Collectors.toList()))
                .risk(risk)
                .recentRiskEvents(List.copyOf(recent))
                .build();
    }

    /** Every hedge since startup, terminal ones included, for audit. */
    public List<HedgeSummary> getHedgeHistory() {
        return positionCoordinator.getHedges().stream().map(this::toSummary).collect(Collectors.toList());
    }

    private HedgeSummary toSummary(Hedge hedge) {
        return HedgeSummary.builder()
                .id(hedge.getId())
                .pairId(hedge.getPairId())
                .status(hedge.getStatus())
                .createdAt(hedge.getCreatedAt())
                .openedAt(hedge.getOpenedAt())
                .closedAt(hedge.getClosedAt())
                .closeReason(hedge.getCloseReason())
                .failureReason(hedge.getFailureReason())
                .realizedPnl(hedge.getRealizedPnl())
                .legs(hedge.getLegs().stream()
                        .map(leg -> HedgeSummary.LegSummary.builder()
                                .accountAddress(leg.getAccountAddress())
                                .side(leg.getSide().name())
                                .size(leg.getRequestedSize())
                                .status(leg.getStatus().name())
                                .entryPrice(leg.getEntryPrice())
                                .exitStatus(leg.getExitStatus().name())
                                .exitPrice(leg.getExitPrice())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private AccountSummary toSummary(Account account) {
        return AccountSummary.builder()
                .address(account.getAddress())
                .index(account.getIndex())
                .balance(account.getBalance())
                .availableBalance(account.getAvailableBalance())
                .locked(account.isLocked())
                .lockReason(account.getLockReason())
                .reservedByHedgeId(account.getReservedByHedgeId())
                .activeOrders(account.getActiveOrders())
                .dailyLoss(account.getDailyLoss())
                .dailyTrades(account.getDailyTrades())
                .maxDailyTrades(account.getMaxDailyTrades())
                .build();
    }

    private PairSummary toSummary(TradingPair pair, List<Hedge> active, RiskSummary risk) {
        return PairSummary.builder()
                .id(pair.getId())
                .name(pair.getName())
                .marketId(pair.getMarketId())
                .enabled(pair.isEnabled())
                .halted(risk.getHaltedPairs().contains(pair.getId()))
                .activeHedges((int) active.stream().filter(hedge -> hedge.getPairId().equals(pair.getId())).count())
                .maxPositions(pair.getMaxPositions())
                .cooldownRemaining(cooldownTracker.remaining(pair.getId()))
                .dailyLoss(risk.getPairDailyLosses().getOrDefault(pair.getId(), BigDecimal.ZERO))
                .build();
    }
}
