package com.hedgetrader.risk;

import com.hedgetrader.account.AccountRegistry;
import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.enums.RiskAction;
import com.hedgetrader.domain.enums.RiskScope;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.event.EventPublisherHelper;
import com.hedgetrader.event.RiskEvent;
import com.hedgetrader.event.RiskEventType;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates the global, pair and account risk tiers and turns breaches into
 * {@link RiskEvent}s with their control actions.
 *
 * <p>Tiers:
 * <ul>
 *   <li><b>Global:</b> sum of account daily losses vs {@code globalMaxDailyLoss}, plus the
 *       explicit emergency stop. A breach stops all admissions and locks every account.</li>
 *   <li><b>Pair:</b> daily loss attributable to the pair's hedges vs the pair limit
 *       (HALT_PAIR), and the pair's position size limit (checked at admission).</li>
 *   <li><b>Account:</b> daily loss vs {@code maxDailyLoss} and balance vs {@code minBalance}
 *       (HALT_ACCOUNT, which locks the account).</li>
 * </ul>
 * Each tier also emits a WARN event when a daily loss crosses the warning threshold.
 *
 * <p>{@link #evaluate()} runs after every hedge state change and on every tick. Events are
 * emitted on transitions only: a scope that is already halted is not re-reported. Open
 * hedges are never closed from here; that is left to the closing policy.
 *
 * <p>Every event is appended to a bounded in-memory log (oldest evicted first) and
 * published as a Spring application event.
 *
 * <p><b>Thread safety:</b> {@link #evaluate()} is synchronized so concurrent pair tasks see
 * one consistent transition. Halt flags are concurrent sets; the emergency stop is an
 * {@link AtomicBoolean} so activation is idempotent.
 */
@Component
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final AccountRegistry accountRegistry;
    private final AccountRiskChecker accountRiskChecker;
    private final PairRiskChecker pairRiskChecker;
    private final RiskLimits riskLimits;
    private final TradingConfiguration tradingConfiguration;
    private final EngineProperties engineProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicBoolean emergencyStop = new AtomicBoolean(false);
    private volatile String emergencyReason;

    private final Set<String> haltedPairs = ConcurrentHashMap.newKeySet();

    // Last reported status per scope, for transition-only emission
    private LimitStatus globalLossStatus = LimitStatus.OK;
    private final Map<String, LimitStatus> pairLossStatus = new ConcurrentHashMap<>();
    private final Map<String, LimitStatus> accountLossStatus = new ConcurrentHashMap<>();
    private final Set<String> accountsBelowMinBalance = ConcurrentHashMap.newKeySet();

    private final Deque<RiskEvent> eventLog = new ArrayDeque<>();

    public RiskManager(
            AccountRegistry accountRegistry,
            AccountRiskChecker accountRiskChecker,
            PairRiskChecker pairRiskChecker,
            RiskLimits riskLimits,
            TradingConfiguration tradingConfiguration,
            EngineProperties engineProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accountRegistry = accountRegistry;
        this.accountRiskChecker = accountRiskChecker;
        this.pairRiskChecker = pairRiskChecker;
        this.riskLimits = riskLimits;
        this.tradingConfiguration = tradingConfiguration;
        this.engineProperties = engineProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // ADMISSION
    // ========================

    /**
     * Validates a prospective hedge for {@code pair} on {@code selectedAccounts} against every
     * tier. The emergency stop rejects regardless of anything else.
     */
    public RiskValidationResult validateAdmission(TradingPair pair, List<Account> selectedAccounts) {
        if (emergencyStop.get()) {
            return RiskValidationResult.rejected(
                    List.of(RiskViolation.of("EMERGENCY_STOP", "Emergency stop active: " + emergencyReason)));
        }

        List<RiskViolation> violations = new ArrayList<>();

        if (LimitStatus.of(accountRegistry.getTotalDailyLoss(), riskLimits.getGlobalMaxDailyLoss(), null)
                == LimitStatus.BREACHED) {
            violations.add(RiskViolation.of("GLOBAL_DAILY_LOSS_LIMIT", "Global daily loss limit reached"));
        }

        if (haltedPairs.contains(pair.getId())) {
            violations.add(RiskViolation.of("PAIR_HALTED", "Pair " + pair.getId() + " is halted"));
        }

        violations.addAll(pairRiskChecker.validate(pair));

        for (Account account : selectedAccounts) {
            violations.addAll(accountRiskChecker.validate(account));
        }

        return RiskValidationResult.of(violations);
    }

    public boolean isEmergencyStopped() {
        return emergencyStop.get();
    }

    public String getEmergencyReason() {
        return emergencyReason;
    }

    public boolean isPairHalted(String pairId) {
        return haltedPairs.contains(pairId);
    }

    // ========================
    // EVALUATION
    // ========================

    /** Re-evaluates every tier and emits events for any new warning or breach. */
    public synchronized void evaluate() {
        BigDecimal threshold = riskLimits.getDailyLossWarningThreshold();
        evaluateGlobal(threshold);
        evaluatePairs(threshold);
        evaluateAccounts(threshold);
    }

    /** Books a closed hedge's realized P&L against its pair. */
    public void recordHedgePnl(String pairId, BigDecimal pnl) {
        pairRiskChecker.recordPnl(pairId, pnl);
    }

    private void evaluateGlobal(BigDecimal threshold) {
        BigDecimal totalLoss = accountRegistry.getTotalDailyLoss();
        BigDecimal limit = riskLimits.getGlobalMaxDailyLoss();
        LimitStatus status = LimitStatus.of(totalLoss, limit, threshold);

        if (status == LimitStatus.BREACHED && !emergencyStop.get()) {
            triggerEmergencyStop(
                    RiskEventType.GLOBAL_DAILY_LOSS_BREACH,
                    "Global daily loss " + totalLoss + " reached limit " + limit,
                    Map.of("totalDailyLoss", totalLoss, "limit", limit));
        } else if (status == LimitStatus.WARNING && globalLossStatus == LimitStatus.OK) {
            record(RiskScope.GLOBAL, RiskEventType.GLOBAL_DAILY_LOSS_WARNING, RiskAction.WARN,
                    "Global daily loss " + totalLoss + " approaching limit " + limit, null, null,
                    Map.of("totalDailyLoss", totalLoss, "limit", limit));
        }
        globalLossStatus = status;
    }

    private void evaluatePairs(BigDecimal threshold) {
        for (TradingPair pair : tradingConfiguration.getPairs()) {
            LimitStatus status = pairRiskChecker.dailyLossStatus(pair, threshold);
            LimitStatus previous = pairLossStatus.getOrDefault(pair.getId(), LimitStatus.OK);

            if (status.isWorseThan(previous)) {
                BigDecimal loss = pairRiskChecker.getDailyLoss(pair.getId());
                BigDecimal limit = pair.getRiskLimits().getMaxDailyLoss();
                Map<String, Object> details = Map.of("dailyLoss", loss, "limit", limit);
                if (status == LimitStatus.BREACHED) {
                    haltPairInternal(pair.getId(), RiskEventType.PAIR_DAILY_LOSS_BREACH,
                            "Pair " + pair.getId() + " daily loss " + loss + " reached limit " + limit, details);
                } else {
                    record(RiskScope.PAIR, RiskEventType.PAIR_DAILY_LOSS_WARNING, RiskAction.WARN,
                            "Pair " + pair.getId() + " daily loss " + loss + " approaching limit " + limit,
                            pair.getId(), null, details);
                }
            }
            pairLossStatus.put(pair.getId(), status);
        }
    }

    private void evaluateAccounts(BigDecimal threshold) {
        for (Account account : accountRegistry.getAccounts()) {
            String address = account.getAddress();
            LimitStatus status = accountRiskChecker.dailyLossStatus(account, threshold);
            LimitStatus previous = accountLossStatus.getOrDefault(address, LimitStatus.OK);

            if (status.isWorseThan(previous)) {
                BigDecimal limit = account.getRiskLimits().getMaxDailyLoss();
                Map<String, Object> details = Map.of("dailyLoss", account.getDailyLoss(), "limit", limit);
                if (status == LimitStatus.BREACHED) {
                    haltAccount(address, LockCause.RISK_HALT, RiskEventType.ACCOUNT_DAILY_LOSS_BREACH,
                            "Account " + address + " daily loss " + account.getDailyLoss() + " reached limit " + limit,
                            details);
                } else {
                    record(RiskScope.ACCOUNT, RiskEventType.ACCOUNT_DAILY_LOSS_WARNING, RiskAction.WARN,
                            "Account " + address + " daily loss " + account.getDailyLoss() + " approaching limit "
                                    + limit, null, address, details);
                }
            }
            accountLossStatus.put(address, status);

            if (accountRiskChecker.isBelowMinBalance(account)) {
                if (accountsBelowMinBalance.add(address)) {
                    BigDecimal minBalance = account.getRiskLimits().getMinBalance();
                    haltAccount(address, LockCause.RISK_HALT, RiskEventType.ACCOUNT_MIN_BALANCE_BREACH,
                            "Account " + address + " balance " + account.getBalance() + " below minimum " + minBalance,
                            Map.of("balance", account.getBalance(), "minBalance", minBalance));
                }
            } else {
                accountsBelowMinBalance.remove(address);
            }
        }
    }

    // ========================
    // CONTROL ACTIONS
    // ========================

    /**
     * Stops all admissions and locks every account. Idempotent.
     *
     * @return true if this call activated the stop
     */
    public boolean emergencyStop(String reason) {
        return triggerEmergencyStop(RiskEventType.EMERGENCY_STOP, reason, Map.of());
    }

    /**
     * Clears the emergency stop and unlocks the accounts it locked. Accounts locked for other
     * causes stay locked. If the global loss limit is still breached, the next evaluation
     * stops again.
     *
     * @return true if an emergency stop was active
     */
    public boolean clearEmergencyStop() {
        if (!emergencyStop.compareAndSet(true, false)) {
            return false;
        }
        String previousReason = emergencyReason;
        emergencyReason = null;
        int unlocked = accountRegistry.unlockAll(LockCause.EMERGENCY_STOP);
        record(RiskScope.GLOBAL, RiskEventType.EMERGENCY_STOP_CLEARED, RiskAction.WARN,
                "Emergency stop cleared (was: " + previousReason + ")", null, null,
                Map.of("accountsUnlocked", unlocked));
        return true;
    }

    /** Operator halt of one pair. Existing hedges are left open. */
    public boolean haltPair(String pairId, String reason) {
        return haltPairInternal(pairId, RiskEventType.PAIR_HALTED, reason, Map.of());
    }

    public boolean resumePair(String pairId) {
        if (!haltedPairs.remove(pairId)) {
            return false;
        }
        record(RiskScope.PAIR, RiskEventType.PAIR_RESUMED, RiskAction.WARN, "Pair " + pairId + " resumed", pairId,
                null, Map.of());
        return true;
    }

    /** Locks the account and records a HALT_ACCOUNT event. */
    public void haltAccount(
            String address, LockCause cause, RiskEventType eventType, String reason, Map<String, Object> details) {
        accountRegistry.lock(address, cause, reason);
        record(RiskScope.ACCOUNT, eventType, RiskAction.HALT_ACCOUNT, reason, null, address, details);
    }

    private boolean triggerEmergencyStop(RiskEventType eventType, String reason, Map<String, Object> details) {
        if (!emergencyStop.compareAndSet(false, true)) {
            log.warn("Emergency stop already active, ignoring: {}", reason);
            return false;
        }
        emergencyReason = reason;
        accountRegistry.lockAll(LockCause.EMERGENCY_STOP, reason);
        record(RiskScope.GLOBAL, eventType, RiskAction.EMERGENCY_STOP_ALL, reason, null, null, details);
        return true;
    }

    private boolean haltPairInternal(
            String pairId, RiskEventType eventType, String reason, Map<String, Object> details) {
        if (!haltedPairs.add(pairId)) {
            return false;
        }
        record(RiskScope.PAIR, eventType, RiskAction.HALT_PAIR, reason, pairId, null, details);
        return true;
    }

    // ========================
    // EVENT LOG
    // ========================

    private void record(
            RiskScope scope,
            RiskEventType eventType,
            RiskAction action,
            String message,
            String pairId,
            String accountAddress,
            Map<String, Object> details) {
        RiskEvent event = new RiskEvent(
                this, scope, eventType, action, message, pairId, accountAddress, clock.instant(), details);

        synchronized (eventLog) {
            while (eventLog.size() >= engineProperties.getRiskEventLogCapacity()) {
                eventLog.removeFirst();
            }
            eventLog.addLast(event);
        }

        if (action == RiskAction.WARN) {
            log.warn("Risk {} [{}]: {}", eventType, scope, message);
        } else {
            log.error("Risk {} [{}] -> {}: {}", eventType, scope, action, message);
        }

        eventPublisherHelper.publishRisk(event);
    }

    /** Logged events, oldest first. */
    public List<RiskEvent> getEvents() {
        synchronized (eventLog) {
            return new ArrayList<>(eventLog);
        }
    }

    public List<RiskEvent> getEventsSince(Instant since) {
        return getEvents().stream()
                .filter(event -> !event.getOccurredAt().isBefore(since))
                .collect(Collectors.toList());
    }

    public RiskSummary getSummary() {
        Map<String, BigDecimal> accountLosses = new LinkedHashMap<>();
        for (Account account : accountRegistry.getAccounts()) {
            accountLosses.put(account.getAddress(), account.getDailyLoss());
        }

        return RiskSummary.builder()
                .emergencyStop(emergencyStop.get())
                .emergencyReason(emergencyReason)
                .totalDailyLoss(accountRegistry.getTotalDailyLoss())
                .globalMaxDailyLoss(riskLimits.getGlobalMaxDailyLoss())
                .haltedPairs(new TreeSet<>(haltedPairs))
                .pairDailyLosses(pairRiskChecker.getDailyLosses())
                .accountDailyLosses(accountLosses)
                .eventsLastHour(getEventsSince(clock.instant().minus(Duration.ofHours(1))).size())
                .build();
    }
}
