package com.hedgetrader.unit.risk;

import static com.hedgetrader.support.TestFixtures.ALICE;
import static com.hedgetrader.support.TestFixtures.BOB;
import static org.assertj.core.api.Assertions.assertThat;

import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.enums.RiskAction;
import com.hedgetrader.domain.model.PairRiskLimits;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.event.RiskEvent;
import com.hedgetrader.event.RiskEventType;
import com.hedgetrader.risk.RiskManager;
import com.hedgetrader.risk.RiskSummary;
import com.hedgetrader.risk.RiskValidationResult;
import com.hedgetrader.risk.RiskViolation;
import com.hedgetrader.support.EngineHarness;
import com.hedgetrader.support.TestFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RiskManager covering the global, pair and account tiers, transition-only
 * event emission, the emergency stop and the bounded event log.
 */
class RiskManagerTest {

    private static final String PAIR = "btc-usd";

    private EngineHarness harness;
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        TradingPair pair = TestFixtures.pairBuilder(PAIR, ALICE, BOB)
                .riskLimits(PairRiskLimits.builder().maxDailyLoss(new BigDecimal("1000")).build())
                .build();
        harness = new EngineHarness(
                List.of(TestFixtures.account(ALICE, "250000", "1000", "240000"), TestFixtures.account(BOB, "250000")),
                List.of(pair), new BigDecimal("3000"));
        riskManager = harness.riskManager;
    }

    private List<RiskEventType> eventTypes() {
        return riskManager.getEvents().stream().map(RiskEvent::getEventType).collect(Collectors.toList());
    }

    private RiskValidationResult validate() {
        return riskManager.validateAdmission(harness.pair(PAIR), harness.accountRegistry.getAccounts());
    }

    @Test
    @DisplayName("Clean state approves admission")
    void approvesCleanState() {
        RiskValidationResult result = validate();

        assertThat(result.isApproved()).isTrue();
        assertThat(result.getViolations()).isEmpty();
    }

    // ==============================
    // ACCOUNT TIER
    // ==============================

    @Nested
    @DisplayName("Account tier")
    class AccountTier {

        @Test
        @DisplayName("Warning at 80% of the daily loss limit is emitted once")
        void warningOnce() {
            harness.accountRegistry.recordFill(ALICE, new BigDecimal("-800"));

            riskManager.evaluate();
            riskManager.evaluate();

            assertThat(eventTypes()).containsExactly(RiskEventType.ACCOUNT_DAILY_LOSS_WARNING);
            assertThat(harness.accountRegistry.getAccount(ALICE).isLocked()).isFalse();
        }

        @Test
        @DisplayName("Daily loss at the limit halts and locks the account once")
        void breachHaltsAccount() {
            harness.accountRegistry.recordFill(ALICE, new BigDecimal("-1000"));

            riskManager.evaluate();
            riskManager.evaluate();

            assertThat(eventTypes()).containsExactly(RiskEventType.ACCOUNT_DAILY_LOSS_BREACH);
            RiskEvent event = riskManager.getEvents().get(0);
            assertThat(event.getAction()).isEqualTo(RiskAction.HALT_ACCOUNT);
            assertThat(event.getAccountAddress()).isEqualTo(ALICE);
            assertThat(harness.accountRegistry.getAccount(ALICE).getLockCause()).isEqualTo(LockCause.RISK_HALT);
            assertThat(validate().getViolations()).extracting(RiskViolation::getCode)
                    .contains("ACCOUNT_LOCKED", "ACCOUNT_DAILY_LOSS_LIMIT");
        }

        @Test
        @DisplayName("Balance below the minimum halts the account")
        void minBalance() {
            harness.accountRegistry.updateBalance(ALICE, new BigDecimal("239999"));

            riskManager.evaluate();
            riskManager.evaluate();

            assertThat(eventTypes()).containsExactly(RiskEventType.ACCOUNT_MIN_BALANCE_BREACH);
            assertThat(harness.accountRegistry.getAccount(ALICE).isLocked()).isTrue();
        }
    }

    // ==============================
    // PAIR TIER
    // ==============================

    @Nested
    @DisplayName("Pair tier")
    class PairTier {

        @Test
        @DisplayName("Pair loss at the limit halts the pair and starts its cooldown")
        void breachHaltsPair() {
            riskManager.recordHedgePnl(PAIR, new BigDecimal("-1000"));

            riskManager.evaluate();

            assertThat(riskManager.isPairHalted(PAIR)).isTrue();
            assertThat(eventTypes()).containsExactly(RiskEventType.PAIR_DAILY_LOSS_BREACH);
            assertThat(riskManager.getEvents().get(0).getAction()).isEqualTo(RiskAction.HALT_PAIR);
            assertThat(harness.cooldownTracker.isInCooldown(PAIR)).isTrue();
            assertThat(validate().getViolations()).extracting(RiskViolation::getCode)
                    .containsExactly("PAIR_HALTED", "PAIR_DAILY_LOSS_LIMIT");
        }

        @Test
        @DisplayName("Resume lifts the halt but the loss limit still rejects until the day rolls")
        void resumeKeepsLossLimit() {
            riskManager.recordHedgePnl(PAIR, new BigDecimal("-1200"));
            riskManager.evaluate();

            assertThat(riskManager.resumePair(PAIR)).isTrue();
            riskManager.evaluate();

            assertThat(riskManager.isPairHalted(PAIR)).isFalse();
            assertThat(validate().getViolations()).extracting(RiskViolation::getCode)
                    .containsExactly("PAIR_DAILY_LOSS_LIMIT");

            harness.clock.advance(Duration.ofDays(1));
            assertThat(validate().isApproved()).isTrue();
        }

        @Test
        @DisplayName("Profits are not counted against the pair")
        void profitsIgnored() {
            riskManager.recordHedgePnl(PAIR, new BigDecimal("5000"));

            assertThat(harness.pairRiskChecker.getDailyLoss(PAIR)).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // GLOBAL TIER
    // ==============================

    @Nested
    @DisplayName("Global tier")
    class GlobalTier {

        @Test
        @DisplayName("Total loss at the global limit triggers the emergency stop")
        void globalBreach() {
            harness.accountRegistry.recordFill(BOB, new BigDecimal("-2500"));
            harness.accountRegistry.recordFill(ALICE, new BigDecimal("-500"));

            riskManager.evaluate();

            assertThat(riskManager.isEmergencyStopped()).isTrue();
            assertThat(eventTypes()).contains(RiskEventType.GLOBAL_DAILY_LOSS_BREACH);
            assertThat(harness.accountRegistry.getAccount(BOB).getLockCause()).isEqualTo(LockCause.EMERGENCY_STOP);
        }

        @Test
        @DisplayName("Emergency stop rejects with a single violation whatever else is wrong")
        void emergencyTakesPrecedence() {
            riskManager.haltPair(PAIR, "operator");
            riskManager.emergencyStop("manual");

            RiskValidationResult result = validate();

            assertThat(result.getViolations()).extracting(RiskViolation::getCode).containsExactly("EMERGENCY_STOP");
            assertThat(result.describe()).contains("manual");
        }

        @Test
        @DisplayName("Emergency stop is idempotent and clearing keeps other locks")
        void clearEmergency() {
            riskManager.haltAccount(ALICE, LockCause.UNWIND_FAILED, RiskEventType.UNWIND_FAILED, "unwind", Map.of());

            assertThat(riskManager.emergencyStop("manual")).isTrue();
            assertThat(riskManager.emergencyStop("again")).isFalse();
            assertThat(riskManager.getEmergencyReason()).isEqualTo("manual");

            assertThat(riskManager.clearEmergencyStop()).isTrue();
            assertThat(riskManager.clearEmergencyStop()).isFalse();

            assertThat(harness.accountRegistry.getAccount(ALICE).isLocked()).isTrue();
            assertThat(harness.accountRegistry.getAccount(BOB).isLocked()).isFalse();
            assertThat(eventTypes()).containsExactly(RiskEventType.UNWIND_FAILED, RiskEventType.EMERGENCY_STOP,
                    RiskEventType.EMERGENCY_STOP_CLEARED);
        }

        @Test
        @DisplayName("Warning at 80% of the global limit")
        void globalWarning() {
            harness.accountRegistry.recordFill(BOB, new BigDecimal("-2400"));

            riskManager.evaluate();

            assertThat(eventTypes()).containsExactly(RiskEventType.GLOBAL_DAILY_LOSS_WARNING);
            assertThat(riskManager.isEmergencyStopped()).isFalse();
        }
    }

    // ==============================
    // EVENT LOG
    // ==============================

    @Test
    @DisplayName("Event log evicts the oldest entries beyond its capacity")
    void boundedLog() {
        harness.engineProperties.setRiskEventLogCapacity(3);

        for (int i = 0; i < 3; i++) {
            riskManager.haltPair(PAIR, "halt " + i);
            riskManager.resumePair(PAIR);
        }

        assertThat(riskManager.getEvents()).hasSize(3);
        assertThat(eventTypes()).containsExactly(RiskEventType.PAIR_RESUMED, RiskEventType.PAIR_HALTED,
                RiskEventType.PAIR_RESUMED);
        assertThat(harness.riskEvents()).hasSize(6);
    }

    @Test
    @DisplayName("Summary reflects losses, halts and recent events")
    void summary() {
        harness.accountRegistry.recordFill(ALICE, new BigDecimal("-200"));
        riskManager.recordHedgePnl(PAIR, new BigDecimal("-200"));
        riskManager.haltPair(PAIR, "operator");

        RiskSummary summary = riskManager.getSummary();

        assertThat(summary.isEmergencyStop()).isFalse();
        assertThat(summary.getTotalDailyLoss()).isEqualByComparingTo("200");
        assertThat(summary.getGlobalMaxDailyLoss()).isEqualByComparingTo("3000");
        assertThat(summary.getHaltedPairs()).containsExactly(PAIR);
        assertThat(summary.getPairDailyLosses()).containsKey(PAIR);
        assertThat(summary.getAccountDailyLosses()).containsOnlyKeys(ALICE, BOB);
        assertThat(summary.getEventsLastHour()).isEqualTo(1);
    }
}
