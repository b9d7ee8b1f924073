package com.hedgetrader.unit.gate;

import static com.hedgetrader.support.TestFixtures.ALICE;
import static com.hedgetrader.support.TestFixtures.BOB;
import static org.assertj.core.api.Assertions.assertThat;

import com.hedgetrader.core.gate.AccountSelector;
import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.AdmissionDecision;
import com.hedgetrader.core.gate.AdmissionGate;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.CloseReason;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.PairRiskLimits;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.exception.ExchangeException;
import com.hedgetrader.market.MarketSnapshot;
import com.hedgetrader.support.EngineHarness;
import com.hedgetrader.support.TestFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AdmissionGate covering each of the eight conditions, evaluation order and
 * short-circuiting, lazy market data and the read-only nature of evaluation.
 */
class AdmissionGateTest {

    private static final String PAIR = "btc-usd";

    private EngineHarness harness;
    private AtomicInteger snapshotCalls;

    @BeforeEach
    void setUp() {
        harness = harness(TestFixtures.pair(PAIR, 1, ALICE, BOB),
                TestFixtures.account(ALICE, "250000"), TestFixtures.account(BOB, "250000"));
        snapshotCalls = new AtomicInteger();
    }

    private static EngineHarness harness(TradingPair pair, Account... accounts) {
        return new EngineHarness(List.of(accounts), List.of(pair));
    }

    private AdmissionDecision evaluate() {
        return evaluate(TestFixtures.healthySnapshot("BTC-USD", "100"));
    }

    private AdmissionDecision evaluate(MarketSnapshot snapshot) {
        return evaluate(() -> {
            snapshotCalls.incrementAndGet();
            return snapshot;
        });
    }

    private AdmissionDecision evaluate(Supplier<MarketSnapshot> snapshot) {
        return harness.admissionGate.evaluate(harness.pair(PAIR), harness.hedgeBook.getHedgesForPair(PAIR), snapshot);
    }

    private static MarketSnapshot.MarketSnapshotBuilder healthy() {
        return MarketSnapshot.builder()
                .marketId("BTC-USD")
                .open(true)
                .price(new BigDecimal("100"))
                .priceAge(Duration.ofSeconds(1))
                .volatility(new BigDecimal("0.02"))
                .liquidity(new BigDecimal("50000"))
                .spread(new BigDecimal("0.001"));
    }

    // ==============================
    // ADMIT
    // ==============================

    @Test
    @DisplayName("Admits with the selected accounts when every condition holds")
    void admitsWhenClear() {
        AdmissionDecision decision = evaluate();

        assertThat(decision.admitted()).isTrue();
        assertThat(decision.failedCondition()).isNull();
        assertThat(decision.selectedAccounts()).extracting(Account::getAddress).containsExactly(ALICE, BOB);
        assertThat(snapshotCalls).hasValue(1);
    }

    @Test
    @DisplayName("Evaluation is read-only and gives the same answer twice")
    void idempotent() {
        AdmissionDecision first = evaluate();
        AdmissionDecision second = evaluate();

        assertThat(second.admitted()).isEqualTo(first.admitted());
        assertThat(second.selectedAccounts()).extracting(Account::getAddress)
                .containsExactlyElementsOf(first.selectedAccounts().stream().map(Account::getAddress)
                        .collect(Collectors.toList()));
        assertThat(harness.accountRegistry.getAccount(ALICE).isReserved()).isFalse();
        assertThat(harness.hedgeBook.getHedges()).isEmpty();
    }

    // ==============================
    // CONDITIONS
    // ==============================

    @Nested
    @DisplayName("Individual conditions")
    class Conditions {

        @Test
        @DisplayName("1: a hedge still opening denies")
        void openingHedge() {
            harness.coordinator.tryOpenHedge(harness.pair(PAIR));

            assertThat(evaluate().failedCondition()).isEqualTo(GateCondition.NO_OPENING_HEDGE);
        }

        @Test
        @DisplayName("2: a working exit order on a participating account denies")
        void pendingOrders() {
            Hedge hedge = harness.coordinator.tryOpenHedge(harness.pair(PAIR)).orElseThrow();
            hedge.getLegs().forEach(leg ->
                    harness.coordinator.onFill(leg.getOrderRef(), leg.getRequestedSize(), new BigDecimal("100")));
            harness.coordinator.requestClose(hedge.getId(), CloseReason.MANUAL);

            assertThat(evaluate().failedCondition()).isEqualTo(GateCondition.NO_PENDING_ORDERS);
        }

        @Test
        @DisplayName("3: any locked participating account denies")
        void lockedAccount() {
            harness.accountRegistry.lock(BOB, LockCause.MANUAL, "operator");

            AdmissionDecision decision = evaluate();

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.NO_LOCKED_ACCOUNTS);
            assertThat(decision.reason()).contains(BOB).contains("operator");
        }

        @Test
        @DisplayName("4: zero max positions denies")
        void capacity() {
            harness = harness(TestFixtures.pair(PAIR, 0, ALICE, BOB),
                    TestFixtures.account(ALICE, "250000"), TestFixtures.account(BOB, "250000"));

            assertThat(evaluate().failedCondition()).isEqualTo(GateCondition.POSITION_CAPACITY);
        }

        @Test
        @DisplayName("5: too few funded accounts denies")
        void availability() {
            harness = harness(TestFixtures.pair(PAIR, 1, ALICE, BOB),
                    TestFixtures.account(ALICE, "250000"), TestFixtures.account(BOB, "99999.99"));

            AdmissionDecision decision = evaluate();

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.ACCOUNT_AVAILABILITY);
            assertThat(decision.reason()).contains("1 of 2");
        }

        @Test
        @DisplayName("6: a halted pair denies")
        void riskHalt() {
            harness.riskManager.haltPair(PAIR, "operator");

            AdmissionDecision decision = evaluate();

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.RISK_CLEAR);
            assertThat(decision.reason()).contains("PAIR_HALTED");
        }

        @Test
        @DisplayName("6: a leg size above the pair's max position size denies")
        void positionSize() {
            harness = harness(TestFixtures.pairBuilder(PAIR, ALICE, BOB)
                            .riskLimits(PairRiskLimits.builder()
                                    .maxPositionSize(new BigDecimal("50000")).build())
                            .build(),
                    TestFixtures.account(ALICE, "250000"), TestFixtures.account(BOB, "250000"));

            AdmissionDecision decision = evaluate();

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.RISK_CLEAR);
            assertThat(decision.reason()).contains("POSITION_SIZE_EXCEEDED");
        }

        @Test
        @DisplayName("7: an active cooldown denies")
        void cooldown() {
            harness.cooldownTracker.startCooldown(PAIR, Duration.ofMinutes(10), "closed");

            assertThat(evaluate().failedCondition()).isEqualTo(GateCondition.NO_COOLDOWN);
        }
    }

    // ==============================
    // MARKET CONDITIONS
    // ==============================

    @Nested
    @DisplayName("Market conditions")
    class MarketConditions {

        @Test
        @DisplayName("Closed market denies")
        void closed() {
            assertThat(evaluate(healthy().open(false).build()).failedCondition())
                    .isEqualTo(GateCondition.MARKET_CONDITIONS);
        }

        @Test
        @DisplayName("Price as old as the staleness limit denies, just younger passes")
        void stalePrice() {
            assertThat(evaluate(healthy().priceAge(Duration.ofSeconds(30)).build()).failedCondition())
                    .isEqualTo(GateCondition.MARKET_CONDITIONS);
            assertThat(evaluate(healthy().priceAge(Duration.ofSeconds(29)).build()).admitted()).isTrue();
        }

        @Test
        @DisplayName("Spread or volatility above and liquidity below the pair bounds deny")
        void bounds() {
            assertThat(evaluate(healthy().spread(new BigDecimal("0.02")).build()).reason()).contains("Spread");
            assertThat(evaluate(healthy().volatility(new BigDecimal("0.5")).build()).reason()).contains("Volatility");
            assertThat(evaluate(healthy().liquidity(new BigDecimal("10")).build()).reason()).contains("Liquidity");
        }

        @Test
        @DisplayName("Missing snapshot or missing values deny")
        void missingData() {
            assertThat(evaluate((MarketSnapshot) null).failedCondition()).isEqualTo(GateCondition.MARKET_CONDITIONS);
            assertThat(evaluate(healthy().liquidity(null).build()).failedCondition())
                    .isEqualTo(GateCondition.MARKET_CONDITIONS);
        }

        @Test
        @DisplayName("Market data failure denies instead of propagating")
        void providerFailure() {
            AdmissionDecision decision = evaluate(() -> {
                throw new ExchangeException("feed down");
            });

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.MARKET_CONDITIONS);
            assertThat(decision.reason()).contains("feed down");
        }
    }

    // ==============================
    // ORDERING
    // ==============================

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Lowest-numbered failing condition is reported")
        void lowestFailureWins() {
            harness.accountRegistry.lock(ALICE, LockCause.MANUAL, "operator");
            harness.cooldownTracker.startCooldown(PAIR, Duration.ofMinutes(5), "closed");

            AdmissionDecision decision = evaluate(healthy().open(false).build());

            assertThat(decision.failedCondition()).isEqualTo(GateCondition.NO_LOCKED_ACCOUNTS);
        }

        @Test
        @DisplayName("Market data is not fetched when an earlier condition fails")
        void lazySnapshot() {
            harness.cooldownTracker.startCooldown(PAIR, Duration.ofMinutes(5), "closed");

            evaluate();

            assertThat(snapshotCalls).hasValue(0);
        }

        @Test
        @DisplayName("Checks run in condition order whatever order they are registered in")
        void sortsChecks() {
            List<GateCondition> seen = new ArrayList<>();
            List<AdmissionCheck> checks = new ArrayList<>();
            for (GateCondition condition : List.of(GateCondition.MARKET_CONDITIONS, GateCondition.NO_COOLDOWN,
                    GateCondition.NO_OPENING_HEDGE, GateCondition.RISK_CLEAR)) {
                checks.add(new RecordingCheck(condition, seen, condition == GateCondition.NO_COOLDOWN));
            }
            AdmissionGate gate = new AdmissionGate(checks, harness.accountRegistry, new AccountSelector(),
                    harness.clock);

            AdmissionDecision decision = gate.evaluate(harness.pair(PAIR), List.of(), () -> null);

            assertThat(seen).containsExactly(GateCondition.NO_OPENING_HEDGE, GateCondition.RISK_CLEAR,
                    GateCondition.NO_COOLDOWN);
            assertThat(decision.failedCondition()).isEqualTo(GateCondition.NO_COOLDOWN);
            assertThat(gate.getChecks()).extracting(AdmissionCheck::condition).containsExactly(
                    GateCondition.NO_OPENING_HEDGE, GateCondition.RISK_CLEAR, GateCondition.NO_COOLDOWN,
                    GateCondition.MARKET_CONDITIONS);
        }
    }

    private static class RecordingCheck implements AdmissionCheck {

        private final GateCondition condition;
        private final List<GateCondition> seen;
        private final boolean fail;

        RecordingCheck(GateCondition condition, List<GateCondition> seen, boolean fail) {
            this.condition = condition;
            this.seen = seen;
            this.fail = fail;
        }

        @Override
        public GateCondition condition() {
            return condition;
        }

        @Override
        public CheckResult check(AdmissionContext context) {
            seen.add(condition);
            return fail ? CheckResult.fail("scripted") : CheckResult.pass();
        }
    }
}
