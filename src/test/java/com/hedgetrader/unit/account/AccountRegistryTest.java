package com.hedgetrader.unit.account;

import static com.hedgetrader.support.TestFixtures.ALICE;
import static com.hedgetrader.support.TestFixtures.BOB;
import static com.hedgetrader.support.TestFixtures.CAROL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hedgetrader.account.AccountRegistry;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.domain.enums.LockCause;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.exception.ReservationException;
import com.hedgetrader.exception.ResourceNotFoundException;
import com.hedgetrader.support.MutableClock;
import com.hedgetrader.support.TestFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AccountRegistry covering reservation and release, all-or-nothing
 * multi-account reservation, fill booking, locking and the daily counter reset.
 */
class AccountRegistryTest {

    private static final BigDecimal AMOUNT = new BigDecimal("100000");

    private MutableClock clock;
    private AccountRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.START);
        Account carol = TestFixtures.account(CAROL, "250000");
        carol.setMaxDailyTrades(1);
        registry = new AccountRegistry(new TradingConfiguration(
                List.of(TestFixtures.account(ALICE, "250000"), TestFixtures.account(BOB, "150000"), carol),
                List.of()), clock);
    }

    // ==============================
    // RESERVATION
    // ==============================

    @Nested
    @DisplayName("Reservation")
    class Reservation {

        @Test
        @DisplayName("Reserving records the owner and reduces available balance")
        void reserve() {
            registry.reserveForHedge(ALICE, "h1", "btc-usd", AMOUNT);

            Account alice = registry.getAccount(ALICE);
            assertThat(alice.getReservedByHedgeId()).isEqualTo("h1");
            assertThat(alice.getReservedForPairId()).isEqualTo("btc-usd");
            assertThat(alice.getAvailableBalance()).isEqualByComparingTo("150000");
        }

        @Test
        @DisplayName("Reserved account cannot be reserved again")
        void doubleReserve() {
            registry.reserveForHedge(ALICE, "h1", "btc-usd", AMOUNT);

            assertThatThrownBy(() -> registry.reserveForHedge(ALICE, "h2", "eth-usd", AMOUNT))
                    .isInstanceOf(ReservationException.class)
                    .hasMessageContaining("h1");
        }

        @Test
        @DisplayName("Locked, underfunded and exhausted accounts cannot be reserved")
        void rejectedReservations() {
            registry.lock(ALICE, LockCause.MANUAL, "operator");
            registry.recordFill(CAROL, BigDecimal.ZERO);

            assertThatThrownBy(() -> registry.reserveForHedge(ALICE, "h1", "p", AMOUNT))
                    .isInstanceOf(ReservationException.class);
            assertThatThrownBy(() -> registry.reserveForHedge(BOB, "h1", "p", new BigDecimal("150000.01")))
                    .isInstanceOf(ReservationException.class);
            assertThatThrownBy(() -> registry.reserveForHedge(CAROL, "h1", "p", AMOUNT))
                    .isInstanceOf(ReservationException.class);
        }

        @Test
        @DisplayName("Multi-account reservation changes nothing when one account fails")
        void reserveAllIsAtomic() {
            registry.lock(BOB, LockCause.MANUAL, "operator");

            assertThatThrownBy(() -> registry.reserveAll(List.of(ALICE, BOB), "h1", "p", AMOUNT))
                    .isInstanceOf(ReservationException.class);

            assertThat(registry.getAccount(ALICE).isReserved()).isFalse();
            assertThat(registry.getAccount(ALICE).getReserved()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Release only succeeds for the owning hedge")
        void releaseByOwner() {
            registry.reserveAll(List.of(ALICE, BOB), "h1", "p", AMOUNT);

            assertThat(registry.release(ALICE, "h2")).isFalse();
            assertThat(registry.release(ALICE, "h1")).isTrue();
            assertThat(registry.getAccount(ALICE).getAvailableBalance()).isEqualByComparingTo("250000");
            assertThat(registry.releaseAll("h1")).isEqualTo(1);
            assertThat(registry.getAccount(BOB).isReserved()).isFalse();
        }

        @Test
        @DisplayName("Concurrent reservations of overlapping accounts never share an account")
        void concurrentExclusivity() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                for (int round = 0; round < 50; round++) {
                    CountDownLatch start = new CountDownLatch(1);
                    AtomicInteger winners = new AtomicInteger();
                    CountDownLatch done = new CountDownLatch(8);
                    for (int t = 0; t < 8; t++) {
                        String hedgeId = "h-" + round + "-" + t;
                        executor.submit(() -> {
                            try {
                                start.await();
                                registry.reserveAll(List.of(ALICE, BOB), hedgeId, "p", AMOUNT);
                                winners.incrementAndGet();
                            } catch (ReservationException e) {
                                // lost the race
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            } finally {
                                done.countDown();
                            }
                        });
                    }
                    start.countDown();
                    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();

                    assertThat(winners).hasValue(1);
                    String owner = registry.getAccount(ALICE).getReservedByHedgeId();
                    assertThat(registry.getAccount(BOB).getReservedByHedgeId()).isEqualTo(owner);
                    registry.releaseAll(owner);
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    // ==============================
    // FILLS & DAILY RESET
    // ==============================

    @Nested
    @DisplayName("Fills and daily counters")
    class Fills {

        @Test
        @DisplayName("Loss adjusts balance, daily loss and trade count")
        void bookLoss() {
            registry.recordFill(ALICE, new BigDecimal("-750"));

            Account alice = registry.getAccount(ALICE);
            assertThat(alice.getBalance()).isEqualByComparingTo("249250");
            assertThat(alice.getDailyLoss()).isEqualByComparingTo("750");
            assertThat(alice.getDailyTrades()).isEqualTo(1);
            assertThat(registry.getTotalDailyLoss()).isEqualByComparingTo("750");
        }

        @Test
        @DisplayName("Profit never reduces the daily loss")
        void bookProfit() {
            registry.recordFill(ALICE, new BigDecimal("-100"));
            registry.recordFill(ALICE, new BigDecimal("300"));

            assertThat(registry.getAccount(ALICE).getDailyLoss()).isEqualByComparingTo("100");
            assertThat(registry.getAccount(ALICE).getBalance()).isEqualByComparingTo("250200");
        }

        @Test
        @DisplayName("Counters reset when the clock crosses into a new day")
        void dailyReset() {
            registry.recordFill(ALICE, new BigDecimal("-500"));

            clock.advance(Duration.ofHours(14));

            Account alice = registry.getAccount(ALICE);
            assertThat(alice.getDailyLoss()).isEqualByComparingTo("0");
            assertThat(alice.getDailyTrades()).isZero();
            assertThat(alice.getBalance()).isEqualByComparingTo("249500");
        }

        @Test
        @DisplayName("Active order count never goes negative")
        void activeOrders() {
            registry.incrementActiveOrders(ALICE);
            registry.decrementActiveOrders(ALICE);
            registry.decrementActiveOrders(ALICE);

            assertThat(registry.getAccount(ALICE).getActiveOrders()).isZero();
        }
    }

    // ==============================
    // LOCKING
    // ==============================

    @Nested
    @DisplayName("Locking")
    class Locking {

        @Test
        @DisplayName("First lock keeps its cause")
        void firstCauseWins() {
            assertThat(registry.lock(ALICE, LockCause.RISK_HALT, "daily loss")).isTrue();
            assertThat(registry.lock(ALICE, LockCause.MANUAL, "operator")).isFalse();

            assertThat(registry.getAccount(ALICE).getLockCause()).isEqualTo(LockCause.RISK_HALT);
        }

        @Test
        @DisplayName("Unlock by cause leaves other locks in place")
        void unlockByCause() {
            registry.lock(ALICE, LockCause.UNWIND_FAILED, "unwind");
            assertThat(registry.lockAll(LockCause.EMERGENCY_STOP, "stop")).isEqualTo(2);

            assertThat(registry.unlockAll(LockCause.EMERGENCY_STOP)).isEqualTo(2);

            assertThat(registry.getAccount(ALICE).isLocked()).isTrue();
            assertThat(registry.getAccount(BOB).isLocked()).isFalse();
            assertThat(registry.unlock(ALICE)).isTrue();
            assertThat(registry.getAccount(ALICE).getLockReason()).isNull();
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    @Test
    @DisplayName("Returned accounts are detached copies")
    void returnsCopies() {
        Account copy = registry.getAccount(ALICE);
        copy.setBalance(BigDecimal.ONE);

        assertThat(registry.getAccount(ALICE).getBalance()).isEqualByComparingTo("250000");
        assertThat(registry.getAccounts(List.of(BOB, "unknown", ALICE))).extracting(Account::getAddress)
                .containsExactly(BOB, ALICE);
    }

    @Test
    @DisplayName("Unknown address throws")
    void unknownAddress() {
        assertThatThrownBy(() -> registry.getAccount("0xNOPE")).isInstanceOf(ResourceNotFoundException.class);
    }
}
