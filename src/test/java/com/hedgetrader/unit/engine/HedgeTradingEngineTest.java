package com.hedgetrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.core.coordinator.PositionCoordinator;
import com.hedgetrader.core.engine.HedgeTradingEngine;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.risk.KillSwitchResult;
import com.hedgetrader.risk.KillSwitchService;
import com.hedgetrader.risk.RiskManager;
import com.hedgetrader.support.TestFixtures;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Unit tests for HedgeTradingEngine covering the per-pair tick fan-out, isolation of pair
 * failures and the start/stop controls.
 */
@ExtendWith(MockitoExtension.class)
class HedgeTradingEngineTest {

    @Mock
    private PositionCoordinator positionCoordinator;

    @Mock
    private RiskManager riskManager;

    @Mock
    private KillSwitchService killSwitchService;

    private ThreadPoolTaskExecutor executor;
    private EngineProperties engineProperties;
    private TradingPair btc;
    private TradingPair eth;
    private TradingPair disabled;
    private HedgeTradingEngine engine;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("pair-eval-test-");
        executor.initialize();

        engineProperties = new EngineProperties();
        btc = TestFixtures.pair("btc-usd", 1, TestFixtures.ALICE, TestFixtures.BOB);
        eth = TestFixtures.pair("eth-usd", 1, TestFixtures.ALICE, TestFixtures.BOB);
        disabled = TestFixtures.pairBuilder("sol-usd", TestFixtures.ALICE, TestFixtures.BOB).enabled(false).build();
        TradingConfiguration configuration = new TradingConfiguration(
                List.of(TestFixtures.account(TestFixtures.ALICE, "1"), TestFixtures.account(TestFixtures.BOB, "1")),
                List.of(btc, eth, disabled));

        engine = new HedgeTradingEngine(configuration, positionCoordinator, riskManager, killSwitchService, executor,
                engineProperties, Clock.fixed(TestFixtures.START, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    // ==============================
    // TICK
    // ==============================

    @Nested
    @DisplayName("Tick")
    class Tick {

        @Test
        @DisplayName("Evaluates risk, then every enabled pair")
        void evaluatesEnabledPairs() {
            engine.tick();

            verify(riskManager).evaluate();
            verify(positionCoordinator).evaluatePair(btc);
            verify(positionCoordinator).evaluatePair(eth);
            verify(positionCoordinator, never()).evaluatePair(disabled);
            assertThat(engine.getTickCount()).isEqualTo(1);
            assertThat(engine.getLastTickAt()).isEqualTo(TestFixtures.START);
        }

        @Test
        @DisplayName("A failing pair does not stop the others")
        void pairFailureIsolated() {
            lenient().when(positionCoordinator.evaluatePair(btc)).thenThrow(new IllegalStateException("boom"));

            engine.tick();

            verify(positionCoordinator).evaluatePair(eth);
        }

        @Test
        @DisplayName("A failing risk evaluation does not skip the pairs")
        void riskFailureIsolated() {
            doThrow(new IllegalStateException("boom")).when(riskManager).evaluate();

            engine.tick();

            verify(positionCoordinator).evaluatePair(btc);
            verify(positionCoordinator).evaluatePair(eth);
        }

        @Test
        @DisplayName("Scheduled tick is skipped while not running")
        void scheduledTickWhenStopped() {
            engine.scheduledTick();

            verifyNoInteractions(positionCoordinator, riskManager);
        }
    }

    // ==============================
    // CONTROL
    // ==============================

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        @DisplayName("Start releases a kill switch left by a previous stop")
        void startReleasesKillSwitch() {
            when(killSwitchService.isActive()).thenReturn(true);

            engine.start();

            verify(killSwitchService).deactivate();
            assertThat(engine.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Stop halts ticking and trips the kill switch")
        void stopTripsKillSwitch() {
            KillSwitchResult result = KillSwitchResult.builder().success(true).hedgesClosing(2).build();
            when(killSwitchService.activate("Operator stop", true)).thenReturn(result);
            engine.start();

            assertThat(engine.stop(true)).isSameAs(result);
            assertThat(engine.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Auto-start can be disabled")
        void autoStartDisabled() {
            engineProperties.setAutoStart(false);

            engine.onApplicationReady();

            assertThat(engine.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Pause stops ticking without touching risk state")
        void pause() {
            engine.start();

            engine.pause();

            assertThat(engine.isRunning()).isFalse();
            verify(killSwitchService, never()).activate("Operator stop", false);
        }
    }
}
