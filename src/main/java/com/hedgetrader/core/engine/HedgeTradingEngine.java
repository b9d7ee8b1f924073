package com.hedgetrader.core.engine;

import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.config.TradingConfiguration;
import com.hedgetrader.core.coordinator.PositionCoordinator;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.risk.KillSwitchResult;
import com.hedgetrader.risk.KillSwitchService;
import com.hedgetrader.risk.RiskManager;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Monitoring loop and control entry points.
 *
 * <p>Each tick re-evaluates risk, then runs one task per enabled pair on the
 * {@code pairEvaluationExecutor}. Pairs are independent: a failure evaluating one pair is
 * logged and never stops the others or the next tick. The tick waits for all pair tasks so
 * ticks never overlap.
 *
 * <p>{@link #stop(boolean)} pauses the loop and trips the kill switch, which halts all
 * admissions immediately and optionally closes every hedge. {@link #start()} resumes the
 * loop and releases a kill switch left by a previous stop.
 */
@Component
public class HedgeTradingEngine {

    private static final Logger log = LoggerFactory.getLogger(HedgeTradingEngine.class);

    private final TradingConfiguration tradingConfiguration;
    private final PositionCoordinator positionCoordinator;
    private final RiskManager riskManager;
    private final KillSwitchService killSwitchService;
    private final ThreadPoolTaskExecutor pairEvaluationExecutor;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private volatile Instant lastTickAt;

    public HedgeTradingEngine(
            TradingConfiguration tradingConfiguration,
            PositionCoordinator positionCoordinator,
            RiskManager riskManager,
            KillSwitchService killSwitchService,
            @Qualifier("pairEvaluationExecutor") ThreadPoolTaskExecutor pairEvaluationExecutor,
            EngineProperties engineProperties,
            Clock clock) {
        this.tradingConfiguration = tradingConfiguration;
        this.positionCoordinator = positionCoordinator;
        this.riskManager = riskManager;
        this.killSwitchService = killSwitchService;
        this.pairEvaluationExecutor = pairEvaluationExecutor;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (engineProperties.isAutoStart()) {
            start();
        } else {
            log.info("Auto-start disabled; engine waiting for start()");
        }
    }

    // ========================
    // CONTROL
    // ========================

    public void start() {
        if (killSwitchService.isActive()) {
            killSwitchService.deactivate();
        }
        if (running.compareAndSet(false, true)) {
            log.info("Engine started: {} enabled pairs, tick every {}ms",
                    tradingConfiguration.getEnabledPairs().size(), engineProperties.getMonitoringIntervalMs());
        }
    }

    /**
     * Stops ticking and halts all admissions.
     *
     * @param closePositions also drive every OPEN and OPENING hedge to closing
     */
    public KillSwitchResult stop(boolean closePositions) {
        running.set(false);
        KillSwitchResult result = killSwitchService.activate("Operator stop", closePositions);
        log.info("Engine stopped (close positions: {})", closePositions);
        return result;
    }

    /** Stops ticking without touching risk state or positions. Used on shutdown. */
    public void pause() {
        if (running.compareAndSet(true, false)) {
            log.info("Engine paused; open hedges left in place");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    // ========================
    // TICK
    // ========================

    @Scheduled(
            fixedDelayString = "${hedgetrader.engine.monitoring-interval-ms:5000}",
            initialDelayString = "${hedgetrader.engine.monitoring-interval-ms:5000}")
    public void scheduledTick() {
        if (running.get()) {
            tick();
        }
    }

    /** Runs one monitoring pass over all enabled pairs. */
    public void tick() {
        lastTickAt = clock.instant();
        long tick = tickCount.incrementAndGet();

        try {
            riskManager.evaluate();
        } catch (RuntimeException e) {
            log.error("Risk evaluation failed on tick {}", tick, e);
        }

        List<CompletableFuture<Void>> tasks = tradingConfiguration.getEnabledPairs().stream()
                .map(pair -> CompletableFuture.runAsync(() -> evaluatePair(pair), pairEvaluationExecutor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        log.debug("Tick {} complete ({} pairs)", tick, tasks.size());
    }

    private void evaluatePair(TradingPair pair) {
        try {
            positionCoordinator.evaluatePair(pair);
        } catch (RuntimeException e) {
            log.error("Evaluation of pair {} failed", pair.getId(), e);
        }
    }
}
